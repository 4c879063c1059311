package com.DentalCare.chart_backend.dto.response;

import com.DentalCare.chart_backend.enums.StatusCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusDescriptor {
    private String code;
    private String displayName;
    private String color;
    private StatusCategory category;
    private boolean builtIn;
    private boolean active;
}
