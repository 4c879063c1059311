package com.DentalCare.chart_backend.dto.response;

import com.DentalCare.chart_backend.enums.StatusCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusGroup {
    private StatusCategory category;
    private String label;
    private List<StatusDescriptor> statuses;
}
