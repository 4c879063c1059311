package com.DentalCare.chart_backend.dto.request;

import com.DentalCare.chart_backend.enums.StatusCategory;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomStatusRequest {

    @NotBlank(message = "Status code is required")
    @Size(max = 50, message = "Status code must not exceed 50 characters")
    private String code;

    @NotBlank(message = "Display name is required")
    @Size(max = 255, message = "Display name must not exceed 255 characters")
    private String displayName;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Color must be a hex value like #A1B2C3")
    private String color;

    private StatusCategory category;
}
