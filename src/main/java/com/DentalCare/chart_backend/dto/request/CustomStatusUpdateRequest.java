package com.DentalCare.chart_backend.dto.request;

import com.DentalCare.chart_backend.enums.StatusCategory;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CustomStatusUpdateRequest {

    @Size(max = 255, message = "Display name must not exceed 255 characters")
    private String displayName;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Color must be a hex value like #A1B2C3")
    private String color;

    private StatusCategory category;
}
