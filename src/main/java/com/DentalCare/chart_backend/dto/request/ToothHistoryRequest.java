package com.DentalCare.chart_backend.dto.request;

import com.DentalCare.chart_backend.enums.RecordType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToothHistoryRequest {

    @NotNull(message = "Record type is required (patient_problem or doctor_finding)")
    private RecordType recordType;

    @NotEmpty(message = "At least one status is required")
    private List<String> statuses;

    @Size(max = 4000, message = "Description must not exceed 4000 characters")
    private String description;
}
