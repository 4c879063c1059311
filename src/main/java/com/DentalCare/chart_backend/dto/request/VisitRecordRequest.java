package com.DentalCare.chart_backend.dto.request;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRecordRequest {

    @NotNull(message = "Visit date is required")
    private LocalDate visitDate;

    @NotNull(message = "Amount paid is required")
    @DecimalMin(value = "0.0", message = "Amount paid cannot be negative")
    private BigDecimal amountPaid;

    @Size(max = 4000, message = "Chief complaint must not exceed 4000 characters")
    private String chiefComplaint;

    @Size(max = 4000, message = "Diagnosis must not exceed 4000 characters")
    private String diagnosis;

    @Size(max = 4000, message = "Treatment performed must not exceed 4000 characters")
    private String treatmentPerformed;

    @Size(max = 4000, message = "Advice must not exceed 4000 characters")
    private String advice;

    private List<Integer> affectedTeeth;

    /**
     * Statuses for the doctor findings derived from this visit. Empty means the
     * configured default status.
     */
    private List<String> findingStatuses;
}
