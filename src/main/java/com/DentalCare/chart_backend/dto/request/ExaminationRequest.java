package com.DentalCare.chart_backend.dto.request;

import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExaminationRequest {

    @PastOrPresent(message = "Examination date cannot be in the future")
    private LocalDate examinationDate;

    @Size(max = 4000, message = "Chief complaint must not exceed 4000 characters")
    private String chiefComplaint;

    @Size(max = 4000, message = "Findings must not exceed 4000 characters")
    private String findings;

    @Size(max = 4000, message = "Diagnosis must not exceed 4000 characters")
    private String diagnosis;

    @Size(max = 4000, message = "Treatment plan must not exceed 4000 characters")
    private String treatmentPlan;

    @Size(max = 4000, message = "Notes must not exceed 4000 characters")
    private String notes;
}
