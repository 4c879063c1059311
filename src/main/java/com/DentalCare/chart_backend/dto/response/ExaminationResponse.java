package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExaminationResponse {
    private Long id;
    private Long patientId;
    private LocalDate examinationDate;
    private String chiefComplaint;
    private String findings;
    private String diagnosis;
    private String treatmentPlan;
    private String notes;
    private boolean current;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
