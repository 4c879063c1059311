package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRecordResponse {
    private Long id;
    private Long patientId;
    private Long examinationId;
    private LocalDate visitDate;
    private BigDecimal amountPaid;
    private String chiefComplaint;
    private String diagnosis;
    private String treatmentPerformed;
    private String advice;
    private List<Integer> affectedTeeth;
    private LocalDateTime createdAt;

    // Doctor finding entries appended alongside this visit, if any
    @Builder.Default
    private List<Long> derivedEntryIds = new ArrayList<>();
}
