package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExaminationStatistics {
    private Long patientId;
    private long totalExaminations;
    private long recentExaminations;
}
