package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToothHistoryStatistics {
    private Long patientId;
    private long totalRecords;
    private long patientProblems;
    private long doctorFindings;
    private long recentRecords;
}
