package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitStatistics {
    private LocalDate startDate;
    private LocalDate endDate;
    private long visitCount;
    private long patientCount;
    private BigDecimal totalRevenue;
    private BigDecimal averagePerVisit;
}
