package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitTotalResponse {
    private Long patientId;
    private Long examinationId;
    private long visitCount;
    private BigDecimal totalPaid;
}
