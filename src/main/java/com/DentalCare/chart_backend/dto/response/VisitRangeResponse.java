package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Visits of one patient or one date range with their summed payments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRangeResponse {
    private List<VisitRecordResponse> visits;
    private long visitCount;
    private BigDecimal totalPaid;
}
