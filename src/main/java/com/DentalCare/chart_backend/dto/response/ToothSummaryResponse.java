package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToothSummaryResponse {
    private Long patientId;
    private Long examinationId;
    private List<ToothSummaryItem> teeth;

    /**
     * Both streams for one tooth, reported side by side and never combined.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToothSummaryItem {
        private Integer toothNumber;
        private CurrentToothStatus patientProblem;
        private CurrentToothStatus doctorFinding;
        private List<StatusDescriptor> patientProblemStatuses;
        private List<StatusDescriptor> doctorFindingStatuses;
    }
}
