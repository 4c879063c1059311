package com.DentalCare.chart_backend.dto.response;

import com.DentalCare.chart_backend.enums.RecordType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToothHistoryEntryResponse {
    private Long id;
    private Long patientId;
    private Long examinationId;
    private Integer toothNumber;
    private RecordType recordType;
    private List<String> statuses;
    private String description;
    private LocalDate dateRecorded;
    private LocalDateTime createdAt;
}
