package com.DentalCare.chart_backend.dto.response;

import com.DentalCare.chart_backend.enums.RecordType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Current statuses of one tooth in one stream of one examination.
 * {@code defaulted} is true when no entry exists and the tooth reads as normal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentToothStatus {
    private Long examinationId;
    private Integer toothNumber;
    private RecordType recordType;
    private List<String> statuses;
    private Long entryId;
    private LocalDate dateRecorded;
    private boolean defaulted;
    private long entryCount;
}
