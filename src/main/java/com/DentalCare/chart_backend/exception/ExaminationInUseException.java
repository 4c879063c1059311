package com.DentalCare.chart_backend.exception;

import org.springframework.http.HttpStatus;

public class ExaminationInUseException extends ApiException {
    public ExaminationInUseException(Long examinationId, long toothEntries, long visits) {
        super(String.format("Examination %d still has %d tooth history entries and %d visit records",
                        examinationId, toothEntries, visits),
                HttpStatus.CONFLICT,
                "EXAMINATION_IN_USE");
    }
}
