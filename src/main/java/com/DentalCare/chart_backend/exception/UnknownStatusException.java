package com.DentalCare.chart_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class UnknownStatusException extends ApiException {
    private final String code;

    public UnknownStatusException(String code) {
        super(String.format("Unknown or inactive status code: '%s'", code),
                HttpStatus.BAD_REQUEST,
                "UNKNOWN_STATUS");
        this.code = code;
    }
}
