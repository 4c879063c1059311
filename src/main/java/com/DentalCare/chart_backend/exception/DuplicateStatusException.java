package com.DentalCare.chart_backend.exception;

import org.springframework.http.HttpStatus;

public class DuplicateStatusException extends ApiException {
    public DuplicateStatusException(String code, boolean builtIn) {
        super(String.format("Status code '%s' already exists as a %s status",
                        code, builtIn ? "built-in" : "custom"),
                HttpStatus.CONFLICT,
                "DUPLICATE_STATUS");
    }
}
