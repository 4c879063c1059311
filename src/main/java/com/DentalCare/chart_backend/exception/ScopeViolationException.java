package com.DentalCare.chart_backend.exception;

import org.springframework.http.HttpStatus;

public class ScopeViolationException extends ApiException {
    public ScopeViolationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "SCOPE_VIOLATION");
    }
}
