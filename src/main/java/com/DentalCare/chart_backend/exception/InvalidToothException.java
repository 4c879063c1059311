package com.DentalCare.chart_backend.exception;

import org.springframework.validation.FieldError;

import java.util.List;

public class InvalidToothException extends ValidationException {
    public InvalidToothException(Integer toothNumber) {
        super(String.format("Invalid tooth number %s. Expected an FDI code 11-18, 21-28, 31-38 or 41-48",
                        toothNumber),
                List.of(new FieldError("tooth", "toothNumber", String.valueOf(toothNumber))),
                "INVALID_TOOTH");
    }
}
