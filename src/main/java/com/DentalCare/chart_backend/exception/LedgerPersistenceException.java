package com.DentalCare.chart_backend.exception;

import com.DentalCare.chart_backend.util.Constants;
import org.springframework.http.HttpStatus;

/**
 * Storage failure inside a ledger write. Thrown from a transactional method so
 * the whole unit of work is rolled back.
 */
public class LedgerPersistenceException extends ApiException {
    public LedgerPersistenceException(String operation, Throwable cause) {
        super(Constants.ERROR_PERSISTENCE + ": " + operation,
                HttpStatus.INTERNAL_SERVER_ERROR,
                "PERSISTENCE_ERROR",
                cause);
    }
}
