package com.DentalCare.chart_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Status Constants
    public static final String DEFAULT_STATUS_CODE = "normal";
    public static final String FALLBACK_STATUS_COLOR = "#808080";
    public static final String COLOR_PATTERN = "^#[0-9A-Fa-f]{6}$";
    public static final String STATUS_CODE_PATTERN = "^[a-z][a-z0-9_]{1,49}$";

    // Tooth History Constants
    public static final int RECENT_RECORDS_DAYS = 30;

    // Patient Constants
    public static final String PATIENT_CODE_PREFIX = "P";
    public static final int PATIENT_CODE_DIGITS = 5; // e.g. P00001

    // Export Constants
    public static final String EXPORT_DATE_FORMAT = "yyyy-MM-dd";
    public static final String LIST_SEPARATOR = "|";
    public static final String EXPORT_SHEET_NAME = "Dental Records";

    // Error Messages
    public static final String ERROR_VALIDATION_FAILED = "Validation failed";
    public static final String ERROR_PERSISTENCE = "Failed to persist ledger changes";

    // Success Messages
    public static final String SUCCESS_RETRIEVED = "Retrieved successfully";
}
