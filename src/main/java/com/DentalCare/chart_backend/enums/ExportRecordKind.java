package com.DentalCare.chart_backend.enums;

/**
 * Values of the {@code kind} discriminator column in the flat export.
 */
public enum ExportRecordKind {
    PATIENT("patient"),
    CUSTOM_STATUS("custom_status"),
    EXAMINATION("examination"),
    TOOTH_HISTORY("tooth_history"),
    VISIT("visit");

    private final String value;

    ExportRecordKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ExportRecordKind fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (ExportRecordKind kind : values()) {
            if (kind.value.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
