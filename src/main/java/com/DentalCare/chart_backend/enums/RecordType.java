package com.DentalCare.chart_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two independent observation streams kept per tooth.
 */
public enum RecordType {
    PATIENT_PROBLEM("patient_problem"),
    DOCTOR_FINDING("doctor_finding");

    private final String value;

    RecordType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the stored form ({@code patient_problem}) as well as the enum name.
     * Returns null for anything else so callers can report a validation error.
     */
    @JsonCreator
    public static RecordType fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (RecordType type : values()) {
            if (type.value.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
