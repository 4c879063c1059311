package com.DentalCare.chart_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presentation grouping for status codes. Declaration order is the display order.
 */
public enum StatusCategory {
    HARD_TISSUE("Hard Tissue"),
    PULPAL_PERIAPICAL("Pulpal / Periapical"),
    PERIODONTAL("Periodontal"),
    SOFT_TISSUE("Soft Tissue"),
    OTHER("Other");

    private final String label;

    StatusCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static StatusCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return StatusCategory.valueOf(value.trim().toUpperCase().replaceAll("[^A-Z]+", "_"));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }
}
