package com.DentalCare.chart_backend.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parsed import line: column name to raw cell text, plus its 1-based
 * position in the source so errors can point back at it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportRow {

    private int rowNumber;
    private Map<String, String> values = new LinkedHashMap<>();

    /**
     * Trimmed value, or an empty string when the column is absent.
     */
    public String get(String column) {
        String value = values.get(column);
        return value == null ? "" : value.trim();
    }

    public boolean has(String column) {
        return !get(column).isEmpty();
    }
}
