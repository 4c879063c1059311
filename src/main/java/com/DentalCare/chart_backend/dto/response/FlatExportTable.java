package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All record kinds in one column set. Each row holds only the columns its
 * kind uses; the rest render blank.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlatExportTable {

    private List<String> columns;

    @Builder.Default
    private List<Map<String, String>> rows = new ArrayList<>();

    public Map<String, String> addRow() {
        Map<String, String> row = new LinkedHashMap<>();
        rows.add(row);
        return row;
    }

    public String cell(int rowIndex, String column) {
        String value = rows.get(rowIndex).get(column);
        return value == null ? "" : value;
    }

    public int size() {
        return rows.size();
    }
}
