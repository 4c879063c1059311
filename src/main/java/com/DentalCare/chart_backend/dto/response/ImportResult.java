package com.DentalCare.chart_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {
    private int created;
    private int updated;
    private int unchanged;
    private int examinationsRestored;
    private int teethRestored;
    private int visitsRestored;
    private int statusesRegistered;
    private int skipped;

    @Builder.Default
    private List<ImportRowError> errors = new ArrayList<>();

    // At least one patient row was applied; row errors may still be present
    public boolean isSuccess() {
        return created + updated + unchanged > 0;
    }
}
