package com.DentalCare.chart_backend.model;

import lombok.NonNull;
import lombok.Value;

/**
 * The (patient, examination) pair every ledger read and write is confined to.
 * Obtain one from {@code ExaminationService.resolveScope} so the examination is
 * known to belong to the patient.
 */
@Value(staticConstructor = "of")
public class LedgerScope {
    @NonNull
    Long patientId;
    @NonNull
    Long examinationId;
}
