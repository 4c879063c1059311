package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.request.CustomStatusRequest;
import com.DentalCare.chart_backend.dto.request.ExaminationRequest;
import com.DentalCare.chart_backend.dto.request.ImportRow;
import com.DentalCare.chart_backend.dto.request.PatientRequest;
import com.DentalCare.chart_backend.dto.request.VisitRecordRequest;
import com.DentalCare.chart_backend.dto.response.FlatExportTable;
import com.DentalCare.chart_backend.dto.response.ImportResult;
import com.DentalCare.chart_backend.dto.response.ImportRowError;
import com.DentalCare.chart_backend.enums.ExportRecordKind;
import com.DentalCare.chart_backend.enums.RecordType;
import com.DentalCare.chart_backend.enums.StatusCategory;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.model.CustomStatus;
import com.DentalCare.chart_backend.model.Examination;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.model.Patient;
import com.DentalCare.chart_backend.model.ToothHistoryEntry;
import com.DentalCare.chart_backend.model.VisitRecord;
import com.DentalCare.chart_backend.repository.ExaminationRepository;
import com.DentalCare.chart_backend.repository.PatientRepository;
import com.DentalCare.chart_backend.util.Constants;
import com.DentalCare.chart_backend.util.ExportColumns;
import com.DentalCare.chart_backend.util.FlatExportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Moves whole patient records in and out as one flat table, keyed by phone number.
 * <p>
 * Import is not one transaction: each row commits on its own so that a bad row
 * is reported and the rest still land.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataTransferService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern(Constants.EXPORT_DATE_FORMAT);
    private static final Pattern LIST_SPLITTER = Pattern.compile(Pattern.quote(Constants.LIST_SEPARATOR));

    private final PatientRepository patientRepository;
    private final ExaminationRepository examinationRepository;
    private final PatientService patientService;
    private final ExaminationService examinationService;
    private final ToothHistoryService toothHistoryService;
    private final VisitRecordService visitRecordService;
    private final StatusRegistryService statusRegistryService;
    private final PlatformTransactionManager transactionManager;

    // ---------------------------------------------------------------- export

    @Transactional(readOnly = true)
    public FlatExportTable exportFlat(Long patientId) {
        Patient patient = patientService.getPatient(patientId);
        FlatExportTable table = newTable();
        appendPatient(table, patient, new LinkedHashSet<>());
        log.info("Exported {} rows for patient {}", table.size(), patient.getPatientCode());
        return table;
    }

    @Transactional(readOnly = true)
    public FlatExportTable exportAll() {
        FlatExportTable table = newTable();
        Set<String> exportedStatuses = new LinkedHashSet<>();
        List<Patient> patients = patientRepository.findAll(Sort.by(Sort.Direction.ASC, "id"));
        for (Patient patient : patients) {
            appendPatient(table, patient, exportedStatuses);
        }
        log.info("Exported {} rows for {} patients", table.size(), patients.size());
        return table;
    }

    public byte[] exportPatientCsv(Long patientId) {
        return FlatExportWriter.toCsv(exportFlat(patientId));
    }

    public byte[] exportPatientXlsx(Long patientId) {
        return FlatExportWriter.toXlsx(exportFlat(patientId));
    }

    public byte[] exportAllCsv() {
        return FlatExportWriter.toCsv(exportAll());
    }

    public byte[] exportAllXlsx() {
        return FlatExportWriter.toXlsx(exportAll());
    }

    private FlatExportTable newTable() {
        return FlatExportTable.builder()
                .columns(ExportColumns.ALL)
                .build();
    }

    private void appendPatient(FlatExportTable table, Patient patient, Set<String> exportedStatuses) {
        String phone = patient.getPhoneNumber();

        Map<String, String> patientRow = table.addRow();
        patientRow.put(ExportColumns.KIND, ExportRecordKind.PATIENT.getValue());
        patientRow.put(ExportColumns.PHONE_NUMBER, phone);
        patientRow.put(ExportColumns.PATIENT_CODE, patient.getPatientCode());
        patientRow.put(ExportColumns.FULL_NAME, patient.getFullName());
        patientRow.put(ExportColumns.EMAIL, nullToEmpty(patient.getEmail()));
        patientRow.put(ExportColumns.ADDRESS, nullToEmpty(patient.getAddress()));
        patientRow.put(ExportColumns.DATE_OF_BIRTH, formatDate(patient.getDateOfBirth()));

        List<Examination> examinations =
                examinationRepository.findByPatientIdOrderByExaminationDateAscIdAsc(patient.getId());

        Map<Long, List<ToothHistoryEntry>> entriesByExamination = new LinkedHashMap<>();
        Set<String> usedCodes = new LinkedHashSet<>();
        for (Examination examination : examinations) {
            List<ToothHistoryEntry> entries = toothHistoryService.listForExamination(
                    LedgerScope.of(patient.getId(), examination.getId()));
            entriesByExamination.put(examination.getId(), entries);
            entries.forEach(entry -> usedCodes.addAll(entry.getStatuses()));
        }

        // Custom codes go out ahead of the rows that use them
        for (String code : usedCodes) {
            if (exportedStatuses.contains(code)) {
                continue;
            }
            Optional<CustomStatus> customStatus = statusRegistryService.findCustomStatus(code);
            if (customStatus.isEmpty()) {
                continue;
            }
            exportedStatuses.add(code);
            CustomStatus status = customStatus.get();
            Map<String, String> row = table.addRow();
            row.put(ExportColumns.KIND, ExportRecordKind.CUSTOM_STATUS.getValue());
            row.put(ExportColumns.PHONE_NUMBER, phone);
            row.put(ExportColumns.STATUS_CODE, status.getCode());
            row.put(ExportColumns.DISPLAY_NAME, status.getDisplayName());
            row.put(ExportColumns.COLOR, status.getColor());
            row.put(ExportColumns.CATEGORY, status.getCategory().name());
            row.put(ExportColumns.ACTIVE, String.valueOf(status.isActive()));
        }

        for (Examination examination : examinations) {
            String ref = String.valueOf(examination.getId());

            Map<String, String> examRow = table.addRow();
            examRow.put(ExportColumns.KIND, ExportRecordKind.EXAMINATION.getValue());
            examRow.put(ExportColumns.PHONE_NUMBER, phone);
            examRow.put(ExportColumns.EXAMINATION_REF, ref);
            examRow.put(ExportColumns.EXAMINATION_DATE, formatDate(examination.getExaminationDate()));
            examRow.put(ExportColumns.CHIEF_COMPLAINT, nullToEmpty(examination.getChiefComplaint()));
            examRow.put(ExportColumns.FINDINGS, nullToEmpty(examination.getFindings()));
            examRow.put(ExportColumns.DIAGNOSIS, nullToEmpty(examination.getDiagnosis()));
            examRow.put(ExportColumns.TREATMENT_PLAN, nullToEmpty(examination.getTreatmentPlan()));
            examRow.put(ExportColumns.NOTES, nullToEmpty(examination.getNotes()));

            for (ToothHistoryEntry entry : entriesByExamination.get(examination.getId())) {
                Map<String, String> row = table.addRow();
                row.put(ExportColumns.KIND, ExportRecordKind.TOOTH_HISTORY.getValue());
                row.put(ExportColumns.PHONE_NUMBER, phone);
                row.put(ExportColumns.EXAMINATION_REF, ref);
                row.put(ExportColumns.TOOTH_NUMBER, String.valueOf(entry.getToothNumber()));
                row.put(ExportColumns.RECORD_TYPE, entry.getRecordType().getValue());
                row.put(ExportColumns.STATUSES, String.join(Constants.LIST_SEPARATOR, entry.getStatuses()));
                row.put(ExportColumns.DESCRIPTION, nullToEmpty(entry.getDescription()));
                row.put(ExportColumns.DATE_RECORDED, formatDate(entry.getDateRecorded()));
            }

            LedgerScope scope = LedgerScope.of(patient.getId(), examination.getId());
            for (VisitRecord visit : visitRecordService.listForExamination(scope)) {
                Map<String, String> row = table.addRow();
                row.put(ExportColumns.KIND, ExportRecordKind.VISIT.getValue());
                row.put(ExportColumns.PHONE_NUMBER, phone);
                row.put(ExportColumns.EXAMINATION_REF, ref);
                row.put(ExportColumns.VISIT_DATE, formatDate(visit.getVisitDate()));
                row.put(ExportColumns.AMOUNT_PAID, visit.getAmountPaid().toPlainString());
                row.put(ExportColumns.CHIEF_COMPLAINT, nullToEmpty(visit.getChiefComplaint()));
                row.put(ExportColumns.DIAGNOSIS, nullToEmpty(visit.getDiagnosis()));
                row.put(ExportColumns.TREATMENT_PERFORMED, nullToEmpty(visit.getTreatmentPerformed()));
                row.put(ExportColumns.ADVICE, nullToEmpty(visit.getAdvice()));
                row.put(ExportColumns.AFFECTED_TEETH, visit.getAffectedTeeth().stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(Constants.LIST_SEPARATOR)));
            }
        }
    }

    // ---------------------------------------------------------------- import

    public ImportResult importCsv(InputStream inputStream) {
        List<ImportRow> rows = FlatExportWriter.parseCsv(inputStream);
        log.info("Parsed {} rows from CSV import", rows.size());
        return importRows(rows);
    }

    /**
     * Imports rows grouped by phone number. Within a group, patient rows are
     * applied first, then custom statuses, examinations, tooth history and visits.
     */
    public ImportResult importRows(List<ImportRow> rows) {
        ImportResult result = new ImportResult();
        Map<String, List<ImportRow>> byPhone = new LinkedHashMap<>();

        for (ImportRow row : rows) {
            String phone = row.get(ExportColumns.PHONE_NUMBER);
            ExportRecordKind kind = ExportRecordKind.fromString(row.get(ExportColumns.KIND));
            if (phone.isEmpty()) {
                addError(result, row, "VALIDATION_ERROR", "phone_number is required");
            } else if (kind == null) {
                addError(result, row, "VALIDATION_ERROR", "Unknown kind '" + row.get(ExportColumns.KIND) + "'");
            } else {
                byPhone.computeIfAbsent(phone, k -> new ArrayList<>()).add(row);
            }
        }

        TransactionTemplate rowTransaction = new TransactionTemplate(transactionManager);
        rowTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        for (Map.Entry<String, List<ImportRow>> group : byPhone.entrySet()) {
            List<ImportRow> groupRows = new ArrayList<>(group.getValue());
            groupRows.sort(Comparator.comparing((ImportRow row) -> ExportRecordKind.fromString(row.get(ExportColumns.KIND))));

            ImportContext context = new ImportContext(group.getKey());
            patientService.findByPhoneNumber(group.getKey()).ifPresent(p -> context.patientId = p.getId());

            for (ImportRow row : groupRows) {
                try {
                    rowTransaction.executeWithoutResult(status -> importRow(row, context, result));
                } catch (ApiException e) {
                    log.warn("Import row {} rejected: {}", row.getRowNumber(), e.getMessage());
                    addError(result, row, e.getErrorCode(), e.getMessage());
                } catch (DataAccessException e) {
                    log.error("Import row {} failed to persist: {}", row.getRowNumber(), e.getMessage(), e);
                    addError(result, row, "PERSISTENCE_ERROR", Constants.ERROR_PERSISTENCE);
                } catch (RuntimeException e) {
                    log.error("Import row {} failed: {}", row.getRowNumber(), e.getMessage(), e);
                    addError(result, row, "IMPORT_ERROR", "Unexpected error: " + e.getMessage());
                }
            }
        }

        log.info("Import finished: {} created, {} updated, {} unchanged, {} examinations, {} teeth, {} visits, "
                        + "{} statuses, {} skipped, {} errors",
                result.getCreated(), result.getUpdated(), result.getUnchanged(), result.getExaminationsRestored(),
                result.getTeethRestored(), result.getVisitsRestored(), result.getStatusesRegistered(),
                result.getSkipped(), result.getErrors().size());
        return result;
    }

    private void importRow(ImportRow row, ImportContext context, ImportResult result) {
        ExportRecordKind kind = ExportRecordKind.fromString(row.get(ExportColumns.KIND));
        switch (kind) {
            case PATIENT -> importPatient(row, context, result);
            case CUSTOM_STATUS -> importCustomStatus(row, result);
            case EXAMINATION -> importExamination(row, context, result);
            case TOOTH_HISTORY -> importToothHistory(row, context, result);
            case VISIT -> importVisit(row, context, result);
        }
    }

    private void importPatient(ImportRow row, ImportContext context, ImportResult result) {
        PatientRequest request = PatientRequest.builder()
                .fullName(row.get(ExportColumns.FULL_NAME))
                .phoneNumber(context.phoneNumber)
                .email(row.get(ExportColumns.EMAIL))
                .address(row.get(ExportColumns.ADDRESS))
                .dateOfBirth(parseDate(row, ExportColumns.DATE_OF_BIRTH, false))
                .build();

        Optional<Patient> existing = patientService.findByPhoneNumber(context.phoneNumber);
        if (existing.isPresent()) {
            context.patientId = existing.get().getId();
            if (patientService.updateFields(existing.get(), request)) {
                result.setUpdated(result.getUpdated() + 1);
            } else {
                result.setUnchanged(result.getUnchanged() + 1);
            }
            return;
        }

        if (request.getFullName().isEmpty()) {
            throw ValidationException.forField("patient", ExportColumns.FULL_NAME,
                    "full_name is required to create a patient");
        }
        Patient patient = patientService.register(request);
        context.patientId = patient.getId();
        result.setCreated(result.getCreated() + 1);
    }

    private void importCustomStatus(ImportRow row, ImportResult result) {
        String code = row.get(ExportColumns.STATUS_CODE);
        if (code.isEmpty()) {
            throw ValidationException.forField("customStatus", ExportColumns.STATUS_CODE, "status_code is required");
        }
        if (statusRegistryService.isKnown(code)) {
            result.setSkipped(result.getSkipped() + 1);
            return;
        }

        statusRegistryService.registerCustom(CustomStatusRequest.builder()
                .code(code)
                .displayName(row.has(ExportColumns.DISPLAY_NAME) ? row.get(ExportColumns.DISPLAY_NAME) : code)
                .color(row.has(ExportColumns.COLOR) ? row.get(ExportColumns.COLOR) : Constants.FALLBACK_STATUS_COLOR)
                .category(StatusCategory.fromString(row.get(ExportColumns.CATEGORY)))
                .build());
        if ("false".equalsIgnoreCase(row.get(ExportColumns.ACTIVE))) {
            statusRegistryService.deactivate(code);
        }
        result.setStatusesRegistered(result.getStatusesRegistered() + 1);
    }

    /**
     * Matches an existing examination only when every field is equal, and never
     * hands the same target examination to two refs of one import.
     */
    private void importExamination(ImportRow row, ImportContext context, ImportResult result) {
        Long patientId = context.requirePatient();
        String ref = row.get(ExportColumns.EXAMINATION_REF);
        if (!ref.isEmpty() && context.examinationRefs.containsKey(ref)) {
            result.setSkipped(result.getSkipped() + 1);
            return;
        }

        ExaminationRequest request = ExaminationRequest.builder()
                .examinationDate(parseDate(row, ExportColumns.EXAMINATION_DATE, true))
                .chiefComplaint(emptyToNull(row.get(ExportColumns.CHIEF_COMPLAINT)))
                .findings(emptyToNull(row.get(ExportColumns.FINDINGS)))
                .diagnosis(emptyToNull(row.get(ExportColumns.DIAGNOSIS)))
                .treatmentPlan(emptyToNull(row.get(ExportColumns.TREATMENT_PLAN)))
                .notes(emptyToNull(row.get(ExportColumns.NOTES)))
                .build();

        Optional<Examination> match = examinationRepository
                .findByPatientIdAndExaminationDate(patientId, request.getExaminationDate()).stream()
                .filter(e -> !context.claimedExaminations.contains(e.getId()))
                .filter(e -> sameExamination(e, request))
                .min(Comparator.comparing(Examination::getId));

        Examination examination;
        if (match.isPresent()) {
            examination = match.get();
            result.setSkipped(result.getSkipped() + 1);
        } else {
            examination = examinationService.create(patientId, request);
            context.createdExaminations.add(examination.getId());
            result.setExaminationsRestored(result.getExaminationsRestored() + 1);
        }

        context.claimedExaminations.add(examination.getId());
        if (!ref.isEmpty()) {
            context.examinationRefs.put(ref, examination.getId());
        }
    }

    private void importToothHistory(ImportRow row, ImportContext context, ImportResult result) {
        LedgerScope scope = context.scopeFor(row, examinationService);
        Integer toothNumber = parseInteger(row, ExportColumns.TOOTH_NUMBER);
        RecordType recordType = RecordType.fromString(row.get(ExportColumns.RECORD_TYPE));
        if (recordType == null) {
            throw ValidationException.forField("toothHistory", ExportColumns.RECORD_TYPE,
                    "record_type must be patient_problem or doctor_finding");
        }
        List<String> statuses = splitList(row.get(ExportColumns.STATUSES));
        String description = row.get(ExportColumns.DESCRIPTION);
        LocalDate dateRecorded = parseDate(row, ExportColumns.DATE_RECORDED, false);

        // Each entry present before the import absorbs at most one identical row
        List<ToothHistoryEntry> existing = context.existingEntries(scope, toothHistoryService);
        Optional<ToothHistoryEntry> duplicate = existing.stream()
                .filter(entry -> Objects.equals(entry.getToothNumber(), toothNumber)
                        && entry.getRecordType() == recordType
                        && entry.getStatuses().equals(lowerCase(statuses))
                        && Objects.equals(nullToEmpty(entry.getDescription()), description)
                        && (dateRecorded == null || dateRecorded.equals(entry.getDateRecorded())))
                .findFirst();
        if (duplicate.isPresent()) {
            existing.remove(duplicate.get());
            result.setSkipped(result.getSkipped() + 1);
            return;
        }

        toothHistoryService.restore(scope, toothNumber, recordType, statuses, description, dateRecorded);
        result.setTeethRestored(result.getTeethRestored() + 1);
    }

    private void importVisit(ImportRow row, ImportContext context, ImportResult result) {
        LedgerScope scope = context.scopeFor(row, examinationService);
        VisitRecordRequest request = VisitRecordRequest.builder()
                .visitDate(parseDate(row, ExportColumns.VISIT_DATE, true))
                .amountPaid(parseAmount(row))
                .chiefComplaint(emptyToNull(row.get(ExportColumns.CHIEF_COMPLAINT)))
                .diagnosis(emptyToNull(row.get(ExportColumns.DIAGNOSIS)))
                .treatmentPerformed(emptyToNull(row.get(ExportColumns.TREATMENT_PERFORMED)))
                .advice(emptyToNull(row.get(ExportColumns.ADVICE)))
                .affectedTeeth(splitList(row.get(ExportColumns.AFFECTED_TEETH)).stream()
                        .map(value -> parseTooth(value, row))
                        .collect(Collectors.toList()))
                .build();

        List<VisitRecord> existing = context.existingVisits(scope, visitRecordService);
        Optional<VisitRecord> duplicate = existing.stream()
                .filter(visit -> sameVisit(visit, request))
                .findFirst();
        if (duplicate.isPresent()) {
            existing.remove(duplicate.get());
            result.setSkipped(result.getSkipped() + 1);
            return;
        }

        visitRecordService.restore(scope, request);
        result.setVisitsRestored(result.getVisitsRestored() + 1);
    }

    private static boolean sameExamination(Examination examination, ExaminationRequest request) {
        return Objects.equals(emptyToNull(examination.getChiefComplaint()), request.getChiefComplaint())
                && Objects.equals(emptyToNull(examination.getFindings()), request.getFindings())
                && Objects.equals(emptyToNull(examination.getDiagnosis()), request.getDiagnosis())
                && Objects.equals(emptyToNull(examination.getTreatmentPlan()), request.getTreatmentPlan())
                && Objects.equals(emptyToNull(examination.getNotes()), request.getNotes());
    }

    private static boolean sameVisit(VisitRecord visit, VisitRecordRequest request) {
        return visit.getVisitDate().equals(request.getVisitDate())
                && visit.getAmountPaid().compareTo(request.getAmountPaid()) == 0
                && Objects.equals(visit.getChiefComplaint(), request.getChiefComplaint())
                && Objects.equals(visit.getDiagnosis(), request.getDiagnosis())
                && Objects.equals(visit.getTreatmentPerformed(), request.getTreatmentPerformed())
                && Objects.equals(visit.getAdvice(), request.getAdvice())
                && visit.getAffectedTeeth().stream().sorted().collect(Collectors.toList())
                        .equals(request.getAffectedTeeth().stream().sorted().distinct().collect(Collectors.toList()));
    }

    private static void addError(ImportResult result, ImportRow row, String errorCode, String message) {
        result.getErrors().add(ImportRowError.builder()
                .rowNumber(row.getRowNumber())
                .phoneNumber(row.get(ExportColumns.PHONE_NUMBER))
                .kind(row.get(ExportColumns.KIND))
                .errorCode(errorCode)
                .message(message)
                .build());
    }

    private static LocalDate parseDate(ImportRow row, String column, boolean required) {
        if (!row.has(column)) {
            if (required) {
                throw ValidationException.forField("row", column, column + " is required");
            }
            return null;
        }
        try {
            return LocalDate.parse(row.get(column), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw ValidationException.forField("row", column,
                    String.format("%s '%s' is not a date (%s)", column, row.get(column), Constants.EXPORT_DATE_FORMAT));
        }
    }

    private static Integer parseInteger(ImportRow row, String column) {
        try {
            return Integer.valueOf(row.get(column));
        } catch (NumberFormatException e) {
            throw ValidationException.forField("row", column,
                    String.format("%s '%s' is not a number", column, row.get(column)));
        }
    }

    private static Integer parseTooth(String value, ImportRow row) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw ValidationException.forField("row", ExportColumns.AFFECTED_TEETH,
                    String.format("Row %d: tooth '%s' is not a number", row.getRowNumber(), value));
        }
    }

    private static BigDecimal parseAmount(ImportRow row) {
        if (!row.has(ExportColumns.AMOUNT_PAID)) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(row.get(ExportColumns.AMOUNT_PAID));
        } catch (NumberFormatException e) {
            throw ValidationException.forField("row", ExportColumns.AMOUNT_PAID,
                    String.format("amount_paid '%s' is not a number", row.get(ExportColumns.AMOUNT_PAID)));
        }
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return new ArrayList<>();
        }
        return LIST_SPLITTER.splitAsStream(value)
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<String> lowerCase(List<String> codes) {
        return codes.stream()
                .map(code -> code.toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toList());
    }

    private static String formatDate(LocalDate date) {
        return date == null ? "" : date.format(DATE_FORMAT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Per-phone state carried across the rows of one group.
     */
    private static class ImportContext {
        private final String phoneNumber;
        private final Map<String, Long> examinationRefs = new HashMap<>();
        private final Set<Long> claimedExaminations = new HashSet<>();
        private final Set<Long> createdExaminations = new HashSet<>();
        private final Map<Long, List<ToothHistoryEntry>> entriesBeforeImport = new HashMap<>();
        private final Map<Long, List<VisitRecord>> visitsBeforeImport = new HashMap<>();
        private Long patientId;

        ImportContext(String phoneNumber) {
            this.phoneNumber = phoneNumber;
        }

        Long requirePatient() {
            if (patientId == null) {
                throw ValidationException.forField("row", ExportColumns.PHONE_NUMBER,
                        "No patient with phone number " + phoneNumber + " exists or was imported");
            }
            return patientId;
        }

        /**
         * Entries the examination held before this import first wrote to it.
         * Callers remove the ones they match, so the list shrinks as rows are skipped.
         */
        List<ToothHistoryEntry> existingEntries(LedgerScope scope, ToothHistoryService toothHistoryService) {
            return entriesBeforeImport.computeIfAbsent(scope.getExaminationId(), id ->
                    createdExaminations.contains(id)
                            ? new ArrayList<>()
                            : new ArrayList<>(toothHistoryService.listForExamination(scope)));
        }

        List<VisitRecord> existingVisits(LedgerScope scope, VisitRecordService visitRecordService) {
            return visitsBeforeImport.computeIfAbsent(scope.getExaminationId(), id ->
                    createdExaminations.contains(id)
                            ? new ArrayList<>()
                            : new ArrayList<>(visitRecordService.listForExamination(scope)));
        }

        /**
         * Maps the exported examination_ref to the examination it was imported as.
         * Rows without a ref go to the patient's current examination.
         */
        LedgerScope scopeFor(ImportRow row, ExaminationService examinationService) {
            Long id = requirePatient();
            String ref = row.get(ExportColumns.EXAMINATION_REF);
            if (ref.isEmpty()) {
                return examinationService.resolveScope(id, null);
            }
            Long examinationId = examinationRefs.get(ref);
            if (examinationId == null) {
                throw ValidationException.forField("row", ExportColumns.EXAMINATION_REF,
                        "examination_ref " + ref + " does not match an imported examination");
            }
            return LedgerScope.of(id, examinationId);
        }
    }
}
