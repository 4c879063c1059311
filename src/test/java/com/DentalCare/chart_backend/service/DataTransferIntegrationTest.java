package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.request.CustomStatusRequest;
import com.DentalCare.chart_backend.dto.request.ExaminationRequest;
import com.DentalCare.chart_backend.dto.request.ImportRow;
import com.DentalCare.chart_backend.dto.request.PatientRequest;
import com.DentalCare.chart_backend.dto.request.VisitRecordRequest;
import com.DentalCare.chart_backend.dto.response.FlatExportTable;
import com.DentalCare.chart_backend.dto.response.ImportResult;
import com.DentalCare.chart_backend.dto.response.ImportRowError;
import com.DentalCare.chart_backend.enums.RecordType;
import com.DentalCare.chart_backend.model.Examination;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.model.Patient;
import com.DentalCare.chart_backend.model.ToothHistoryEntry;
import com.DentalCare.chart_backend.model.VisitRecord;
import com.DentalCare.chart_backend.util.ExportColumns;
import com.DentalCare.chart_backend.util.FlatExportWriter;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Flat export and import")
class DataTransferIntegrationTest {

    private static final LocalDate EXAM_DATE = LocalDate.of(2024, 3, 4);
    private static final LocalDate RECORDED_ON = LocalDate.of(2024, 3, 5);

    @Autowired
    private DataTransferService dataTransferService;

    @Autowired
    private PatientService patientService;

    @Autowired
    private ExaminationService examinationService;

    @Autowired
    private ToothHistoryService toothHistoryService;

    @Autowired
    private VisitRecordService visitRecordService;

    @Autowired
    private StatusRegistryService statusRegistryService;

    private Patient patient;
    private LedgerScope scope;
    private String customCode;

    @BeforeEach
    void setUp() {
        patient = patientService.register(PatientRequest.builder()
                .fullName("Grace Wanjiku")
                .phoneNumber(ToothHistoryLedgerIntegrationTest.uniquePhone())
                .email("grace@example.com")
                .dateOfBirth(LocalDate.of(1990, 6, 1))
                .build());
        Examination examination = examinationService.create(patient.getId(), ExaminationRequest.builder()
                .examinationDate(EXAM_DATE)
                .chiefComplaint("Pain lower right")
                .diagnosis("Irreversible pulpitis 46")
                .build());
        scope = examinationService.resolveScope(patient.getId(), examination.getId());

        customCode = "veneer_" + UUID.randomUUID().toString().substring(0, 8);
        statusRegistryService.registerCustom(CustomStatusRequest.builder()
                .code(customCode)
                .displayName("Veneer")
                .color("#ffcc00")
                .build());

        toothHistoryService.restore(scope, 46, RecordType.PATIENT_PROBLEM,
                List.of("toothache", "sensitivity"), "Hurts with cold drinks", RECORDED_ON);
        toothHistoryService.restore(scope, 46, RecordType.DOCTOR_FINDING,
                List.of("pulpitis_irreversible"), "", RECORDED_ON);
        toothHistoryService.restore(scope, 11, RecordType.DOCTOR_FINDING,
                List.of(customCode), "Labial veneer", RECORDED_ON);
        visitRecordService.restore(scope, VisitRecordRequest.builder()
                .visitDate(RECORDED_ON)
                .amountPaid(new BigDecimal("4500.00"))
                .diagnosis("Irreversible pulpitis")
                .treatmentPerformed("Root canal, first stage")
                .affectedTeeth(List.of(46))
                .build());
    }

    @Test
    @DisplayName("exported CSV imports under a new phone number as an equivalent record")
    void csvRoundTripRecreatesRecord() {
        String newPhone = ToothHistoryLedgerIntegrationTest.uniquePhone();
        FlatExportTable table = dataTransferService.exportFlat(patient.getId());
        table.getRows().forEach(row -> row.put(ExportColumns.PHONE_NUMBER, newPhone));

        ImportResult result = dataTransferService.importCsv(new ByteArrayInputStream(FlatExportWriter.toCsv(table)));

        assertTrue(result.getErrors().isEmpty(), () -> "Unexpected errors: " + result.getErrors());
        assertEquals(1, result.getCreated());
        assertEquals(1, result.getExaminationsRestored());
        assertEquals(3, result.getTeethRestored());
        assertEquals(1, result.getVisitsRestored());

        Patient copy = patientService.findByPhoneNumber(newPhone).orElseThrow();
        assertNotEquals(patient.getId(), copy.getId());
        assertEquals("Grace Wanjiku", copy.getFullName());
        assertEquals(LocalDate.of(1990, 6, 1), copy.getDateOfBirth());

        LedgerScope copyScope = examinationService.resolveScope(copy.getId(), null);
        Examination copiedExam = examinationService.getById(copy.getId(), copyScope.getExaminationId());
        assertEquals(EXAM_DATE, copiedExam.getExaminationDate());
        assertEquals("Pain lower right", copiedExam.getChiefComplaint());

        List<ToothHistoryEntry> problems = toothHistoryService.history(copyScope, 46, RecordType.PATIENT_PROBLEM);
        assertEquals(1, problems.size());
        assertEquals(List.of("toothache", "sensitivity"), problems.get(0).getStatuses());
        assertEquals("Hurts with cold drinks", problems.get(0).getDescription());
        assertEquals(RECORDED_ON, problems.get(0).getDateRecorded());

        assertEquals(List.of(customCode),
                toothHistoryService.currentStatus(copyScope, 11, RecordType.DOCTOR_FINDING).getStatuses());

        // The visit comes back without deriving another finding on 46
        assertEquals(1, toothHistoryService.history(copyScope, 46, RecordType.DOCTOR_FINDING).size());
        List<VisitRecord> visits = visitRecordService.listForExamination(copyScope);
        assertEquals(1, visits.size());
        assertEquals(List.of(46), visits.get(0).getAffectedTeeth());
        assertEquals(0, new BigDecimal("4500.00").compareTo(visitRecordService.totalForExamination(copyScope)));
    }

    @Test
    @DisplayName("importing an unchanged export leaves the patient as is and skips every known row")
    void reimportIsIdempotent() {
        byte[] csv = dataTransferService.exportPatientCsv(patient.getId());

        ImportResult result = dataTransferService.importCsv(new ByteArrayInputStream(csv));

        assertTrue(result.getErrors().isEmpty(), () -> "Unexpected errors: " + result.getErrors());
        assertEquals(0, result.getCreated());
        assertEquals(0, result.getUpdated());
        assertEquals(1, result.getUnchanged());
        assertEquals(0, result.getExaminationsRestored());
        assertEquals(0, result.getTeethRestored());
        assertEquals(0, result.getVisitsRestored());
        // custom status, examination, three tooth rows, one visit
        assertEquals(6, result.getSkipped());
        assertEquals(1, examinationService.listForPatient(patient.getId()).size());
    }

    @Test
    @DisplayName("rows for an existing phone number are appended to that patient")
    void existingPhoneAppendsRows() {
        String ref = String.valueOf(scope.getExaminationId());
        List<ImportRow> rows = new ArrayList<>();
        rows.add(row(2, Map.of(
                ExportColumns.KIND, "patient",
                ExportColumns.FULL_NAME, "Grace W. Kamau",
                ExportColumns.ADDRESS, "Nakuru")));
        rows.add(row(3, Map.of(
                ExportColumns.KIND, "examination",
                ExportColumns.EXAMINATION_REF, ref,
                ExportColumns.EXAMINATION_DATE, EXAM_DATE.toString(),
                ExportColumns.CHIEF_COMPLAINT, "Pain lower right")));
        rows.add(row(4, Map.of(
                ExportColumns.KIND, "tooth_history",
                ExportColumns.EXAMINATION_REF, ref,
                ExportColumns.TOOTH_NUMBER, "46",
                ExportColumns.RECORD_TYPE, "doctor_finding",
                ExportColumns.STATUSES, "root_canal")));

        ImportResult first = dataTransferService.importRows(rows);

        assertTrue(first.getErrors().isEmpty(), () -> "Unexpected errors: " + first.getErrors());
        assertEquals(1, first.getUpdated());
        assertEquals(0, first.getCreated());
        assertEquals(1, first.getTeethRestored());

        Patient updated = patientService.getPatient(patient.getId());
        assertEquals("Grace W. Kamau", updated.getFullName());
        assertEquals("Nakuru", updated.getAddress());
        assertEquals(1, examinationService.listForPatient(patient.getId()).size());
        assertEquals(List.of("root_canal"),
                toothHistoryService.currentStatus(scope, 46, RecordType.DOCTOR_FINDING).getStatuses());
        assertEquals(2, toothHistoryService.history(scope, 46, RecordType.DOCTOR_FINDING).size());

        ImportResult second = dataTransferService.importRows(rows);

        assertEquals(0, second.getUpdated());
        assertEquals(1, second.getUnchanged());
        assertEquals(0, second.getTeethRestored());
        assertEquals(2, second.getSkipped());
        assertEquals(2, toothHistoryService.history(scope, 46, RecordType.DOCTOR_FINDING).size());
    }

    @Test
    @DisplayName("same-day examinations with the same complaint come back as separate examinations")
    void sameDayExaminationsStaySeparate() {
        Patient source = registerPatient("Lucy Atieno");
        LedgerScope first = examinationService.resolveScope(source.getId(), examinationService.create(
                source.getId(), examination("first")).getId());
        LedgerScope second = examinationService.resolveScope(source.getId(), examinationService.create(
                source.getId(), examination("second")).getId());
        toothHistoryService.record(first, 21, RecordType.DOCTOR_FINDING, List.of("missing"), "");

        Patient copy = importUnderNewPhone(source);

        List<Examination> copied = examinationService.listForPatient(copy.getId());
        assertEquals(2, copied.size());
        // newest first: the second examination is current
        assertEquals("second", copied.get(0).getFindings());
        assertEquals("first", copied.get(1).getFindings());
        LedgerScope copiedFirst = examinationService.resolveScope(copy.getId(), copied.get(1).getId());
        LedgerScope copiedSecond = examinationService.resolveScope(copy.getId(), copied.get(0).getId());

        assertEquals(List.of("missing"),
                toothHistoryService.currentStatus(copiedFirst, 21, RecordType.DOCTOR_FINDING).getStatuses());
        assertTrue(toothHistoryService.currentStatus(copiedSecond, 21, RecordType.DOCTOR_FINDING).isDefaulted());
        assertTrue(toothHistoryService.currentStatus(second, 21, RecordType.DOCTOR_FINDING).isDefaulted());
    }

    @Test
    @DisplayName("two examinations identical in every field are not merged on import")
    void identicalExaminationsStaySeparate() {
        Patient source = registerPatient("Samuel Odhiambo");
        LedgerScope first = examinationService.resolveScope(source.getId(), examinationService.create(
                source.getId(), examination("same")).getId());
        LedgerScope second = examinationService.resolveScope(source.getId(), examinationService.create(
                source.getId(), examination("same")).getId());
        toothHistoryService.record(first, 36, RecordType.PATIENT_PROBLEM, List.of("pain"), "");
        toothHistoryService.record(second, 46, RecordType.PATIENT_PROBLEM, List.of("swelling"), "");

        Patient copy = importUnderNewPhone(source);

        List<Examination> copied = examinationService.listForPatient(copy.getId());
        assertEquals(2, copied.size());
        LedgerScope copiedSecond = examinationService.resolveScope(copy.getId(), copied.get(0).getId());
        LedgerScope copiedFirst = examinationService.resolveScope(copy.getId(), copied.get(1).getId());
        assertEquals(List.of("pain"),
                toothHistoryService.currentStatus(copiedFirst, 36, RecordType.PATIENT_PROBLEM).getStatuses());
        assertTrue(toothHistoryService.currentStatus(copiedFirst, 46, RecordType.PATIENT_PROBLEM).isDefaulted());
        assertEquals(List.of("swelling"),
                toothHistoryService.currentStatus(copiedSecond, 46, RecordType.PATIENT_PROBLEM).getStatuses());
        assertTrue(toothHistoryService.currentStatus(copiedSecond, 36, RecordType.PATIENT_PROBLEM).isDefaulted());
    }

    @Test
    @DisplayName("repeated identical tooth entries and visits all survive a round trip")
    void repeatedRowsSurviveRoundTrip() {
        Patient source = registerPatient("Ann Chebet");
        LedgerScope sourceScope = examinationService.resolveScope(source.getId(), examinationService.create(
                source.getId(), examination("repeat")).getId());
        toothHistoryService.restore(sourceScope, 11, RecordType.DOCTOR_FINDING, List.of("caries_deep"), "", RECORDED_ON);
        toothHistoryService.restore(sourceScope, 11, RecordType.DOCTOR_FINDING, List.of("filling"), "", RECORDED_ON);
        toothHistoryService.restore(sourceScope, 11, RecordType.DOCTOR_FINDING, List.of("caries_deep"), "", RECORDED_ON);
        for (int i = 0; i < 2; i++) {
            visitRecordService.restore(sourceScope, VisitRecordRequest.builder()
                    .visitDate(RECORDED_ON)
                    .amountPaid(new BigDecimal("500.00"))
                    .treatmentPerformed("Scaling")
                    .affectedTeeth(List.of())
                    .build());
        }

        Patient copy = importUnderNewPhone(source);

        LedgerScope copyScope = examinationService.resolveScope(copy.getId(), null);
        assertEquals(List.of("caries_deep"),
                toothHistoryService.currentStatus(copyScope, 11, RecordType.DOCTOR_FINDING).getStatuses());
        assertEquals(3, toothHistoryService.history(copyScope, 11, RecordType.DOCTOR_FINDING).size());
        assertEquals(2, visitRecordService.listForExamination(copyScope).size());
        assertEquals(0, new BigDecimal("1000.00").compareTo(visitRecordService.totalForExamination(copyScope)));

        // A second import of the copy only skips: each stored row absorbs one identical incoming row
        ImportResult again = dataTransferService.importCsv(
                new ByteArrayInputStream(dataTransferService.exportPatientCsv(copy.getId())));

        assertEquals(0, again.getTeethRestored());
        assertEquals(0, again.getVisitsRestored());
        assertEquals(3, toothHistoryService.history(copyScope, 11, RecordType.DOCTOR_FINDING).size());
        assertEquals(0, new BigDecimal("1000.00").compareTo(visitRecordService.totalForExamination(copyScope)));
    }

    @Test
    @DisplayName("a row with an invalid tooth is reported and the other rows still land")
    void badRowDoesNotAbortImport() {
        String phone = ToothHistoryLedgerIntegrationTest.uniquePhone();
        List<ImportRow> rows = new ArrayList<>();
        rows.add(row(2, phone, Map.of(
                ExportColumns.KIND, "patient",
                ExportColumns.FULL_NAME, "Peter Njoroge")));
        rows.add(row(3, phone, Map.of(
                ExportColumns.KIND, "examination",
                ExportColumns.EXAMINATION_REF, "e1",
                ExportColumns.EXAMINATION_DATE, "2024-05-20",
                ExportColumns.CHIEF_COMPLAINT, "Checkup")));
        rows.add(row(4, phone, Map.of(
                ExportColumns.KIND, "tooth_history",
                ExportColumns.EXAMINATION_REF, "e1",
                ExportColumns.TOOTH_NUMBER, "19",
                ExportColumns.RECORD_TYPE, "doctor_finding",
                ExportColumns.STATUSES, "missing")));
        rows.add(row(5, phone, Map.of(
                ExportColumns.KIND, "tooth_history",
                ExportColumns.EXAMINATION_REF, "e1",
                ExportColumns.TOOTH_NUMBER, "18",
                ExportColumns.RECORD_TYPE, "doctor_finding",
                ExportColumns.STATUSES, "missing")));

        ImportResult result = dataTransferService.importRows(rows);

        assertEquals(1, result.getCreated());
        assertEquals(1, result.getExaminationsRestored());
        assertEquals(1, result.getTeethRestored());
        assertEquals(1, result.getErrors().size());
        ImportRowError error = result.getErrors().get(0);
        assertEquals(4, error.getRowNumber());
        assertEquals("INVALID_TOOTH", error.getErrorCode());

        Patient imported = patientService.findByPhoneNumber(phone).orElseThrow();
        LedgerScope importedScope = examinationService.resolveScope(imported.getId(), null);
        assertEquals(List.of("missing"),
                toothHistoryService.currentStatus(importedScope, 18, RecordType.DOCTOR_FINDING).getStatuses());
    }

    @Test
    @DisplayName("rows for an unknown phone without a patient row are rejected")
    void unknownPhoneWithoutPatientRowIsRejected() {
        String phone = ToothHistoryLedgerIntegrationTest.uniquePhone();

        ImportResult result = dataTransferService.importRows(List.of(row(2, phone, Map.of(
                ExportColumns.KIND, "examination",
                ExportColumns.EXAMINATION_DATE, "2024-05-20",
                ExportColumns.CHIEF_COMPLAINT, "Checkup"))));

        assertEquals(0, result.getExaminationsRestored());
        assertEquals(1, result.getErrors().size());
        assertEquals("VALIDATION_ERROR", result.getErrors().get(0).getErrorCode());
        assertTrue(patientService.findByPhoneNumber(phone).isEmpty());
    }

    @Test
    @DisplayName("XLSX export opens as a workbook with a header and one row per record")
    void xlsxExportIsReadable() throws Exception {
        byte[] xlsx = dataTransferService.exportPatientXlsx(patient.getId());

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals(ExportColumns.KIND, sheet.getRow(0).getCell(0).getStringCellValue());
            // patient, custom status, examination, three tooth rows, one visit
            assertEquals(7, sheet.getLastRowNum());
            assertEquals("patient", sheet.getRow(1).getCell(0).getStringCellValue());
        }
    }

    private Patient registerPatient(String fullName) {
        return patientService.register(PatientRequest.builder()
                .fullName(fullName)
                .phoneNumber(ToothHistoryLedgerIntegrationTest.uniquePhone())
                .build());
    }

    private static ExaminationRequest examination(String findings) {
        return ExaminationRequest.builder()
                .examinationDate(EXAM_DATE)
                .chiefComplaint("Pain")
                .findings(findings)
                .build();
    }

    private Patient importUnderNewPhone(Patient source) {
        String newPhone = ToothHistoryLedgerIntegrationTest.uniquePhone();
        FlatExportTable table = dataTransferService.exportFlat(source.getId());
        table.getRows().forEach(row -> row.put(ExportColumns.PHONE_NUMBER, newPhone));

        ImportResult result = dataTransferService.importCsv(new ByteArrayInputStream(FlatExportWriter.toCsv(table)));

        assertTrue(result.getErrors().isEmpty(), () -> "Unexpected errors: " + result.getErrors());
        assertEquals(1, result.getCreated());
        return patientService.findByPhoneNumber(newPhone).orElseThrow();
    }

    private ImportRow row(int rowNumber, Map<String, String> values) {
        return row(rowNumber, patient.getPhoneNumber(), values);
    }

    private static ImportRow row(int rowNumber, String phone, Map<String, String> values) {
        Map<String, String> cells = new LinkedHashMap<>(values);
        cells.put(ExportColumns.PHONE_NUMBER, phone);
        return new ImportRow(rowNumber, cells);
    }
}
