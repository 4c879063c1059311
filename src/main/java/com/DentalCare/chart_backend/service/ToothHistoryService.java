package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.response.CurrentToothStatus;
import com.DentalCare.chart_backend.dto.response.StatusDescriptor;
import com.DentalCare.chart_backend.dto.response.ToothHistoryEntryResponse;
import com.DentalCare.chart_backend.dto.response.ToothHistoryStatistics;
import com.DentalCare.chart_backend.dto.response.ToothSummaryResponse;
import com.DentalCare.chart_backend.enums.RecordType;
import com.DentalCare.chart_backend.exception.InvalidToothException;
import com.DentalCare.chart_backend.exception.LedgerPersistenceException;
import com.DentalCare.chart_backend.exception.ScopeViolationException;
import com.DentalCare.chart_backend.exception.UnknownStatusException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.model.ToothHistoryEntry;
import com.DentalCare.chart_backend.repository.ToothHistoryEntryRepository;
import com.DentalCare.chart_backend.util.Constants;
import com.DentalCare.chart_backend.util.ToothNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Append-only per-tooth ledger with two independent streams
 * ({@link RecordType#PATIENT_PROBLEM} and {@link RecordType#DOCTOR_FINDING}).
 * Every read and write is confined to one {@link LedgerScope}; nothing here
 * combines the two streams into one answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToothHistoryService {

    private final ToothHistoryEntryRepository toothHistoryEntryRepository;
    private final ExaminationService examinationService;
    private final StatusRegistryService statusRegistryService;
    private final ModelMapper modelMapper;

    /**
     * Appends one entry. Existing entries are never touched.
     */
    @Transactional
    public ToothHistoryEntry record(LedgerScope scope, Integer toothNumber, RecordType recordType,
                                   List<String> statuses, String description) {
        examinationService.requireScope(scope);
        validateTooth(toothNumber);
        validateRecordType(recordType);
        List<String> codes = statusRegistryService.validateCodes(statuses);

        return append(scope, toothNumber, recordType, codes, description, LocalDate.now());
    }

    /**
     * Import path. Keeps the original recording date and accepts any registered
     * code, including deactivated custom statuses.
     */
    @Transactional
    public ToothHistoryEntry restore(LedgerScope scope, Integer toothNumber, RecordType recordType,
                                    List<String> statuses, String description, LocalDate dateRecorded) {
        examinationService.requireScope(scope);
        validateTooth(toothNumber);
        validateRecordType(recordType);
        List<String> codes = knownCodes(statuses);

        return append(scope, toothNumber, recordType, codes, description,
                dateRecorded != null ? dateRecorded : LocalDate.now());
    }

    /**
     * Statuses of the most recent entry for the exact (examination, tooth, stream),
     * or {@code ["normal"]} when there is none.
     */
    @Transactional(readOnly = true)
    public CurrentToothStatus currentStatus(LedgerScope scope, Integer toothNumber, RecordType recordType) {
        validateTooth(toothNumber);
        validateRecordType(recordType);

        Optional<ToothHistoryEntry> latest = toothHistoryEntryRepository
                .findTopByPatientIdAndExaminationIdAndToothNumberAndRecordTypeOrderByIdDesc(
                        scope.getPatientId(), scope.getExaminationId(), toothNumber, recordType);

        if (latest.isEmpty()) {
            return CurrentToothStatus.builder()
                    .examinationId(scope.getExaminationId())
                    .toothNumber(toothNumber)
                    .recordType(recordType)
                    .statuses(List.of(Constants.DEFAULT_STATUS_CODE))
                    .defaulted(true)
                    .entryCount(0)
                    .build();
        }

        ToothHistoryEntry entry = latest.get();
        checkEntryScope(entry, scope, toothNumber, recordType);

        long entryCount = toothHistoryEntryRepository.countByPatientIdAndExaminationIdAndToothNumberAndRecordType(
                scope.getPatientId(), scope.getExaminationId(), toothNumber, recordType);

        return CurrentToothStatus.builder()
                .examinationId(entry.getExaminationId())
                .toothNumber(entry.getToothNumber())
                .recordType(entry.getRecordType())
                .statuses(List.copyOf(entry.getStatuses()))
                .entryId(entry.getId())
                .dateRecorded(entry.getDateRecorded())
                .defaulted(false)
                .entryCount(entryCount)
                .build();
    }

    /**
     * All entries for one tooth in one stream, oldest first. Each call runs a
     * fresh query and returns a new list.
     */
    @Transactional(readOnly = true)
    public List<ToothHistoryEntry> history(LedgerScope scope, Integer toothNumber, RecordType recordType) {
        validateTooth(toothNumber);
        validateRecordType(recordType);

        List<ToothHistoryEntry> entries = toothHistoryEntryRepository
                .findByPatientIdAndExaminationIdAndToothNumberAndRecordTypeOrderByIdAsc(
                        scope.getPatientId(), scope.getExaminationId(), toothNumber, recordType);
        for (ToothHistoryEntry entry : entries) {
            checkEntryScope(entry, scope, toothNumber, recordType);
        }
        log.debug("Loaded {} {} entries for tooth {} in examination {}",
                entries.size(), recordType.getValue(), toothNumber, scope.getExaminationId());
        return new ArrayList<>(entries);
    }

    /**
     * Whole-mouth chart: both streams for each of the 32 teeth, side by side.
     */
    @Transactional(readOnly = true)
    public ToothSummaryResponse toothSummary(LedgerScope scope) {
        examinationService.requireScope(scope);

        List<ToothSummaryResponse.ToothSummaryItem> teeth = new ArrayList<>();
        for (Integer toothNumber : ToothNumbers.ALL_TEETH) {
            CurrentToothStatus patientProblem = currentStatus(scope, toothNumber, RecordType.PATIENT_PROBLEM);
            CurrentToothStatus doctorFinding = currentStatus(scope, toothNumber, RecordType.DOCTOR_FINDING);

            teeth.add(ToothSummaryResponse.ToothSummaryItem.builder()
                    .toothNumber(toothNumber)
                    .patientProblem(patientProblem)
                    .doctorFinding(doctorFinding)
                    .patientProblemStatuses(describeAll(patientProblem.getStatuses()))
                    .doctorFindingStatuses(describeAll(doctorFinding.getStatuses()))
                    .build());
        }

        return ToothSummaryResponse.builder()
                .patientId(scope.getPatientId())
                .examinationId(scope.getExaminationId())
                .teeth(teeth)
                .build();
    }

    @Transactional(readOnly = true)
    public ToothHistoryStatistics statistics(Long patientId) {
        LocalDate since = LocalDate.now().minusDays(Constants.RECENT_RECORDS_DAYS);

        return ToothHistoryStatistics.builder()
                .patientId(patientId)
                .totalRecords(toothHistoryEntryRepository.countByPatientId(patientId))
                .patientProblems(toothHistoryEntryRepository.countByPatientIdAndRecordType(
                        patientId, RecordType.PATIENT_PROBLEM))
                .doctorFindings(toothHistoryEntryRepository.countByPatientIdAndRecordType(
                        patientId, RecordType.DOCTOR_FINDING))
                .recentRecords(toothHistoryEntryRepository.countRecordedSince(patientId, since))
                .build();
    }

    /**
     * Every entry of one examination, used by export. Both streams come back in
     * insertion order and are written out as separate rows.
     */
    @Transactional(readOnly = true)
    public List<ToothHistoryEntry> listForExamination(LedgerScope scope) {
        return toothHistoryEntryRepository.findByPatientIdAndExaminationIdOrderByIdAsc(
                scope.getPatientId(), scope.getExaminationId());
    }

    public ToothHistoryEntryResponse mapToResponse(ToothHistoryEntry entry) {
        ToothHistoryEntryResponse response = modelMapper.map(entry, ToothHistoryEntryResponse.class);
        response.setStatuses(List.copyOf(entry.getStatuses()));
        return response;
    }

    public List<ToothHistoryEntryResponse> mapToResponses(List<ToothHistoryEntry> entries) {
        return entries.stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    private ToothHistoryEntry append(LedgerScope scope, Integer toothNumber, RecordType recordType,
                                     List<String> codes, String description, LocalDate dateRecorded) {
        ToothHistoryEntry entry = ToothHistoryEntry.builder()
                .patientId(scope.getPatientId())
                .examinationId(scope.getExaminationId())
                .toothNumber(toothNumber)
                .recordType(recordType)
                .statuses(new ArrayList<>(codes))
                .description(description != null ? description.trim() : "")
                .dateRecorded(dateRecorded)
                .build();

        try {
            ToothHistoryEntry savedEntry = toothHistoryEntryRepository.saveAndFlush(entry);
            log.info("Recorded {} for tooth {} in examination {}: {}",
                    recordType.getValue(), toothNumber, scope.getExaminationId(), codes);
            return savedEntry;
        } catch (DataAccessException e) {
            log.error("Failed to record tooth {} in examination {}: {}",
                    toothNumber, scope.getExaminationId(), e.getMessage(), e);
            throw new LedgerPersistenceException("record tooth history", e);
        }
    }

    private void checkEntryScope(ToothHistoryEntry entry, LedgerScope scope, Integer toothNumber,
                                 RecordType recordType) {
        if (!Objects.equals(entry.getPatientId(), scope.getPatientId())
                || !Objects.equals(entry.getExaminationId(), scope.getExaminationId())
                || !Objects.equals(entry.getToothNumber(), toothNumber)
                || entry.getRecordType() != recordType) {
            throw new ScopeViolationException(String.format(
                    "Entry %d is outside examination %d, tooth %d, %s",
                    entry.getId(), scope.getExaminationId(), toothNumber, recordType.getValue()));
        }
    }

    private List<String> knownCodes(List<String> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            throw ValidationException.forField("statuses", "statuses", "At least one status is required");
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String status : statuses) {
            String code = status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
            if (code.isEmpty()) {
                continue;
            }
            if (!statusRegistryService.isKnown(code)) {
                throw new UnknownStatusException(code);
            }
            ordered.add(code);
        }
        if (ordered.isEmpty()) {
            throw ValidationException.forField("statuses", "statuses", "At least one status is required");
        }
        return new ArrayList<>(ordered);
    }

    private List<StatusDescriptor> describeAll(List<String> codes) {
        return codes.stream()
                .map(statusRegistryService::describe)
                .collect(Collectors.toList());
    }

    private static void validateTooth(Integer toothNumber) {
        if (!ToothNumbers.isValid(toothNumber)) {
            throw new InvalidToothException(toothNumber);
        }
    }

    private static void validateRecordType(RecordType recordType) {
        if (recordType == null) {
            throw ValidationException.forField("toothHistory", "recordType",
                    "Record type must be patient_problem or doctor_finding");
        }
    }
}
