package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.request.ExaminationRequest;
import com.DentalCare.chart_backend.dto.response.ExaminationResponse;
import com.DentalCare.chart_backend.dto.response.ExaminationStatistics;
import com.DentalCare.chart_backend.exception.ExaminationInUseException;
import com.DentalCare.chart_backend.exception.ResourceNotFoundException;
import com.DentalCare.chart_backend.exception.ScopeViolationException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.model.Examination;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.repository.ExaminationRepository;
import com.DentalCare.chart_backend.repository.PatientRepository;
import com.DentalCare.chart_backend.repository.ToothHistoryEntryRepository;
import com.DentalCare.chart_backend.repository.VisitRecordRepository;
import com.DentalCare.chart_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Examination episodes. Every tooth and visit row hangs off exactly one of these,
 * and the ledger services only ever see them through a {@link LedgerScope}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExaminationService {

    private final ExaminationRepository examinationRepository;
    private final PatientRepository patientRepository;
    private final ToothHistoryEntryRepository toothHistoryEntryRepository;
    private final VisitRecordRepository visitRecordRepository;
    private final ModelMapper modelMapper;

    @Transactional
    public Examination create(Long patientId, ExaminationRequest request) {
        requirePatient(patientId);
        requireDescriptiveContent(request);

        Examination examination = Examination.builder()
                .patientId(patientId)
                .examinationDate(request.getExaminationDate() != null ? request.getExaminationDate() : LocalDate.now())
                .chiefComplaint(trimToNull(request.getChiefComplaint()))
                .findings(trimToNull(request.getFindings()))
                .diagnosis(trimToNull(request.getDiagnosis()))
                .treatmentPlan(trimToNull(request.getTreatmentPlan()))
                .notes(trimToNull(request.getNotes()))
                .build();

        Examination savedExamination = examinationRepository.save(examination);
        log.info("Examination {} created for patient {} on {}",
                savedExamination.getId(), patientId, savedExamination.getExaminationDate());
        return savedExamination;
    }

    /**
     * Latest examination date wins; the most recently created one breaks ties.
     */
    public Optional<Examination> getCurrent(Long patientId) {
        return examinationRepository.findTopByPatientIdOrderByExaminationDateDescIdDesc(patientId);
    }

    public List<Examination> listForPatient(Long patientId) {
        requirePatient(patientId);
        return examinationRepository.findByPatientIdOrderByExaminationDateDescIdDesc(patientId);
    }

    public Examination getById(Long patientId, Long examinationId) {
        Examination examination = examinationRepository.findById(examinationId)
                .orElseThrow(() -> new ResourceNotFoundException("Examination", "id", examinationId));
        if (!Objects.equals(examination.getPatientId(), patientId)) {
            throw new ScopeViolationException(String.format(
                    "Examination %d does not belong to patient %d", examinationId, patientId));
        }
        return examination;
    }

    @Transactional
    public Examination update(Long patientId, Long examinationId, ExaminationRequest request) {
        Examination examination = getById(patientId, examinationId);
        requireDescriptiveContent(request);

        if (request.getExaminationDate() != null) {
            examination.setExaminationDate(request.getExaminationDate());
        }
        examination.setChiefComplaint(trimToNull(request.getChiefComplaint()));
        examination.setFindings(trimToNull(request.getFindings()));
        examination.setDiagnosis(trimToNull(request.getDiagnosis()));
        examination.setTreatmentPlan(trimToNull(request.getTreatmentPlan()));
        examination.setNotes(trimToNull(request.getNotes()));

        Examination updatedExamination = examinationRepository.save(examination);
        log.info("Examination {} updated", examinationId);
        return updatedExamination;
    }

    @Transactional
    public void delete(Long patientId, Long examinationId) {
        Examination examination = getById(patientId, examinationId);

        long toothEntries = toothHistoryEntryRepository.countByExaminationId(examinationId);
        long visits = visitRecordRepository.countByExaminationId(examinationId);
        if (toothEntries > 0 || visits > 0) {
            throw new ExaminationInUseException(examinationId, toothEntries, visits);
        }

        examinationRepository.delete(examination);
        log.info("Examination {} deleted for patient {}", examinationId, patientId);
    }

    /**
     * Examination counts for one patient, or for the whole clinic when
     * {@code patientId} is null. Recent means dated within the last 30 days.
     */
    public ExaminationStatistics statistics(Long patientId) {
        LocalDate since = LocalDate.now().minusDays(Constants.RECENT_RECORDS_DAYS);
        if (patientId == null) {
            return ExaminationStatistics.builder()
                    .totalExaminations(examinationRepository.count())
                    .recentExaminations(examinationRepository.countByExaminationDateGreaterThanEqual(since))
                    .build();
        }

        requirePatient(patientId);
        return ExaminationStatistics.builder()
                .patientId(patientId)
                .totalExaminations(examinationRepository.countByPatientId(patientId))
                .recentExaminations(examinationRepository.countByPatientIdAndExaminationDateGreaterThanEqual(
                        patientId, since))
                .build();
    }

    /**
     * Builds the scope for ledger calls. An explicit examination must belong to
     * the patient; a null id selects the current examination.
     */
    public LedgerScope resolveScope(Long patientId, Long examinationId) {
        if (patientId == null) {
            throw new ScopeViolationException("A patient must be selected");
        }
        if (examinationId == null) {
            Examination current = getCurrent(patientId)
                    .orElseThrow(() -> new ScopeViolationException(String.format(
                            "Patient %d has no examinations. Create one before recording", patientId)));
            log.debug("Resolved current examination {} for patient {}", current.getId(), patientId);
            return LedgerScope.of(patientId, current.getId());
        }
        Examination examination = getById(patientId, examinationId);
        return LedgerScope.of(patientId, examination.getId());
    }

    /**
     * Re-checks a scope handed in from outside the service layer.
     */
    public void requireScope(LedgerScope scope) {
        if (scope == null) {
            throw new ScopeViolationException("No examination selected");
        }
        getById(scope.getPatientId(), scope.getExaminationId());
    }

    public ExaminationResponse mapToExaminationResponse(Examination examination) {
        ExaminationResponse response = modelMapper.map(examination, ExaminationResponse.class);
        response.setCurrent(getCurrent(examination.getPatientId())
                .map(current -> current.getId().equals(examination.getId()))
                .orElse(false));
        return response;
    }

    public List<ExaminationResponse> mapToExaminationResponses(List<Examination> examinations) {
        if (examinations.isEmpty()) {
            return List.of();
        }
        Long currentId = getCurrent(examinations.get(0).getPatientId()).map(Examination::getId).orElse(null);
        return examinations.stream()
                .map(examination -> {
                    ExaminationResponse response = modelMapper.map(examination, ExaminationResponse.class);
                    response.setCurrent(examination.getId().equals(currentId));
                    return response;
                })
                .collect(Collectors.toList());
    }

    private void requirePatient(Long patientId) {
        if (patientId == null || !patientRepository.existsById(patientId)) {
            throw new ResourceNotFoundException("Patient", "id", patientId);
        }
    }

    private void requireDescriptiveContent(ExaminationRequest request) {
        // A blank complaint is fine as long as something else was written down
        if (hasText(request.getChiefComplaint())
                || hasText(request.getFindings())
                || hasText(request.getDiagnosis())
                || hasText(request.getTreatmentPlan())
                || hasText(request.getNotes())) {
            return;
        }
        throw ValidationException.forField("examination", "chiefComplaint",
                "Chief complaint is required when no findings, diagnosis, treatment plan or notes are given");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
