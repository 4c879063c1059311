package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.config.LedgerProperties;
import com.DentalCare.chart_backend.dto.request.VisitRecordRequest;
import com.DentalCare.chart_backend.dto.response.VisitRangeResponse;
import com.DentalCare.chart_backend.dto.response.VisitRecordResponse;
import com.DentalCare.chart_backend.dto.response.VisitStatistics;
import com.DentalCare.chart_backend.dto.response.VisitTotalResponse;
import com.DentalCare.chart_backend.enums.RecordType;
import com.DentalCare.chart_backend.exception.InvalidToothException;
import com.DentalCare.chart_backend.exception.LedgerPersistenceException;
import com.DentalCare.chart_backend.exception.ResourceNotFoundException;
import com.DentalCare.chart_backend.exception.ScopeViolationException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.model.LedgerScope;
import com.DentalCare.chart_backend.model.ToothHistoryEntry;
import com.DentalCare.chart_backend.model.VisitRecord;
import com.DentalCare.chart_backend.repository.VisitRecordRepository;
import com.DentalCare.chart_backend.util.ToothNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class VisitRecordService {

    private final VisitRecordRepository visitRecordRepository;
    private final ExaminationService examinationService;
    private final ToothHistoryService toothHistoryService;
    private final StatusRegistryService statusRegistryService;
    private final LedgerProperties ledgerProperties;
    private final ModelMapper modelMapper;

    /**
     * Adds a visit to the examination. When derivation is enabled each affected
     * tooth also gets a doctor_finding entry; the visit and those entries commit
     * together or not at all.
     */
    @Transactional
    public VisitRecordResponse add(LedgerScope scope, VisitRecordRequest request) {
        examinationService.requireScope(scope);
        List<Integer> affectedTeeth = validateTeeth(request.getAffectedTeeth());

        boolean derive = ledgerProperties.getVisits().isDeriveDoctorFindings() && !affectedTeeth.isEmpty();
        List<String> findingStatuses = derive ? findingStatuses(request) : List.of();

        VisitRecord savedVisit = persist(scope, request, affectedTeeth);

        List<Long> derivedEntryIds = new ArrayList<>();
        if (derive) {
            String description = describeTreatment(request, savedVisit.getVisitDate());
            for (Integer toothNumber : affectedTeeth) {
                ToothHistoryEntry entry = toothHistoryService.record(
                        scope, toothNumber, RecordType.DOCTOR_FINDING, findingStatuses, description);
                derivedEntryIds.add(entry.getId());
            }
            log.info("Visit {} recorded {} doctor findings", savedVisit.getId(), derivedEntryIds.size());
        }

        VisitRecordResponse response = mapToVisitRecordResponse(savedVisit);
        response.setDerivedEntryIds(derivedEntryIds);
        return response;
    }

    /**
     * Import path. Stores the visit as given without deriving tooth findings,
     * since the exported tooth rows are restored separately.
     */
    @Transactional
    public VisitRecord restore(LedgerScope scope, VisitRecordRequest request) {
        examinationService.requireScope(scope);
        List<Integer> affectedTeeth = validateTeeth(request.getAffectedTeeth());
        return persist(scope, request, affectedTeeth);
    }

    /**
     * Sum of amounts paid in this examination, queried on every call.
     */
    @Transactional(readOnly = true)
    public BigDecimal totalForExamination(LedgerScope scope) {
        BigDecimal total = visitRecordRepository.sumAmountPaidByExamination(
                scope.getPatientId(), scope.getExaminationId());
        return total != null ? total : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public VisitTotalResponse totalResponse(LedgerScope scope) {
        return VisitTotalResponse.builder()
                .patientId(scope.getPatientId())
                .examinationId(scope.getExaminationId())
                .visitCount(visitRecordRepository.countByExaminationId(scope.getExaminationId()))
                .totalPaid(totalForExamination(scope))
                .build();
    }

    @Transactional(readOnly = true)
    public List<VisitRecord> listForExamination(LedgerScope scope) {
        return visitRecordRepository.findByPatientIdAndExaminationIdOrderByVisitDateAscIdAsc(
                scope.getPatientId(), scope.getExaminationId());
    }

    @Transactional(readOnly = true)
    public List<VisitRecord> listForPatient(Long patientId) {
        return visitRecordRepository.findByPatientIdOrderByVisitDateAscIdAsc(patientId);
    }

    /**
     * Visits across all patients with a visit date inside [startDate, endDate].
     */
    @Transactional(readOnly = true)
    public List<VisitRecord> listByDateRange(LocalDate startDate, LocalDate endDate) {
        validateRange(startDate, endDate);
        return visitRecordRepository.findByVisitDateBetweenOrderByVisitDateAscIdAsc(startDate, endDate);
    }

    /**
     * Visit count and revenue for the range. Both bounds are inclusive.
     */
    @Transactional(readOnly = true)
    public VisitStatistics statistics(LocalDate startDate, LocalDate endDate) {
        validateRange(startDate, endDate);

        long visitCount = visitRecordRepository.countByVisitDateBetween(startDate, endDate);
        BigDecimal totalRevenue = visitRecordRepository.sumAmountPaidBetween(startDate, endDate);
        if (totalRevenue == null) {
            totalRevenue = BigDecimal.ZERO;
        }
        BigDecimal averagePerVisit = visitCount > 0
                ? totalRevenue.divide(BigDecimal.valueOf(visitCount), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return VisitStatistics.builder()
                .startDate(startDate)
                .endDate(endDate)
                .visitCount(visitCount)
                .patientCount(visitRecordRepository.countPatientsBetween(startDate, endDate))
                .totalRevenue(totalRevenue)
                .averagePerVisit(averagePerVisit)
                .build();
    }

    public VisitRangeResponse mapToRangeResponse(List<VisitRecord> visits, BigDecimal totalPaid) {
        return VisitRangeResponse.builder()
                .visits(mapToVisitRecordResponses(visits))
                .visitCount(visits.size())
                .totalPaid(totalPaid)
                .build();
    }

    @Transactional(readOnly = true)
    public BigDecimal totalForPatient(Long patientId) {
        BigDecimal total = visitRecordRepository.sumAmountPaidByPatient(patientId);
        return total != null ? total : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public VisitRecord getById(LedgerScope scope, Long visitId) {
        VisitRecord visit = visitRecordRepository.findById(visitId)
                .orElseThrow(() -> new ResourceNotFoundException("VisitRecord", "id", visitId));
        if (!Objects.equals(visit.getPatientId(), scope.getPatientId())
                || !Objects.equals(visit.getExaminationId(), scope.getExaminationId())) {
            throw new ScopeViolationException(String.format(
                    "Visit %d does not belong to examination %d", visitId, scope.getExaminationId()));
        }
        return visit;
    }

    public VisitRecordResponse mapToVisitRecordResponse(VisitRecord visit) {
        VisitRecordResponse response = modelMapper.map(visit, VisitRecordResponse.class);
        response.setAffectedTeeth(List.copyOf(visit.getAffectedTeeth()));
        response.setDerivedEntryIds(new ArrayList<>());
        return response;
    }

    public List<VisitRecordResponse> mapToVisitRecordResponses(List<VisitRecord> visits) {
        return visits.stream()
                .map(this::mapToVisitRecordResponse)
                .collect(Collectors.toList());
    }

    private VisitRecord persist(LedgerScope scope, VisitRecordRequest request, List<Integer> affectedTeeth) {
        BigDecimal amountPaid = request.getAmountPaid() != null ? request.getAmountPaid() : BigDecimal.ZERO;
        if (amountPaid.signum() < 0) {
            throw ValidationException.forField("visit", "amountPaid", "Amount paid cannot be negative");
        }

        VisitRecord visit = VisitRecord.builder()
                .patientId(scope.getPatientId())
                .examinationId(scope.getExaminationId())
                .visitDate(request.getVisitDate() != null ? request.getVisitDate() : LocalDate.now())
                .amountPaid(amountPaid)
                .chiefComplaint(trimToNull(request.getChiefComplaint()))
                .diagnosis(trimToNull(request.getDiagnosis()))
                .treatmentPerformed(trimToNull(request.getTreatmentPerformed()))
                .advice(trimToNull(request.getAdvice()))
                .affectedTeeth(new ArrayList<>(affectedTeeth))
                .build();

        try {
            VisitRecord savedVisit = visitRecordRepository.saveAndFlush(visit);
            log.info("Visit {} added to examination {}: amount {}",
                    savedVisit.getId(), scope.getExaminationId(), savedVisit.getAmountPaid());
            return savedVisit;
        } catch (DataAccessException e) {
            log.error("Failed to add visit to examination {}: {}", scope.getExaminationId(), e.getMessage(), e);
            throw new LedgerPersistenceException("add visit", e);
        }
    }

    private List<String> findingStatuses(VisitRecordRequest request) {
        List<String> requested = request.getFindingStatuses();
        if (requested == null || requested.isEmpty()) {
            requested = List.of(ledgerProperties.getVisits().getDefaultFindingStatus());
        }
        return statusRegistryService.validateCodes(requested);
    }

    private static void validateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw ValidationException.forField("visitRange", "startDate", "Start and end dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw ValidationException.forField("visitRange", "endDate", "End date must not be before start date");
        }
    }

    private static List<Integer> validateTeeth(List<Integer> teeth) {
        List<Integer> normalized = ToothNumbers.normalize(teeth);
        for (Integer toothNumber : normalized) {
            if (!ToothNumbers.isValid(toothNumber)) {
                throw new InvalidToothException(toothNumber);
            }
        }
        return normalized;
    }

    private static String describeTreatment(VisitRecordRequest request, LocalDate visitDate) {
        List<String> parts = new ArrayList<>();
        if (hasText(request.getDiagnosis())) {
            parts.add("Diagnosis: " + request.getDiagnosis().trim());
        }
        if (hasText(request.getTreatmentPerformed())) {
            parts.add("Treatment: " + request.getTreatmentPerformed().trim());
        }
        if (parts.isEmpty()) {
            return "Visit on " + visitDate;
        }
        return String.join("; ", parts);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
