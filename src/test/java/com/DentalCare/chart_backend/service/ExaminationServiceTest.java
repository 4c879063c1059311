package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.config.ModelMapperConfig;
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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.modelmapper.ModelMapper;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExaminationServiceTest {

    private static final Long PATIENT_ID = 1L;

    @Mock
    private ExaminationRepository examinationRepository;

    @Mock
    private PatientRepository patientRepository;

    @Mock
    private ToothHistoryEntryRepository toothHistoryEntryRepository;

    @Mock
    private VisitRecordRepository visitRecordRepository;

    @Spy
    private ModelMapper modelMapper = new ModelMapperConfig().modelMapper();

    @InjectMocks
    private ExaminationService examinationService;

    private Examination examination(Long id, Long patientId, LocalDate date) {
        return Examination.builder()
                .id(id)
                .patientId(patientId)
                .examinationDate(date)
                .chiefComplaint("Pain on chewing")
                .build();
    }

    @Test
    void create_BlankComplaintAndNoOtherFields_ThrowsValidation() {
        when(patientRepository.existsById(PATIENT_ID)).thenReturn(true);
        ExaminationRequest request = ExaminationRequest.builder()
                .chiefComplaint("   ")
                .build();

        assertThrows(ValidationException.class, () -> examinationService.create(PATIENT_ID, request));
        verify(examinationRepository, never()).save(any());
    }

    @Test
    void create_BlankComplaintWithFindings_SavesAndDefaultsDateToToday() {
        when(patientRepository.existsById(PATIENT_ID)).thenReturn(true);
        when(examinationRepository.save(any(Examination.class))).thenAnswer(inv -> inv.getArgument(0));

        Examination saved = examinationService.create(PATIENT_ID, ExaminationRequest.builder()
                .chiefComplaint("")
                .findings("Plaque on lower incisors")
                .build());

        assertEquals(PATIENT_ID, saved.getPatientId());
        assertEquals(LocalDate.now(), saved.getExaminationDate());
        assertNull(saved.getChiefComplaint());
        assertEquals("Plaque on lower incisors", saved.getFindings());
    }

    @Test
    void create_UnknownPatient_ThrowsNotFound() {
        when(patientRepository.existsById(42L)).thenReturn(false);
        ExaminationRequest request = ExaminationRequest.builder().chiefComplaint("Pain").build();

        assertThrows(ResourceNotFoundException.class, () -> examinationService.create(42L, request));
    }

    @Test
    void resolveScope_ExaminationOfAnotherPatient_ThrowsScopeViolation() {
        when(examinationRepository.findById(5L))
                .thenReturn(Optional.of(examination(5L, 2L, LocalDate.now())));

        assertThrows(ScopeViolationException.class, () -> examinationService.resolveScope(PATIENT_ID, 5L));
    }

    @Test
    void resolveScope_NoExaminationId_UsesCurrentExamination() {
        when(examinationRepository.findTopByPatientIdOrderByExaminationDateDescIdDesc(PATIENT_ID))
                .thenReturn(Optional.of(examination(7L, PATIENT_ID, LocalDate.now())));

        LedgerScope scope = examinationService.resolveScope(PATIENT_ID, null);

        assertEquals(LedgerScope.of(PATIENT_ID, 7L), scope);
    }

    @Test
    void resolveScope_PatientWithoutExaminations_ThrowsScopeViolation() {
        when(examinationRepository.findTopByPatientIdOrderByExaminationDateDescIdDesc(PATIENT_ID))
                .thenReturn(Optional.empty());

        assertThrows(ScopeViolationException.class, () -> examinationService.resolveScope(PATIENT_ID, null));
    }

    @Test
    void delete_WithRecordedTeeth_ThrowsExaminationInUse() {
        when(examinationRepository.findById(5L))
                .thenReturn(Optional.of(examination(5L, PATIENT_ID, LocalDate.now())));
        when(toothHistoryEntryRepository.countByExaminationId(5L)).thenReturn(3L);
        when(visitRecordRepository.countByExaminationId(5L)).thenReturn(0L);

        assertThrows(ExaminationInUseException.class, () -> examinationService.delete(PATIENT_ID, 5L));
        verify(examinationRepository, never()).delete(any());
    }

    @Test
    void delete_EmptyExamination_Deletes() {
        Examination examination = examination(5L, PATIENT_ID, LocalDate.now());
        when(examinationRepository.findById(5L)).thenReturn(Optional.of(examination));

        examinationService.delete(PATIENT_ID, 5L);

        verify(examinationRepository).delete(examination);
    }

    @Test
    void mapToExaminationResponses_FlagsOnlyTheCurrentExamination() {
        Examination newer = examination(8L, PATIENT_ID, LocalDate.now());
        Examination older = examination(3L, PATIENT_ID, LocalDate.now().minusMonths(6));
        when(examinationRepository.findTopByPatientIdOrderByExaminationDateDescIdDesc(PATIENT_ID))
                .thenReturn(Optional.of(newer));

        List<ExaminationResponse> responses = examinationService.mapToExaminationResponses(List.of(newer, older));

        assertTrue(responses.get(0).isCurrent());
        assertFalse(responses.get(1).isCurrent());
        assertEquals("Pain on chewing", responses.get(1).getChiefComplaint());
    }

    @Test
    void statistics_ForPatient_CountsTotalAndLastThirtyDays() {
        when(patientRepository.existsById(PATIENT_ID)).thenReturn(true);
        when(examinationRepository.countByPatientId(PATIENT_ID)).thenReturn(5L);
        when(examinationRepository.countByPatientIdAndExaminationDateGreaterThanEqual(
                PATIENT_ID, LocalDate.now().minusDays(30))).thenReturn(2L);

        ExaminationStatistics statistics = examinationService.statistics(PATIENT_ID);

        assertEquals(PATIENT_ID, statistics.getPatientId());
        assertEquals(5L, statistics.getTotalExaminations());
        assertEquals(2L, statistics.getRecentExaminations());
    }

    @Test
    void statistics_WithoutPatient_CountsWholeClinic() {
        when(examinationRepository.count()).thenReturn(40L);
        when(examinationRepository.countByExaminationDateGreaterThanEqual(LocalDate.now().minusDays(30)))
                .thenReturn(7L);

        ExaminationStatistics statistics = examinationService.statistics(null);

        assertNull(statistics.getPatientId());
        assertEquals(40L, statistics.getTotalExaminations());
        assertEquals(7L, statistics.getRecentExaminations());
        verifyNoInteractions(patientRepository);
    }

    @Test
    void statistics_UnknownPatient_ThrowsNotFound() {
        when(patientRepository.existsById(42L)).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> examinationService.statistics(42L));
    }
}
