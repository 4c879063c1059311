package com.DentalCare.chart_backend.repository;

import com.DentalCare.chart_backend.enums.RecordType;
import com.DentalCare.chart_backend.model.ToothHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Every lookup here is keyed by a single record type. There is no
 * query that spans both streams for the same tooth.
 */
@Repository
public interface ToothHistoryEntryRepository extends JpaRepository<ToothHistoryEntry, Long> {

    Optional<ToothHistoryEntry> findTopByPatientIdAndExaminationIdAndToothNumberAndRecordTypeOrderByIdDesc(
            Long patientId, Long examinationId, Integer toothNumber, RecordType recordType);

    List<ToothHistoryEntry> findByPatientIdAndExaminationIdAndToothNumberAndRecordTypeOrderByIdAsc(
            Long patientId, Long examinationId, Integer toothNumber, RecordType recordType);

    List<ToothHistoryEntry> findByPatientIdAndExaminationIdOrderByIdAsc(Long patientId, Long examinationId);

    long countByPatientIdAndExaminationIdAndToothNumberAndRecordType(
            Long patientId, Long examinationId, Integer toothNumber, RecordType recordType);

    long countByExaminationId(Long examinationId);

    long countByPatientId(Long patientId);

    long countByPatientIdAndRecordType(Long patientId, RecordType recordType);

    @Query("""
        SELECT COUNT(t) FROM ToothHistoryEntry t
        WHERE t.patientId = :patientId
        AND t.dateRecorded >= :since
    """)
    long countRecordedSince(@Param("patientId") Long patientId, @Param("since") LocalDate since);
}
