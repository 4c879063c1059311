package com.DentalCare.chart_backend.repository;

import com.DentalCare.chart_backend.model.VisitRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Repository
public interface VisitRecordRepository extends JpaRepository<VisitRecord, Long> {

    List<VisitRecord> findByPatientIdAndExaminationIdOrderByVisitDateAscIdAsc(Long patientId, Long examinationId);

    List<VisitRecord> findByPatientIdOrderByVisitDateAscIdAsc(Long patientId);

    List<VisitRecord> findByVisitDateBetweenOrderByVisitDateAscIdAsc(LocalDate startDate, LocalDate endDate);

    long countByExaminationId(Long examinationId);

    long countByVisitDateBetween(LocalDate startDate, LocalDate endDate);

    @Query("""
        SELECT COUNT(DISTINCT v.patientId) FROM VisitRecord v
        WHERE v.visitDate BETWEEN :startDate AND :endDate
    """)
    long countPatientsBetween(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    @Query("""
        SELECT COALESCE(SUM(v.amountPaid), 0) FROM VisitRecord v
        WHERE v.visitDate BETWEEN :startDate AND :endDate
    """)
    BigDecimal sumAmountPaidBetween(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    @Query("""
        SELECT COALESCE(SUM(v.amountPaid), 0) FROM VisitRecord v
        WHERE v.patientId = :patientId
        AND v.examinationId = :examinationId
    """)
    BigDecimal sumAmountPaidByExamination(
            @Param("patientId") Long patientId,
            @Param("examinationId") Long examinationId
    );

    @Query("SELECT COALESCE(SUM(v.amountPaid), 0) FROM VisitRecord v WHERE v.patientId = :patientId")
    BigDecimal sumAmountPaidByPatient(@Param("patientId") Long patientId);
}
