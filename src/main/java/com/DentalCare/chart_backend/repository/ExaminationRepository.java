package com.DentalCare.chart_backend.repository;

import com.DentalCare.chart_backend.model.Examination;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ExaminationRepository extends JpaRepository<Examination, Long> {

    /**
     * Current examination: latest date, most recently created on ties.
     */
    Optional<Examination> findTopByPatientIdOrderByExaminationDateDescIdDesc(Long patientId);

    List<Examination> findByPatientIdOrderByExaminationDateDescIdDesc(Long patientId);

    List<Examination> findByPatientIdOrderByExaminationDateAscIdAsc(Long patientId);

    List<Examination> findByPatientIdAndExaminationDate(Long patientId, LocalDate examinationDate);

    long countByPatientId(Long patientId);

    long countByPatientIdAndExaminationDateGreaterThanEqual(Long patientId, LocalDate since);

    long countByExaminationDateGreaterThanEqual(LocalDate since);
}
