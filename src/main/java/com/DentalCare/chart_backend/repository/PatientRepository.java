package com.DentalCare.chart_backend.repository;

import com.DentalCare.chart_backend.model.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PatientRepository extends JpaRepository<Patient, Long> {

    Optional<Patient> findByPhoneNumber(String phoneNumber);

    boolean existsByPhoneNumber(String phoneNumber);

    boolean existsByPatientCode(String patientCode);

    @Query("SELECT COALESCE(MAX(p.id), 0) FROM Patient p")
    long findMaxId();
}
