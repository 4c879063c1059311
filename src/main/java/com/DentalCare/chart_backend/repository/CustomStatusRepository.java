package com.DentalCare.chart_backend.repository;

import com.DentalCare.chart_backend.model.CustomStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomStatusRepository extends JpaRepository<CustomStatus, Long> {

    Optional<CustomStatus> findByCodeIgnoreCase(String code);

    boolean existsByCodeIgnoreCase(String code);

    List<CustomStatus> findByActiveTrueOrderByDisplayNameAsc();

    List<CustomStatus> findAllByOrderByDisplayNameAsc();
}
