package com.DentalCare.chart_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A billable visit. Insert-only; this row is the unit of truth for billing.
 */
@Entity
@Immutable
@Table(name = "visit_records", indexes = {
        @Index(name = "idx_visit_records_scope", columnList = "patient_id, examination_id")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VisitRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private Long patientId;

    @Column(name = "examination_id", nullable = false, updatable = false)
    private Long examinationId;

    @Column(nullable = false, updatable = false)
    private LocalDate visitDate;

    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal amountPaid = BigDecimal.ZERO;

    @Column(length = 4000, updatable = false)
    private String chiefComplaint;

    @Column(length = 4000, updatable = false)
    private String diagnosis;

    @Column(length = 4000, updatable = false)
    private String treatmentPerformed;

    @Column(length = 4000, updatable = false)
    private String advice;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "visit_affected_teeth", joinColumns = @JoinColumn(name = "visit_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "tooth_number", nullable = false)
    @Builder.Default
    private List<Integer> affectedTeeth = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
