package com.DentalCare.chart_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "examinations", indexes = {
        @Index(name = "idx_examinations_patient_date", columnList = "patient_id, examination_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Examination {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private Long patientId;

    @Column(name = "examination_date", nullable = false)
    private LocalDate examinationDate;

    @Column(length = 4000)
    private String chiefComplaint;

    @Column(length = 4000)
    private String findings;

    @Column(length = 4000)
    private String diagnosis;

    @Column(length = 4000)
    private String treatmentPlan;

    @Column(length = 4000)
    private String notes;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
