package com.DentalCare.chart_backend.model;

import com.DentalCare.chart_backend.enums.RecordType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One clinical observation for one tooth, in one stream, within one examination.
 * Rows are never updated; a new observation is a new row.
 */
@Entity
@Immutable
@Table(name = "tooth_history_entries", indexes = {
        @Index(name = "idx_tooth_history_scope",
                columnList = "patient_id, examination_id, tooth_number, record_type")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToothHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private Long patientId;

    @Column(name = "examination_id", nullable = false, updatable = false)
    private Long examinationId;

    @Column(name = "tooth_number", nullable = false, updatable = false)
    private Integer toothNumber;

    @Column(name = "record_type", nullable = false, updatable = false, length = 20)
    private RecordType recordType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tooth_history_statuses", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "status_code", nullable = false, length = 50)
    @Builder.Default
    private List<String> statuses = new ArrayList<>();

    @Column(length = 4000, updatable = false)
    @Builder.Default
    private String description = "";

    @Column(nullable = false, updatable = false)
    private LocalDate dateRecorded;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
