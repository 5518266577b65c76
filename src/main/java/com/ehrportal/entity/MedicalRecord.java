package com.ehrportal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A clinical entry written by a doctor or admin. Never updated after insert.
 */
@Entity
@Table(name = "medical_records")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MedicalRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "patient_id", nullable = false, updatable = false)
    private PatientProfile patient;

    @ManyToOne(optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false)
    private User author;

    @Column(name = "visit_date", nullable = false, updatable = false)
    private LocalDateTime visitDate;

    @Column(name = "chief_complaint", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String chiefComplaint;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String diagnosis;

    @Column(name = "treatment_plan", updatable = false, columnDefinition = "TEXT")
    private String treatmentPlan;

    @Convert(converter = StringListConverter.class)
    @Column(updatable = false, columnDefinition = "TEXT")
    private List<String> prescriptions = new ArrayList<>();

    @Column(updatable = false, columnDefinition = "TEXT")
    private String notes;

    @Column(name = "follow_up_date", updatable = false)
    private LocalDate followUpDate;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
