package com.ehrportal.dto;

import com.ehrportal.entity.MedicalRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MedicalRecordResponse {
    private UUID id;
    private UUID patientId;
    private UUID authorId;
    private LocalDateTime visitDate;
    private String chiefComplaint;
    private String diagnosis;
    private String treatmentPlan;
    private List<String> prescriptions = new ArrayList<>();
    private String notes;
    private LocalDate followUpDate;
    private LocalDateTime createdAt;

    public static MedicalRecordResponse from(MedicalRecord record) {
        return new MedicalRecordResponse(
                record.getId(),
                record.getPatient().getId(),
                record.getAuthor().getId(),
                record.getVisitDate(),
                record.getChiefComplaint(),
                record.getDiagnosis(),
                record.getTreatmentPlan(),
                copyOf(record.getPrescriptions()),
                record.getNotes(),
                record.getFollowUpDate(),
                record.getCreatedAt()
        );
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
