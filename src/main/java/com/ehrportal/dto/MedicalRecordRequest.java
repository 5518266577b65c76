package com.ehrportal.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class MedicalRecordRequest {
    @NotNull(message = "Patient ID is required")
    private UUID patientId;

    @NotBlank(message = "Chief complaint is required")
    private String chiefComplaint;

    @NotBlank(message = "Diagnosis is required")
    private String diagnosis;

    private String treatmentPlan;
    private List<String> prescriptions = new ArrayList<>();
    private String notes;

    // defaults to the time of creation
    private LocalDateTime visitDate;
    private LocalDate followUpDate;
}
