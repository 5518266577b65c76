package com.ehrportal.dto;

import com.ehrportal.entity.Gender;
import com.ehrportal.entity.PatientProfile;
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
public class PatientProfileResponse {
    private UUID id;
    private UUID userId;
    private LocalDate dateOfBirth;
    private Gender gender;
    private String phoneNumber;
    private String address;
    private String emergencyContactName;
    private String emergencyContactPhone;
    private String bloodType;
    private List<String> allergies = new ArrayList<>();
    private List<String> chronicConditions = new ArrayList<>();
    private List<String> currentMedications = new ArrayList<>();
    private LocalDateTime createdAt;

    public static PatientProfileResponse from(PatientProfile profile) {
        return new PatientProfileResponse(
                profile.getId(),
                profile.getUser().getId(),
                profile.getDateOfBirth(),
                profile.getGender(),
                profile.getPhoneNumber(),
                profile.getAddress(),
                profile.getEmergencyContactName(),
                profile.getEmergencyContactPhone(),
                profile.getBloodType(),
                copyOf(profile.getAllergies()),
                copyOf(profile.getChronicConditions()),
                copyOf(profile.getCurrentMedications()),
                profile.getCreatedAt()
        );
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
