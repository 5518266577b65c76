package com.ehrportal.dto;

import com.ehrportal.entity.Gender;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class PatientProfileRequest {
    @NotNull(message = "Date of birth is required")
    @Past(message = "Date of birth must be in the past")
    private LocalDate dateOfBirth;

    @NotNull(message = "Gender is required")
    private Gender gender;

    @NotBlank(message = "Phone number is required")
    @Size(max = 30)
    private String phoneNumber;

    @NotBlank(message = "Address is required")
    private String address;

    @NotBlank(message = "Emergency contact name is required")
    @Size(max = 150)
    private String emergencyContactName;

    @NotBlank(message = "Emergency contact phone is required")
    @Size(max = 30)
    private String emergencyContactPhone;

    @Size(max = 5)
    private String bloodType;

    private List<String> allergies = new ArrayList<>();
    private List<String> chronicConditions = new ArrayList<>();
    private List<String> currentMedications = new ArrayList<>();
}
