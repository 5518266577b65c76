package com.ehrportal.controller;

import com.ehrportal.dto.PatientProfileRequest;
import com.ehrportal.dto.PatientProfileResponse;
import com.ehrportal.security.UserPrincipal;
import com.ehrportal.service.PatientService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/patients")
public class PatientController {

    private final PatientService patientService;

    public PatientController(PatientService patientService) {
        this.patientService = patientService;
    }

    @PostMapping
    public ResponseEntity<PatientProfileResponse> createProfile(
            @Valid @RequestBody PatientProfileRequest request,
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(patientService.createProfile(userPrincipal, request));
    }

    @GetMapping("/me")
    public ResponseEntity<PatientProfileResponse> getOwnProfile(
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.ok(patientService.getOwnProfile(userPrincipal));
    }

    @PutMapping("/me")
    public ResponseEntity<PatientProfileResponse> updateOwnProfile(
            @Valid @RequestBody PatientProfileRequest request,
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.ok(patientService.updateOwnProfile(userPrincipal, request));
    }

    @GetMapping
    public ResponseEntity<List<PatientProfileResponse>> listPatients(
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.ok(patientService.listPatients(userPrincipal));
    }

    @GetMapping("/{patientId}")
    public ResponseEntity<PatientProfileResponse> getPatient(
            @PathVariable UUID patientId,
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.ok(patientService.getPatient(userPrincipal, patientId));
    }
}
