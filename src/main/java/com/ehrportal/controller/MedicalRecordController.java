package com.ehrportal.controller;

import com.ehrportal.dto.MedicalRecordRequest;
import com.ehrportal.dto.MedicalRecordResponse;
import com.ehrportal.security.UserPrincipal;
import com.ehrportal.service.MedicalRecordService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/medical-records")
public class MedicalRecordController {

    private final MedicalRecordService medicalRecordService;

    public MedicalRecordController(MedicalRecordService medicalRecordService) {
        this.medicalRecordService = medicalRecordService;
    }

    @PostMapping
    public ResponseEntity<MedicalRecordResponse> createRecord(
            @Valid @RequestBody MedicalRecordRequest request,
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(medicalRecordService.createRecord(userPrincipal, request));
    }

    @GetMapping
    public ResponseEntity<List<MedicalRecordResponse>> listRecords(
            @RequestParam(required = false) UUID patientId,
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.ok(medicalRecordService.listRecords(userPrincipal, patientId));
    }

    @GetMapping("/{recordId}")
    public ResponseEntity<MedicalRecordResponse> getRecord(
            @PathVariable UUID recordId,
            @AuthenticationPrincipal UserPrincipal userPrincipal) {
        return ResponseEntity.ok(medicalRecordService.getRecord(userPrincipal, recordId));
    }
}
