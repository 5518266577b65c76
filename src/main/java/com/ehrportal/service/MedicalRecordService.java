package com.ehrportal.service;

import com.ehrportal.dto.MedicalRecordRequest;
import com.ehrportal.dto.MedicalRecordResponse;
import com.ehrportal.entity.MedicalRecord;
import com.ehrportal.entity.PatientProfile;
import com.ehrportal.entity.User;
import com.ehrportal.exception.NotFoundException;
import com.ehrportal.exception.UnauthenticatedException;
import com.ehrportal.repository.MedicalRecordRepository;
import com.ehrportal.repository.PatientProfileRepository;
import com.ehrportal.security.Action;
import com.ehrportal.security.AuthorizationGuard;
import com.ehrportal.security.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Medical records are written once by staff and never changed. Patients see
 * the records attached to their own profile only.
 */
@Slf4j
@Service
public class MedicalRecordService {

    private final MedicalRecordRepository medicalRecordRepository;
    private final PatientProfileRepository patientProfileRepository;
    private final CredentialStore credentialStore;
    private final AuthorizationGuard authorizationGuard;
    private final Clock clock;

    public MedicalRecordService(MedicalRecordRepository medicalRecordRepository,
                                PatientProfileRepository patientProfileRepository,
                                CredentialStore credentialStore,
                                AuthorizationGuard authorizationGuard,
                                Clock clock) {
        this.medicalRecordRepository = medicalRecordRepository;
        this.patientProfileRepository = patientProfileRepository;
        this.credentialStore = credentialStore;
        this.authorizationGuard = authorizationGuard;
        this.clock = clock;
    }

    public MedicalRecordResponse createRecord(UserPrincipal caller, MedicalRecordRequest request) {
        authorizationGuard.authorize(caller, Action.CREATE_MEDICAL_RECORD);

        PatientProfile patient = patientProfileRepository.findById(request.getPatientId())
                .orElseThrow(() -> new NotFoundException("Patient not found"));
        User author = credentialStore.findById(caller.getId())
                .orElseThrow(() -> new UnauthenticatedException("Authentication required"));

        MedicalRecord record = new MedicalRecord();
        record.setPatient(patient);
        record.setAuthor(author);
        record.setVisitDate(request.getVisitDate() != null ? request.getVisitDate() : LocalDateTime.now(clock));
        record.setChiefComplaint(request.getChiefComplaint());
        record.setDiagnosis(request.getDiagnosis());
        record.setTreatmentPlan(request.getTreatmentPlan());
        record.setPrescriptions(request.getPrescriptions() == null
                ? new ArrayList<>() : new ArrayList<>(request.getPrescriptions()));
        record.setNotes(request.getNotes());
        record.setFollowUpDate(request.getFollowUpDate());

        record = medicalRecordRepository.save(record);
        log.info("Identity {} created medical record {} for patient {}", author.getId(), record.getId(), patient.getId());
        return MedicalRecordResponse.from(record);
    }

    /**
     * Staff get every record, or one patient's when {@code patientId} is given;
     * an unknown {@code patientId} simply matches nothing. A patient gets their
     * own records; naming another patient's profile is forbidden and having no
     * profile yet yields an empty list.
     */
    public List<MedicalRecordResponse> listRecords(UserPrincipal caller, UUID patientId) {
        authorizationGuard.authorize(caller, Action.LIST_MEDICAL_RECORDS);

        List<MedicalRecord> records;
        if (patientId != null && caller.getRole().isStaff()) {
            records = medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(patientId);
        } else if (patientId != null) {
            PatientProfile patient = authorizationGuard.authorize(caller, Action.LIST_MEDICAL_RECORDS,
                    () -> patientProfileRepository.findById(patientId)
                            .orElseThrow(() -> new NotFoundException("Patient not found")),
                    p -> p.getUser().getId());
            records = medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(patient.getId());
        } else if (caller.getRole().isStaff()) {
            records = medicalRecordRepository.findAllByOrderByVisitDateDesc();
        } else {
            Optional<PatientProfile> own = patientProfileRepository.findByUserId(caller.getId());
            if (own.isEmpty()) {
                return List.of();
            }
            records = medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(own.get().getId());
        }
        return records.stream().map(MedicalRecordResponse::from).toList();
    }

    public MedicalRecordResponse getRecord(UserPrincipal caller, UUID recordId) {
        MedicalRecord record = authorizationGuard.authorize(caller, Action.VIEW_MEDICAL_RECORD,
                () -> medicalRecordRepository.findById(recordId)
                        .orElseThrow(() -> new NotFoundException("Medical record not found")),
                r -> r.getPatient().getUser().getId());
        return MedicalRecordResponse.from(record);
    }
}
