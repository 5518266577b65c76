package com.ehrportal.service;

import com.ehrportal.dto.PatientProfileRequest;
import com.ehrportal.dto.PatientProfileResponse;
import com.ehrportal.entity.PatientProfile;
import com.ehrportal.entity.User;
import com.ehrportal.exception.ConflictException;
import com.ehrportal.exception.NotFoundException;
import com.ehrportal.exception.UnauthenticatedException;
import com.ehrportal.repository.PatientProfileRepository;
import com.ehrportal.security.Action;
import com.ehrportal.security.AuthorizationGuard;
import com.ehrportal.security.ProtectedResource;
import com.ehrportal.security.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Patient profiles. A patient's profile does not exist until the patient
 * creates it: {@link #getOwnProfile} answers NOT_FOUND until
 * {@link #createProfile} has been called.
 */
@Slf4j
@Service
public class PatientService {

    private final PatientProfileRepository patientProfileRepository;
    private final CredentialStore credentialStore;
    private final AuthorizationGuard authorizationGuard;

    public PatientService(PatientProfileRepository patientProfileRepository,
                          CredentialStore credentialStore,
                          AuthorizationGuard authorizationGuard) {
        this.patientProfileRepository = patientProfileRepository;
        this.credentialStore = credentialStore;
        this.authorizationGuard = authorizationGuard;
    }

    public PatientProfileResponse getOwnProfile(UserPrincipal caller) {
        authorizationGuard.authorize(caller, Action.VIEW_OWN_PROFILE, ownTarget(caller));
        return patientProfileRepository.findByUserId(caller.getId())
                .map(PatientProfileResponse::from)
                .orElseThrow(() -> new NotFoundException("Patient profile not found"));
    }

    public PatientProfileResponse createProfile(UserPrincipal caller, PatientProfileRequest request) {
        authorizationGuard.authorize(caller, Action.CREATE_OWN_PROFILE, ownTarget(caller));

        if (patientProfileRepository.existsByUserId(caller.getId())) {
            throw new ConflictException("Patient profile already exists");
        }
        User user = credentialStore.findById(caller.getId())
                .orElseThrow(() -> new UnauthenticatedException("Authentication required"));

        PatientProfile profile = new PatientProfile();
        profile.setUser(user);
        apply(profile, request);

        try {
            profile = patientProfileRepository.saveAndFlush(profile);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Patient profile already exists");
        }

        log.info("Created patient profile {} for identity {}", profile.getId(), user.getId());
        return PatientProfileResponse.from(profile);
    }

    @Transactional
    public PatientProfileResponse updateOwnProfile(UserPrincipal caller, PatientProfileRequest request) {
        PatientProfile profile = authorizationGuard.authorize(caller, Action.UPDATE_OWN_PROFILE,
                () -> patientProfileRepository.findByUserId(caller.getId())
                        .orElseThrow(() -> new NotFoundException("Patient profile not found")),
                p -> p.getUser().getId());

        apply(profile, request);
        return PatientProfileResponse.from(patientProfileRepository.save(profile));
    }

    public List<PatientProfileResponse> listPatients(UserPrincipal caller) {
        authorizationGuard.authorize(caller, Action.LIST_PATIENTS);
        return patientProfileRepository.findAll().stream()
                .map(PatientProfileResponse::from)
                .toList();
    }

    public PatientProfileResponse getPatient(UserPrincipal caller, UUID patientId) {
        PatientProfile profile = authorizationGuard.authorize(caller, Action.VIEW_PATIENT,
                () -> patientProfileRepository.findById(patientId)
                        .orElseThrow(() -> new NotFoundException("Patient not found")),
                p -> p.getUser().getId());
        return PatientProfileResponse.from(profile);
    }

    private static ProtectedResource ownTarget(UserPrincipal caller) {
        return caller == null || caller.getId() == null
                ? ProtectedResource.none()
                : ProtectedResource.ownedBy(caller.getId());
    }

    private static void apply(PatientProfile profile, PatientProfileRequest request) {
        profile.setDateOfBirth(request.getDateOfBirth());
        profile.setGender(request.getGender());
        profile.setPhoneNumber(request.getPhoneNumber());
        profile.setAddress(request.getAddress());
        profile.setEmergencyContactName(request.getEmergencyContactName());
        profile.setEmergencyContactPhone(request.getEmergencyContactPhone());
        profile.setBloodType(request.getBloodType());
        profile.setAllergies(copyOf(request.getAllergies()));
        profile.setChronicConditions(copyOf(request.getChronicConditions()));
        profile.setCurrentMedications(copyOf(request.getCurrentMedications()));
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
