package com.ehrportal.service;

import com.ehrportal.dto.PatientProfileRequest;
import com.ehrportal.dto.PatientProfileResponse;
import com.ehrportal.entity.Gender;
import com.ehrportal.entity.PatientProfile;
import com.ehrportal.entity.Role;
import com.ehrportal.entity.User;
import com.ehrportal.exception.ConflictException;
import com.ehrportal.exception.ForbiddenException;
import com.ehrportal.exception.NotFoundException;
import com.ehrportal.exception.UnauthenticatedException;
import com.ehrportal.repository.PatientProfileRepository;
import com.ehrportal.security.AuthorizationGuard;
import com.ehrportal.security.UserPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PatientServiceTest {

    @Mock
    private PatientProfileRepository patientProfileRepository;

    @Mock
    private CredentialStore credentialStore;

    @Spy
    private AuthorizationGuard authorizationGuard = new AuthorizationGuard();

    @InjectMocks
    private PatientService patientService;

    private User patientUser;
    private User otherPatientUser;
    private User doctorUser;
    private PatientProfile patientProfile;
    private PatientProfile otherProfile;
    private PatientProfileRequest request;

    @BeforeEach
    void setUp() {
        patientUser = user(Role.PATIENT, "p1@mail.com");
        otherPatientUser = user(Role.PATIENT, "p2@mail.com");
        doctorUser = user(Role.DOCTOR, "doc@clinic.org");

        request = new PatientProfileRequest();
        request.setDateOfBirth(LocalDate.of(1990, 3, 14));
        request.setGender(Gender.FEMALE);
        request.setPhoneNumber("+1-555-0100");
        request.setAddress("1 Main St");
        request.setEmergencyContactName("Sam Doe");
        request.setEmergencyContactPhone("+1-555-0101");
        request.setBloodType("O+");
        request.setAllergies(List.of("penicillin"));
        request.setChronicConditions(List.of("asthma"));
        request.setCurrentMedications(List.of("salbutamol"));

        patientProfile = profile(patientUser);
        otherProfile = profile(otherPatientUser);
    }

    private static User user(Role role, String email) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setEmail(email);
        user.setFullName(email);
        user.setPasswordHash("hash");
        user.setRole(role);
        return user;
    }

    private static PatientProfile profile(User owner) {
        PatientProfile profile = new PatientProfile();
        profile.setId(UUID.randomUUID());
        profile.setUser(owner);
        profile.setDateOfBirth(LocalDate.of(1985, 1, 1));
        profile.setGender(Gender.OTHER);
        profile.setPhoneNumber("000");
        profile.setAddress("somewhere");
        profile.setEmergencyContactName("someone");
        profile.setEmergencyContactPhone("111");
        return profile;
    }

    @Test
    void getOwnProfile_NoProfileYet_ThrowsNotFound() {
        when(patientProfileRepository.findByUserId(patientUser.getId())).thenReturn(Optional.empty());

        NotFoundException exception = assertThrows(NotFoundException.class,
                () -> patientService.getOwnProfile(UserPrincipal.from(patientUser)));

        assertEquals("Patient profile not found", exception.getMessage());
    }

    @Test
    void getOwnProfile_DoctorCaller_ThrowsForbidden() {
        assertThrows(ForbiddenException.class,
                () -> patientService.getOwnProfile(UserPrincipal.from(doctorUser)));
        verifyNoInteractions(patientProfileRepository);
    }

    @Test
    void getOwnProfile_NoCaller_ThrowsUnauthenticated() {
        assertThrows(UnauthenticatedException.class, () -> patientService.getOwnProfile(null));
        verifyNoInteractions(patientProfileRepository);
    }

    @Test
    void createProfile_Success_ReturnsSubmittedFields() {
        when(patientProfileRepository.existsByUserId(patientUser.getId())).thenReturn(false);
        when(credentialStore.findById(patientUser.getId())).thenReturn(Optional.of(patientUser));
        when(patientProfileRepository.saveAndFlush(any(PatientProfile.class))).thenAnswer(invocation -> {
            PatientProfile saved = invocation.getArgument(0);
            saved.setId(UUID.randomUUID());
            return saved;
        });

        PatientProfileResponse response = patientService.createProfile(UserPrincipal.from(patientUser), request);

        assertNotNull(response.getId());
        assertEquals(patientUser.getId(), response.getUserId());
        assertEquals(LocalDate.of(1990, 3, 14), response.getDateOfBirth());
        assertEquals(Gender.FEMALE, response.getGender());
        assertEquals("+1-555-0100", response.getPhoneNumber());
        assertEquals("O+", response.getBloodType());
        assertEquals(List.of("penicillin"), response.getAllergies());
        assertEquals(List.of("asthma"), response.getChronicConditions());
        assertEquals(List.of("salbutamol"), response.getCurrentMedications());
    }

    @Test
    void createProfile_ProfileExists_ThrowsConflict() {
        when(patientProfileRepository.existsByUserId(patientUser.getId())).thenReturn(true);

        assertThrows(ConflictException.class,
                () -> patientService.createProfile(UserPrincipal.from(patientUser), request));
        verify(patientProfileRepository, never()).saveAndFlush(any(PatientProfile.class));
    }

    @Test
    void createProfile_ConcurrentInsertLoses_ThrowsConflict() {
        when(patientProfileRepository.existsByUserId(patientUser.getId())).thenReturn(false);
        when(credentialStore.findById(patientUser.getId())).thenReturn(Optional.of(patientUser));
        when(patientProfileRepository.saveAndFlush(any(PatientProfile.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate user_id"));

        assertThrows(ConflictException.class,
                () -> patientService.createProfile(UserPrincipal.from(patientUser), request));
    }

    @Test
    void createProfile_DoctorCaller_ThrowsForbidden() {
        assertThrows(ForbiddenException.class,
                () -> patientService.createProfile(UserPrincipal.from(doctorUser), request));
        verifyNoInteractions(patientProfileRepository, credentialStore);
    }

    @Test
    void updateOwnProfile_Success_AppliesChanges() {
        request.setAddress("2 Side St");
        when(patientProfileRepository.findByUserId(patientUser.getId())).thenReturn(Optional.of(patientProfile));
        when(patientProfileRepository.save(patientProfile)).thenReturn(patientProfile);

        PatientProfileResponse response = patientService.updateOwnProfile(UserPrincipal.from(patientUser), request);

        assertEquals("2 Side St", response.getAddress());
        assertEquals(patientProfile.getId(), response.getId());
    }

    @Test
    void updateOwnProfile_NoProfile_ThrowsNotFound() {
        when(patientProfileRepository.findByUserId(patientUser.getId())).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> patientService.updateOwnProfile(UserPrincipal.from(patientUser), request));
    }

    @Test
    void listPatients_PatientCaller_ThrowsForbidden() {
        assertThrows(ForbiddenException.class,
                () -> patientService.listPatients(UserPrincipal.from(patientUser)));
        verifyNoInteractions(patientProfileRepository);
    }

    @Test
    void listPatients_DoctorCaller_ReturnsAll() {
        when(patientProfileRepository.findAll()).thenReturn(List.of(patientProfile, otherProfile));

        List<PatientProfileResponse> patients = patientService.listPatients(UserPrincipal.from(doctorUser));

        assertEquals(2, patients.size());
    }

    @Test
    void getPatient_OwnProfile_ReturnsProfile() {
        when(patientProfileRepository.findById(patientProfile.getId())).thenReturn(Optional.of(patientProfile));

        PatientProfileResponse response =
                patientService.getPatient(UserPrincipal.from(patientUser), patientProfile.getId());

        assertEquals(patientProfile.getId(), response.getId());
    }

    @Test
    void getPatient_OtherPatientsProfile_ThrowsForbidden() {
        when(patientProfileRepository.findById(otherProfile.getId())).thenReturn(Optional.of(otherProfile));

        assertThrows(ForbiddenException.class,
                () -> patientService.getPatient(UserPrincipal.from(patientUser), otherProfile.getId()));
    }

    @Test
    void getPatient_DoctorCaller_SeesAnyProfile() {
        when(patientProfileRepository.findById(otherProfile.getId())).thenReturn(Optional.of(otherProfile));

        PatientProfileResponse response =
                patientService.getPatient(UserPrincipal.from(doctorUser), otherProfile.getId());

        assertEquals(otherPatientUser.getId(), response.getUserId());
    }

    @Test
    void getPatient_Missing_ThrowsNotFound() {
        UUID missing = UUID.randomUUID();
        when(patientProfileRepository.findById(missing)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> patientService.getPatient(UserPrincipal.from(doctorUser), missing));
    }
}
