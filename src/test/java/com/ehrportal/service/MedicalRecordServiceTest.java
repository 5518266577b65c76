package com.ehrportal.service;

import com.ehrportal.dto.MedicalRecordRequest;
import com.ehrportal.dto.MedicalRecordResponse;
import com.ehrportal.entity.Gender;
import com.ehrportal.entity.MedicalRecord;
import com.ehrportal.entity.PatientProfile;
import com.ehrportal.entity.Role;
import com.ehrportal.entity.User;
import com.ehrportal.exception.ForbiddenException;
import com.ehrportal.exception.NotFoundException;
import com.ehrportal.exception.UnauthenticatedException;
import com.ehrportal.repository.MedicalRecordRepository;
import com.ehrportal.repository.PatientProfileRepository;
import com.ehrportal.security.AuthorizationGuard;
import com.ehrportal.security.UserPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MedicalRecordServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private MedicalRecordRepository medicalRecordRepository;

    @Mock
    private PatientProfileRepository patientProfileRepository;

    @Mock
    private CredentialStore credentialStore;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private MedicalRecordService medicalRecordService;

    private User doctor;
    private User patient;
    private User otherPatient;
    private PatientProfile profile;
    private PatientProfile otherProfile;
    private MedicalRecord record;

    @BeforeEach
    void setUp() {
        medicalRecordService = new MedicalRecordService(medicalRecordRepository, patientProfileRepository,
                credentialStore, new AuthorizationGuard(), clock);

        doctor = user(Role.DOCTOR);
        patient = user(Role.PATIENT);
        otherPatient = user(Role.PATIENT);
        profile = profile(patient);
        otherProfile = profile(otherPatient);

        record = new MedicalRecord();
        record.setId(UUID.randomUUID());
        record.setPatient(profile);
        record.setAuthor(doctor);
        record.setVisitDate(LocalDateTime.now(clock));
        record.setChiefComplaint("cough");
        record.setDiagnosis("bronchitis");
    }

    private static User user(Role role) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setEmail(role.getValue() + "-" + user.getId() + "@mail.com");
        user.setFullName(role.getValue());
        user.setRole(role);
        return user;
    }

    private static PatientProfile profile(User owner) {
        PatientProfile profile = new PatientProfile();
        profile.setId(UUID.randomUUID());
        profile.setUser(owner);
        profile.setDateOfBirth(LocalDate.of(1980, 6, 1));
        profile.setGender(Gender.MALE);
        return profile;
    }

    private MedicalRecordRequest request(UUID patientId) {
        MedicalRecordRequest request = new MedicalRecordRequest();
        request.setPatientId(patientId);
        request.setChiefComplaint("cough");
        request.setDiagnosis("bronchitis");
        request.setPrescriptions(List.of("amoxicillin"));
        request.setFollowUpDate(LocalDate.of(2024, 5, 15));
        return request;
    }

    @Test
    void createRecord_DoctorForExistingPatient_SavesWithAuthorAndVisitDate() {
        when(patientProfileRepository.findById(profile.getId())).thenReturn(Optional.of(profile));
        when(credentialStore.findById(doctor.getId())).thenReturn(Optional.of(doctor));
        when(medicalRecordRepository.save(any(MedicalRecord.class))).thenAnswer(invocation -> {
            MedicalRecord saved = invocation.getArgument(0);
            saved.setId(UUID.randomUUID());
            return saved;
        });

        MedicalRecordResponse response =
                medicalRecordService.createRecord(UserPrincipal.from(doctor), request(profile.getId()));

        ArgumentCaptor<MedicalRecord> captor = ArgumentCaptor.forClass(MedicalRecord.class);
        verify(medicalRecordRepository).save(captor.capture());
        assertEquals(doctor, captor.getValue().getAuthor());
        assertEquals(LocalDateTime.now(clock), captor.getValue().getVisitDate());

        assertEquals(profile.getId(), response.getPatientId());
        assertEquals(doctor.getId(), response.getAuthorId());
        assertEquals("cough", response.getChiefComplaint());
        assertEquals("bronchitis", response.getDiagnosis());
        assertEquals(List.of("amoxicillin"), response.getPrescriptions());
        assertEquals(LocalDate.of(2024, 5, 15), response.getFollowUpDate());
    }

    @Test
    void createRecord_AdminCaller_IsAllowed() {
        User admin = user(Role.ADMIN);
        when(patientProfileRepository.findById(profile.getId())).thenReturn(Optional.of(profile));
        when(credentialStore.findById(admin.getId())).thenReturn(Optional.of(admin));
        when(medicalRecordRepository.save(any(MedicalRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        MedicalRecordResponse response =
                medicalRecordService.createRecord(UserPrincipal.from(admin), request(profile.getId()));

        assertEquals(admin.getId(), response.getAuthorId());
    }

    @Test
    void createRecord_PatientCaller_ThrowsForbidden() {
        assertThrows(ForbiddenException.class,
                () -> medicalRecordService.createRecord(UserPrincipal.from(patient), request(profile.getId())));
        verifyNoInteractions(medicalRecordRepository, patientProfileRepository);
    }

    @Test
    void createRecord_UnknownPatient_ThrowsNotFound() {
        UUID missing = UUID.randomUUID();
        when(patientProfileRepository.findById(missing)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> medicalRecordService.createRecord(UserPrincipal.from(doctor), request(missing)));
        verify(medicalRecordRepository, never()).save(any(MedicalRecord.class));
    }

    @Test
    void createRecord_NoCaller_ThrowsUnauthenticated() {
        assertThrows(UnauthenticatedException.class,
                () -> medicalRecordService.createRecord(null, request(profile.getId())));
    }

    @Test
    void listRecords_PatientWithoutProfile_ReturnsEmpty() {
        when(patientProfileRepository.findByUserId(patient.getId())).thenReturn(Optional.empty());

        assertTrue(medicalRecordService.listRecords(UserPrincipal.from(patient), null).isEmpty());
        verifyNoInteractions(medicalRecordRepository);
    }

    @Test
    void listRecords_Patient_SeesOwnRecordsOnly() {
        when(patientProfileRepository.findByUserId(patient.getId())).thenReturn(Optional.of(profile));
        when(medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(profile.getId())).thenReturn(List.of(record));

        List<MedicalRecordResponse> records = medicalRecordService.listRecords(UserPrincipal.from(patient), null);

        assertEquals(1, records.size());
        assertEquals(record.getId(), records.get(0).getId());
        verify(medicalRecordRepository, never()).findAllByOrderByVisitDateDesc();
    }

    @Test
    void listRecords_PatientNamingAnotherPatient_ThrowsForbidden() {
        when(patientProfileRepository.findById(otherProfile.getId())).thenReturn(Optional.of(otherProfile));

        assertThrows(ForbiddenException.class,
                () -> medicalRecordService.listRecords(UserPrincipal.from(patient), otherProfile.getId()));
        verifyNoInteractions(medicalRecordRepository);
    }

    @Test
    void listRecords_DoctorWithoutFilter_SeesAll() {
        when(medicalRecordRepository.findAllByOrderByVisitDateDesc()).thenReturn(List.of(record));

        assertEquals(1, medicalRecordService.listRecords(UserPrincipal.from(doctor), null).size());
    }

    @Test
    void listRecords_DoctorWithFilter_SeesThatPatient() {
        when(medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(profile.getId())).thenReturn(List.of(record));

        List<MedicalRecordResponse> records = medicalRecordService.listRecords(UserPrincipal.from(doctor), profile.getId());

        assertEquals(1, records.size());
        assertEquals(record.getId(), records.get(0).getId());
    }

    @Test
    void listRecords_DoctorWithUnknownPatient_ReturnsEmpty() {
        UUID unknown = UUID.randomUUID();
        when(medicalRecordRepository.findByPatientIdOrderByVisitDateDesc(unknown)).thenReturn(List.of());

        assertTrue(medicalRecordService.listRecords(UserPrincipal.from(doctor), unknown).isEmpty());
        verifyNoInteractions(patientProfileRepository);
    }

    @Test
    void getRecord_OwningPatient_ReturnsRecord() {
        when(medicalRecordRepository.findById(record.getId())).thenReturn(Optional.of(record));

        MedicalRecordResponse response = medicalRecordService.getRecord(UserPrincipal.from(patient), record.getId());

        assertEquals("bronchitis", response.getDiagnosis());
    }

    @Test
    void getRecord_OtherPatient_ThrowsForbidden() {
        when(medicalRecordRepository.findById(record.getId())).thenReturn(Optional.of(record));

        assertThrows(ForbiddenException.class,
                () -> medicalRecordService.getRecord(UserPrincipal.from(otherPatient), record.getId()));
    }

    @Test
    void getRecord_Missing_ThrowsNotFound() {
        UUID missing = UUID.randomUUID();
        when(medicalRecordRepository.findById(missing)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> medicalRecordService.getRecord(UserPrincipal.from(doctor), missing));
    }
}
