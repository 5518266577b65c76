package com.ehrportal.client;

import com.ehrportal.dto.AuthResponse;
import com.ehrportal.dto.ErrorResponse;
import com.ehrportal.dto.IdentitySummary;
import com.ehrportal.dto.LoginRequest;
import com.ehrportal.dto.MedicalRecordRequest;
import com.ehrportal.dto.MedicalRecordResponse;
import com.ehrportal.dto.PatientProfileRequest;
import com.ehrportal.dto.PatientProfileResponse;
import com.ehrportal.dto.RegisterRequest;
import com.ehrportal.exception.ErrorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Consumer of the backend API that keeps a {@link ClientSession} in step with
 * server answers: the token is attached to every protected call, an
 * UNAUTHENTICATED answer drops the session, and FORBIDDEN leaves it alone.
 */
@Slf4j
public class EhrApiClient {

    private static final ParameterizedTypeReference<List<PatientProfileResponse>> PATIENT_LIST =
            new ParameterizedTypeReference<>() { };
    private static final ParameterizedTypeReference<List<MedicalRecordResponse>> RECORD_LIST =
            new ParameterizedTypeReference<>() { };
    private static final ParameterizedTypeReference<List<IdentitySummary>> USER_LIST =
            new ParameterizedTypeReference<>() { };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final ClientSession session;
    private final Clock clock;

    public EhrApiClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, ClientSession session) {
        this(restTemplate, objectMapper, baseUrl, session, Clock.systemUTC());
    }

    public EhrApiClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl,
                        ClientSession session, Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.session = session;
        this.clock = clock;
    }

    public ClientSession getSession() {
        return session;
    }

    public IdentitySummary login(String email, String password) {
        LoginRequest request = new LoginRequest();
        request.setEmail(email);
        request.setPassword(password);
        return authenticate("/api/auth/login", request);
    }

    public IdentitySummary register(String email, String password, String fullName, String role) {
        RegisterRequest request = new RegisterRequest();
        request.setEmail(email);
        request.setPassword(password);
        request.setFullName(fullName);
        request.setRole(role);
        return authenticate("/api/auth/register", request);
    }

    public void logout() {
        session.logout();
    }

    public IdentitySummary currentIdentity() {
        return call(HttpMethod.GET, "/api/auth/me", null, IdentitySummary.class);
    }

    /**
     * First step of the profile protocol: an absent profile is a normal answer,
     * after which the caller may {@link #createProfile}.
     */
    public Optional<PatientProfileResponse> getOwnProfile() {
        try {
            return Optional.ofNullable(call(HttpMethod.GET, "/api/patients/me", null, PatientProfileResponse.class));
        } catch (ApiCallException e) {
            if (e.getKind() == ErrorKind.NOT_FOUND) {
                return Optional.empty();
            }
            throw e;
        }
    }

    public PatientProfileResponse createProfile(PatientProfileRequest request) {
        return call(HttpMethod.POST, "/api/patients", request, PatientProfileResponse.class);
    }

    public PatientProfileResponse updateOwnProfile(PatientProfileRequest request) {
        return call(HttpMethod.PUT, "/api/patients/me", request, PatientProfileResponse.class);
    }

    public List<PatientProfileResponse> listPatients() {
        return exchange(HttpMethod.GET, "/api/patients", null, PATIENT_LIST);
    }

    public PatientProfileResponse getPatient(UUID patientId) {
        return call(HttpMethod.GET, "/api/patients/" + patientId, null, PatientProfileResponse.class);
    }

    public MedicalRecordResponse createMedicalRecord(MedicalRecordRequest request) {
        return call(HttpMethod.POST, "/api/medical-records", request, MedicalRecordResponse.class);
    }

    public List<MedicalRecordResponse> listMedicalRecords(UUID patientId) {
        UriComponentsBuilder path = UriComponentsBuilder.fromPath("/api/medical-records");
        if (patientId != null) {
            path.queryParam("patientId", patientId);
        }
        return exchange(HttpMethod.GET, path.toUriString(), null, RECORD_LIST);
    }

    public MedicalRecordResponse getMedicalRecord(UUID recordId) {
        return call(HttpMethod.GET, "/api/medical-records/" + recordId, null, MedicalRecordResponse.class);
    }

    public List<IdentitySummary> listUsers() {
        return exchange(HttpMethod.GET, "/api/users", null, USER_LIST);
    }

    private IdentitySummary authenticate(String path, Object body) {
        session.beginAuthentication();
        try {
            AuthResponse response = restTemplate.exchange(
                    baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, jsonHeaders()), AuthResponse.class
            ).getBody();
            if (response == null || response.getToken() == null) {
                throw new ApiCallException(ErrorKind.INTERNAL_ERROR, 0, "Empty authentication response");
            }
            session.completeAuthentication(response);
            return response.getUser();
        } catch (HttpStatusCodeException e) {
            ApiCallException failure = toApiCallException(e);
            session.failAuthentication(ErrorResponse.of(failure.getKind(), failure.getMessage(), clock));
            throw failure;
        } catch (RuntimeException e) {
            session.failAuthentication(ErrorResponse.of(ErrorKind.INTERNAL_ERROR, e.getMessage(), clock));
            throw e;
        }
    }

    private <T> T call(HttpMethod method, String path, Object body, Class<T> responseType) {
        String token = currentToken();
        try {
            return restTemplate.exchange(baseUrl + path, method, authorizedEntity(token, body), responseType).getBody();
        } catch (HttpStatusCodeException e) {
            throw onErrorResponse(token, e);
        }
    }

    private <T> T exchange(HttpMethod method, String path, Object body, ParameterizedTypeReference<T> responseType) {
        String token = currentToken();
        try {
            return restTemplate.exchange(baseUrl + path, method, authorizedEntity(token, body), responseType).getBody();
        } catch (HttpStatusCodeException e) {
            throw onErrorResponse(token, e);
        }
    }

    private String currentToken() {
        return session.getToken()
                .filter(t -> session.isAuthenticated())
                .orElseThrow(() -> new IllegalStateException("Not authenticated: log in or register first"));
    }

    private static HttpEntity<Object> authorizedEntity(String token, Object body) {
        HttpHeaders headers = jsonHeaders();
        headers.setBearerAuth(token);
        return new HttpEntity<>(body, headers);
    }

    private ApiCallException onErrorResponse(String sentToken, HttpStatusCodeException e) {
        ApiCallException failure = toApiCallException(e);
        if (failure.getKind() == ErrorKind.UNAUTHENTICATED) {
            session.invalidate(sentToken, ErrorResponse.of(failure.getKind(), failure.getMessage(), clock));
        }
        return failure;
    }

    private ApiCallException toApiCallException(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        ErrorResponse error = readError(e.getResponseBodyAsString());
        if (error != null && error.getKind() != null) {
            return new ApiCallException(error.getKind(), status, error.getMessage(), e);
        }
        return new ApiCallException(kindForStatus(status), status, e.getStatusText(), e);
    }

    // used when the body is not a recognisable error response
    private static ErrorKind kindForStatus(int status) {
        switch (status) {
            case 400:
                return ErrorKind.VALIDATION_ERROR;
            case 401:
                return ErrorKind.UNAUTHENTICATED;
            case 403:
                return ErrorKind.FORBIDDEN;
            case 404:
                return ErrorKind.NOT_FOUND;
            default:
                return ErrorKind.INTERNAL_ERROR;
        }
    }

    private ErrorResponse readError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ErrorResponse.class);
        } catch (JsonProcessingException e) {
            log.debug("Unrecognised error body: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
