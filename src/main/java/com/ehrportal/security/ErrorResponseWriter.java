package com.ehrportal.security;

import com.ehrportal.dto.ErrorResponse;
import com.ehrportal.exception.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;

/**
 * Writes an {@link ErrorResponse} for requests answered inside the security
 * filter chain, where the controller advice does not apply.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(HttpServletResponse response, ErrorKind kind, String message) throws IOException {
        response.setStatus(kind.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(kind, message, clock));
    }
}
