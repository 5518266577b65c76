package com.ehrportal.dto;

import com.ehrportal.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private ErrorKind kind;
    private String message;
    private Instant timestamp;

    public static ErrorResponse of(ErrorKind kind, String message, Clock clock) {
        return new ErrorResponse(kind, message, clock.instant());
    }
}
