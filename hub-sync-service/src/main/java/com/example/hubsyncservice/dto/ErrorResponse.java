package com.example.hubsyncservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Standard error response format: {@code {error, status}} plus a stable machine code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;
    private int status;
    private String code;
    private Instant timestamp;
    private Map<String, String> errors;

    public static ErrorResponse of(int status, String code, String error) {
        return ErrorResponse.builder()
                .status(status)
                .code(code)
                .error(error)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Create error response with field errors (for validation).
     */
    public static ErrorResponse of(int status, String code, String error, Map<String, String> errors) {
        return ErrorResponse.builder()
                .status(status)
                .code(code)
                .error(error)
                .timestamp(Instant.now())
                .errors(errors)
                .build();
    }
}
