package com.fintech.escrow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Error body returned by the API. {@code step} names the stage that failed:
 * validation, funding, verification, ledger_submission and so on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private int status;
    private String error;
    private String step;
    private String message;
    private String path;
    private String reference;
    private LocalDateTime timestamp;

    public static ErrorResponse of(int status, String error, String step, String message, String path) {
        return ErrorResponse.builder()
                .status(status)
                .error(error)
                .step(step)
                .message(message)
                .path(path)
                .timestamp(LocalDateTime.now(ZoneOffset.UTC))
                .build();
    }
}
