package com.fintech.escrow.exception;

import com.fintech.escrow.config.CorrelationIdFilter;
import com.fintech.escrow.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps escrow exceptions to error responses naming the failed step.
 * The correlation id is returned as the reference for support requests.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EscrowValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            EscrowValidationException ex, HttpServletRequest request) {
        log.warn("Validation error [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid request [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY), message);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", FailureStep.VALIDATION, message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY),
                ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", FailureStep.VALIDATION,
                "Request body is malformed", request);
    }

    @ExceptionHandler(EscrowNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            EscrowNotFoundException ex, HttpServletRequest request) {
        log.warn("Escrow not found [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Escrow Not Found", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(FundingVerificationException.class)
    public ResponseEntity<ErrorResponse> handleFundingVerification(
            FundingVerificationException ex, HttpServletRequest request) {
        log.error("Funding verification exhausted for escrow {} [correlationId={}]: {}",
                ex.getEscrowId(), MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Funding Not Verified", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(LedgerSubmissionException.class)
    public ResponseEntity<ErrorResponse> handleLedgerSubmission(
            LedgerSubmissionException ex, HttpServletRequest request) {
        log.error("Ledger submission failed on {} (tx {}, retryable={}) [correlationId={}]: {}",
                ex.getConnectionName(), ex.getTxReference(), ex.isRetryable(),
                MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Ledger Submission Failed", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(StaleEscrowStateException.class)
    public ResponseEntity<ErrorResponse> handleStaleState(
            StaleEscrowStateException ex, HttpServletRequest request) {
        log.warn("Stale escrow state [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "State Conflict", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(EscrowConsistencyException.class)
    public ResponseEntity<ErrorResponse> handleConsistency(
            EscrowConsistencyException ex, HttpServletRequest request) {
        log.error("Escrow {} inconsistent with ledger [correlationId={}]: {}",
                ex.getEscrowId(), MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Consistency Hold", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(ReconciliationInProgressException.class)
    public ResponseEntity<ErrorResponse> handleReconciliationInProgress(
            ReconciliationInProgressException ex, HttpServletRequest request) {
        log.warn("Reconciliation refused [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Reconciliation In Progress", ex.getStep(), ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Illegal argument [correlationId={}]: {}", MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", FailureStep.VALIDATION, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Unexpected error [correlationId={}]", correlationId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
                "An unexpected error occurred. Please contact support with reference: " + correlationId, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, FailureStep step,
                                                  String message, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(
                status.value(),
                error,
                step != null ? step.getCode() : null,
                message,
                request.getRequestURI()
        );
        body.setReference(MDC.get(CorrelationIdFilter.MDC_KEY));
        return ResponseEntity.status(status).body(body);
    }
}
