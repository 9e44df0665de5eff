package com.example.truingup.api;

import com.example.truingup.dto.ErrorResponse;
import com.example.truingup.engine.exception.AuditRecordNotFoundException;
import com.example.truingup.engine.exception.CostInputValidationException;
import com.example.truingup.engine.exception.HumanVerificationRequiredException;
import com.example.truingup.engine.exception.RuleSetNotFoundException;
import com.example.truingup.engine.exception.ScenarioNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;

/**
 * Maps engine failures to client-facing statuses. The message text is passed through unchanged:
 * it names the clause or the value a reviewer has to act on.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CostInputValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(CostInputValidationException ex) {
        log.warn("Invalid cost input: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Cost Input", ex.getMessage());
    }

    @ExceptionHandler(HumanVerificationRequiredException.class)
    public ResponseEntity<ErrorResponse> handleVerification(HumanVerificationRequiredException ex) {
        log.warn("Verification required: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Human Verification Required", ex.getMessage());
    }

    @ExceptionHandler({RuleSetNotFoundException.class, ScenarioNotFoundException.class,
            AuditRecordNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
