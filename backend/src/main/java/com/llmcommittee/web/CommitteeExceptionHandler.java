package com.llmcommittee.web;

import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.service.CriteriaGenerationException;
import com.llmcommittee.service.JudgingFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class CommitteeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CommitteeExceptionHandler.class);

    @ExceptionHandler(JudgingFailureException.class)
    public ResponseEntity<JudgingErrorResponse> handleJudgingFailure(JudgingFailureException ex) {
        log.warn("Judging failed ({}): {}", ex.getType().code(), ex.getMessage());
        return ResponseEntity
                .status(ex.getType().status())
                .body(new JudgingErrorResponse(ex.getType().code(), ex.getMessage(), ex.getResponses()));
    }

    @ExceptionHandler(CriteriaGenerationException.class)
    public ResponseEntity<CommitteeErrorResponse> handleCriteriaGeneration(CriteriaGenerationException ex) {
        log.warn("Criteria generation failed: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new CommitteeErrorResponse("criteria_generation_failed", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<CommitteeErrorResponse> handleInvalidRequest(IllegalArgumentException ex) {
        return ResponseEntity
                .badRequest()
                .body(new CommitteeErrorResponse("invalid_request", ex.getMessage()));
    }

    /**
     * Field errors keep the first message per field, keyed by binding path
     * (for example {@code criteria.items[0].weight}).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleInvalidFields(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError ->
                fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage())
        );
        String detail = fieldErrors.isEmpty()
                ? "Invalid committee request"
                : "Invalid committee request: " + String.join("; ", fieldErrors.values());
        return ResponseEntity
                .badRequest()
                .body(new ValidationErrorResponse("invalid_fields", detail, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
                .badRequest()
                .body(new ValidationErrorResponse("malformed_request", "Malformed request body", Map.of()));
    }

    public record JudgingErrorResponse(
            String code,
            String error,
            List<AssembledResponse> responses
    ) {
    }

    public record CommitteeErrorResponse(
            String code,
            String error
    ) {
    }

    public record ValidationErrorResponse(
            String code,
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
