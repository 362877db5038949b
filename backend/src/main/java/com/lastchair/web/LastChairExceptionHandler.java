package com.lastchair.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every rejected match operation as {@code {kind, code, message}} so clients can tell
 * a stake mismatch from a duplicate reveal without parsing messages.
 */
@RestControllerAdvice
public class LastChairExceptionHandler {

    @ExceptionHandler(LastChairException.class)
    public ResponseEntity<LastChairErrorResponse> handle(LastChairException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new LastChairErrorResponse(ex.getKind(), ex.getCode(), ex.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<LastChairErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError ->
                fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage())
        );

        String message = fieldErrors.isEmpty()
                ? "Request validation failed"
                : "Request validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity
                .status(ErrorKind.VALIDATION.status())
                .body(new LastChairErrorResponse(ErrorKind.VALIDATION, "invalid_request", message, fieldErrors));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LastChairErrorResponse(
            ErrorKind kind,
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
