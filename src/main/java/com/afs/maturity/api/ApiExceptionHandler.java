package com.afs.maturity.api;

import com.afs.maturity.error.AssessmentStateException;
import com.afs.maturity.error.IncompleteAssessmentException;
import com.afs.maturity.error.NotFoundException;
import com.afs.maturity.error.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), Map.of("entity", ex.getEntity(), "id", ex.getId()));
    }

    @ExceptionHandler(AssessmentStateException.class)
    public ResponseEntity<Map<String, Object>> handleState(AssessmentStateException ex) {
        return body(HttpStatus.CONFLICT, "invalid_state", ex.getMessage(), Map.of("status", ex.getStatus().name()));
    }

    @ExceptionHandler(IncompleteAssessmentException.class)
    public ResponseEntity<Map<String, Object>> handleIncomplete(IncompleteAssessmentException ex) {
        return body(HttpStatus.CONFLICT, "incomplete", ex.getMessage(), ex.getCompletion());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "validation_failed", ex.getMessage(), ex.getIssues());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
