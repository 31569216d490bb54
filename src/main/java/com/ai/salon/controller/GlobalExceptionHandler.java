package com.ai.salon.controller;

import com.ai.salon.dto.ErrorResponse;
import com.ai.salon.exception.ErrorKind;
import com.ai.salon.exception.ReceptionistException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ReceptionistException.class)
    public ResponseEntity<ErrorResponse> handleReceptionist(ReceptionistException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("{}: {}", e.getKind(), e.getMessage(), e);
        } else {
            log.debug("{}: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getKind().name(), e.getMessage()));
    }

    /**
     * Store failures that escape the services, such as a commit that cannot reach the
     * database or a pool with no connection to hand out.
     */
    @ExceptionHandler({DataAccessResourceFailureException.class, TransientDataAccessException.class,
            CannotCreateTransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(Exception e) {
        log.error("Data store unavailable: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(ErrorKind.DEPENDENCY_UNAVAILABLE.name(), "Data store unavailable"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR.name(),
                "Request validation failed", Map.of("fieldErrors", fieldErrors)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR.name(), "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
            case CAPACITY_ERROR:
                return HttpStatus.CONFLICT;
            case DEPENDENCY_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case CORRUPT_RECORD:
                return HttpStatus.INTERNAL_SERVER_ERROR;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }
}
