package com.ridematch.dispatch.controller;

import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class DispatchExceptionHandler {

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleDispatchException(DispatchException ex) {
        log.warn("Dispatch error [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(statusOf(ex.getCode()))
                .body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        log.info("Concurrent update rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error("CONCURRENT_UPDATE", "Resource was modified concurrently, retry"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(f -> f + " is invalid")
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }

    private static HttpStatus statusOf(String code) {
        return switch (code) {
            case "DRIVER_NOT_FOUND", "RIDE_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "DRIVER_SUSPENDED", "RIDE_NOT_OPEN"  -> HttpStatus.CONFLICT;
            case "SERVICE_UNAVAILABLE"                -> HttpStatus.SERVICE_UNAVAILABLE;
            default                                   -> HttpStatus.BAD_REQUEST;
        };
    }
}
