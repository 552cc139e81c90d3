package com.suraksha.safetymonitor.exception;

import com.suraksha.safetymonitor.dto.ApiResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every failure to {success:false, code, message, data} with the HTTP
 * status implied by its ErrorCode.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SafetyException.class)
    public ResponseEntity<ApiResponse> handleSafetyException(SafetyException ex) {
        ErrorCode code = ex.getErrorCode();
        if (code == ErrorCode.STORAGE_UNAVAILABLE) {
            log.error("Storage unavailable: {}", ex.getMessage(), ex);
        } else {
            log.warn("Request rejected [{}]: {}", code, ex.getMessage());
        }
        return build(code, ex.getMessage(), null);
    }

    /**
     * Bean Validation failures on request bodies
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("Validation failed: {}", errors);
        return build(ErrorCode.VALIDATION_ERROR, "Validation failed", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse> handleConstraintViolation(ConstraintViolationException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(v -> errors.put(v.getPropertyPath().toString(), v.getMessage()));
        log.warn("Validation failed: {}", errors);
        return build(ErrorCode.VALIDATION_ERROR, "Validation failed", errors);
    }

    /**
     * Unparseable JSON, or a non-numeric value in a numeric field
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return build(ErrorCode.VALIDATION_ERROR, "Malformed request body", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad value for '{}': {}", ex.getName(), ex.getValue());
        return build(ErrorCode.VALIDATION_ERROR, "Invalid value for '" + ex.getName() + "'", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing parameter '{}'", ex.getParameterName());
        return build(ErrorCode.VALIDATION_ERROR, "Missing parameter '" + ex.getParameterName() + "'", null);
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleGenericException(Exception ex) {
        // Spring MVC's own errors (unknown route, wrong method, unsupported media type) keep their status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            ErrorCode code = status.value() == 404 ? ErrorCode.NOT_FOUND
                    : status.is4xxClientError() ? ErrorCode.VALIDATION_ERROR : ErrorCode.INTERNAL_ERROR;
            log.warn("Request rejected by MVC [{}]: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(ApiResponse.error(code.name(), ex.getMessage()));
        }
        log.error("Unexpected error occurred", ex);
        return build(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiResponse> build(ErrorCode code, String message, Object data) {
        ApiResponse body = ApiResponse.builder()
                .success(false)
                .code(code.name())
                .message(message)
                .data(data)
                .build();
        return ResponseEntity.status(code.getStatus()).body(body);
    }

}
