package com.snuffles.lotledger.web.error;

import com.snuffles.lotledger.service.exception.DuplicateTransactionException;
import com.snuffles.lotledger.service.exception.InsufficientLotsException;
import com.snuffles.lotledger.service.exception.PriceNotFoundException;
import com.snuffles.lotledger.service.exception.ResourceNotFoundException;
import com.snuffles.lotledger.service.exception.StorageException;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.web.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
        return clientError(HttpStatus.BAD_REQUEST, "Validation failed", details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<String> details = ex.getConstraintViolations().stream()
            .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
            .toList();
        return clientError(HttpStatus.BAD_REQUEST, "Validation failed", details, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return clientError(HttpStatus.BAD_REQUEST, "Malformed request", List.of(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex, HttpServletRequest request) {
        return clientError(HttpStatus.BAD_REQUEST, "Malformed request", List.of(ex.getParameterName() + ": is required"), request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException ex, HttpServletRequest request) {
        return clientError(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler({ResourceNotFoundException.class, PriceNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        return clientError(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(DuplicateTransactionException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateTransactionException ex, HttpServletRequest request) {
        return clientError(
            HttpStatus.CONFLICT,
            ex.getMessage(),
            List.of("existingTransactionId: " + ex.getExistingTransactionId()),
            request
        );
    }

    @ExceptionHandler(InsufficientLotsException.class)
    public ResponseEntity<ApiError> handleInsufficientLots(InsufficientLotsException ex, HttpServletRequest request) {
        return clientError(
            HttpStatus.UNPROCESSABLE_ENTITY,
            ex.getMessage(),
            List.of(
                "requested: " + ex.getRequested().toPlainString(),
                "available: " + ex.getAvailable().toPlainString()
            ),
            request
        );
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {
        log.error("{} {} -> storage failure", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(body(HttpStatus.SERVICE_UNAVAILABLE, "Ledger storage unavailable", List.of(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} -> unexpected error", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", List.of(), request));
    }

    private ResponseEntity<ApiError> clientError(HttpStatus status, String message, List<String> details, HttpServletRequest request) {
        log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        return ResponseEntity.status(status).body(body(status, message, details, request));
    }

    private ApiError body(HttpStatus status, String message, List<String> details, HttpServletRequest request) {
        return ApiError.builder()
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .details(details)
            .build();
    }
}
