package com.retail.billkeeper.config;

import com.retail.billkeeper.exception.AggregationFailureException;
import com.retail.billkeeper.exception.EmptyDocumentException;
import com.retail.billkeeper.exception.InsufficientStockException;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.exception.NumberGenerationExhaustedException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        logger.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing));
        logger.warn("Validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({ InvalidAmountException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        logger.warn("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(EmptyDocumentException.class)
    public ResponseEntity<ApiError> handleEmptyDocument(EmptyDocumentException e) {
        logger.warn("Rejected empty document: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Empty Document", e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiError> handleInsufficientStock(InsufficientStockException e) {
        logger.warn("Rejected for stock: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Insufficient Stock", e.getMessage(),
                Map.of("itemCode", e.getItemCode(),
                        "available", String.valueOf(e.getAvailable()),
                        "requested", String.valueOf(e.getRequested())));
    }

    @ExceptionHandler({ IllegalStateException.class, ConcurrencyFailureException.class,
            DataIntegrityViolationException.class })
    public ResponseEntity<ApiError> handleConflict(RuntimeException e) {
        logger.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getMessage(), null);
    }

    @ExceptionHandler(NumberGenerationExhaustedException.class)
    public ResponseEntity<ApiError> handleNumberingExhausted(NumberGenerationExhaustedException e) {
        logger.error("Numbering exhausted for series {} after {} attempts", e.getPrefix(), e.getAttempts());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Numbering Busy", e.getMessage(), null);
    }

    @ExceptionHandler(AggregationFailureException.class)
    public ResponseEntity<ApiError> handleAggregationFailure(AggregationFailureException e) {
        // Already logged with its cause where it was raised
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Totals Not Updated",
                "The change was rolled back because totals could not be recomputed", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e) {
        logger.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
            Map<String, String> details) {
        ApiError body = ApiError.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @Value
    @Builder
    public static class ApiError {
        int status;
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
