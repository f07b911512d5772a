package com.flamingo.ai.ragdocs.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(VectorStoreConnectionException.class)
  public ResponseEntity<ApiError> handleStoreUnreachable(
      VectorStoreConnectionException ex, HttpServletRequest request) {

    incrementErrorCounter("store_unreachable");
    String errorId = generateErrorId();
    log.error("Vector store unreachable [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORE_UNREACHABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {

    incrementErrorCounter("storage_error");
    String errorId = generateErrorId();
    log.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORAGE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(SchemaException.class)
  public ResponseEntity<ApiError> handleSchema(SchemaException ex, HttpServletRequest request) {

    incrementErrorCounter("schema_error");
    String errorId = generateErrorId();
    log.error("Schema error [{}] on index {}: {}", errorId, ex.getIndexName(), ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.SCHEMA_ERROR,
        "The document index is not usable. Check the server logs.",
        request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("circuit_open");
    String errorId = generateErrorId();
    log.warn("Circuit breaker open [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORE_CIRCUIT_OPEN,
        "Service is temporarily busy. Please try again in a moment.",
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_rejected");
    String errorId = generateErrorId();
    log.warn("Search rejected [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.SEARCH_REJECTED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
