package com.flamingo.ai.deepresearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ResearchSessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      ResearchSessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Research session not found [{}]: {}", errorId, ex.getSessionId());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SESSION_NOT_FOUND,
        "Research session not found",
        request);
  }

  @ExceptionHandler(HistoryRecordNotFoundException.class)
  public ResponseEntity<ApiError> handleHistoryNotFound(
      HistoryRecordNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("history_not_found");
    String errorId = generateErrorId();
    log.warn("History record not found [{}]: {}", errorId, ex.getSessionId());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.HISTORY_NOT_FOUND,
        "History record not found",
        request);
  }

  @ExceptionHandler(ResearchConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ResearchConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration_error");
    String errorId = generateErrorId();
    log.warn("Research configuration error [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.CONFIGURATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiError> handleProvider(ProviderException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "provider_rate_limited" : "provider_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("Provider error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE, errorId, providerCode(ex), ex.getUserMessage(), request);
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ApiError> handleRejected(
      TaskRejectedException ex, HttpServletRequest request) {

    incrementErrorCounter("session_rejected");
    String errorId = generateErrorId();
    log.warn("Research session rejected [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SESSION_REJECTED,
        "Too many research sessions are running. Please try again later.",
        request);
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ApiError> handleStore(StoreException ex, HttpServletRequest request) {

    incrementErrorCounter("history_store_error");
    String errorId = generateErrorId();
    log.error("History store error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.HISTORY_STORE_ERROR,
        "The research history store failed. Please try again later.",
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

  @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<ApiError> handleBadArgument(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid argument [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
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

  private static String providerCode(ProviderException ex) {
    if (ex instanceof SearchException) {
      return ApiError.SEARCH_FAILED;
    }
    if (ex instanceof EmbeddingException) {
      return ApiError.EMBEDDING_FAILED;
    }
    return ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
  }

  private static ResponseEntity<ApiError> error(
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
