package com.flamingo.ai.labmatch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidScorerConfigurationException.class)
  public ResponseEntity<ApiError> handleInvalidConfiguration(
      InvalidScorerConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_configuration");
    String errorId = generateErrorId();
    log.warn(
        "Invalid scorer configuration [{}]: group={}, {}", errorId, ex.getGroup(), ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_CONFIGURATION,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(UnknownPresetException.class)
  public ResponseEntity<ApiError> handleUnknownPreset(
      UnknownPresetException ex, HttpServletRequest request) {

    incrementErrorCounter("unknown_preset");
    String errorId = generateErrorId();
    log.warn("Unknown preset [{}]: {}", errorId, ex.getPresetName());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.UNKNOWN_PRESET,
        "Unknown scoring configuration: " + ex.getPresetName(),
        request);
  }

  @ExceptionHandler(EmbeddingUnavailableException.class)
  public ResponseEntity<ApiError> handleEmbeddingUnavailable(
      EmbeddingUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding model unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CorpusReloadException.class)
  public ResponseEntity<ApiError> handleCorpusReload(
      CorpusReloadException ex, HttpServletRequest request) {

    incrementErrorCounter("corpus_reload");
    String errorId = generateErrorId();
    log.error("Corpus reload failed [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.CONFLICT, errorId, ApiError.CORPUS_RELOAD_FAILED, ex.getUserMessage(), request);
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

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed",
        request);
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
