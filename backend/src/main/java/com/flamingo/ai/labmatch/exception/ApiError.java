package com.flamingo.ai.labmatch.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_CONFIGURATION = "CONFIG_001";
  public static final String UNKNOWN_PRESET = "CONFIG_002";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String CORPUS_RELOAD_FAILED = "CORPUS_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
