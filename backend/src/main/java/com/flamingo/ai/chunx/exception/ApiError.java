package com.flamingo.ai.chunx.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_CHUNKING_OPTIONS = "CHUNKING_001";
  public static final String UNKNOWN_STRATEGY = "CHUNKING_002";
  public static final String EMBEDDING_CONTRACT_VIOLATION = "EMBEDDING_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Offending option, when the error concerns one. */
  private final String option;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
