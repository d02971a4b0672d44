package com.flamingo.ai.embellisher.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String NOTE_NOT_FOUND = "NOTE_001";
  public static final String NOTE_NOT_READY = "NOTE_002";
  public static final String NOTE_INVALID_TRANSITION = "NOTE_003";
  public static final String COMPILER_UNAVAILABLE = "COMPILE_001";
  public static final String MARKUP_REJECTED = "COMPILE_002";
  public static final String DRIVE_NOT_CONNECTED = "DRIVE_001";
  public static final String DRIVE_PROVIDER_ERROR = "DRIVE_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String AUTH_REQUIRED = "AUTH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INPUT_REJECTED = "VALIDATION_002";
  public static final String STORAGE_ERROR = "STORAGE_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as a compiler log excerpt. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
