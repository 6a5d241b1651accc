package com.flamingo.ai.dossier.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CONFIG_INVALID = "CONFIG_001";
  public static final String DOSSIER_EMPTY = "DOSSIER_001";
  public static final String DOSSIER_NO_OUTPUT = "DOSSIER_002";
  public static final String DOSSIER_INVALID_SELECTION = "DOSSIER_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Offending config field, when known. */
  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
