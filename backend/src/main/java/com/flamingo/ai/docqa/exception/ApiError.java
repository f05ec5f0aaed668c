package com.flamingo.ai.docqa.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_002";
  public static final String PROVIDER_UNAVAILABLE = "PROVIDER_001";
  public static final String PROVIDER_RATE_LIMITED = "PROVIDER_002";
  public static final String PIPELINE_FAILED = "RAG_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MISSING_OWNER = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
