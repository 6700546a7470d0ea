package com.flamingo.ai.research.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body returned when a research request is rejected or cannot be served. A run that starts
 * and then fails is reported through its {@code ResearchReport} instead.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Correlates the response with the server log line. */
  private final String errorId;

  private final String code;

  private final String message;

  /** Offending request field for validation errors, e.g. {@code config.maxIterations}. */
  private final String field;

  private final Instant timestamp;

  private final String path;
}
