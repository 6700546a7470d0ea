package com.flamingo.ai.research.exception;

/** Exception thrown when a research request is rejected before the workflow starts. */
public class ResearchValidationException extends RuntimeException {

  private final String field;

  public ResearchValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
