package com.flamingo.ai.research.exception;

/** Exception thrown when the language model backend fails. */
public class LlmServiceException extends RuntimeException {

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
