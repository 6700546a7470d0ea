package com.flamingo.ai.research.exception;

/** Exception thrown when the web search backend fails. */
public class SearchException extends RuntimeException {

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
