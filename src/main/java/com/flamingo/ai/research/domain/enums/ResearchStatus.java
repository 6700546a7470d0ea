package com.flamingo.ai.research.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle status of a research run.
 *
 * <p>Normal path: IDLE, GENERATING_QUERIES, SEARCHING, GRADING, then either back to
 * GENERATING_QUERIES or on to SYNTHESIZING and COMPLETE. ERROR is reachable from any state.
 */
public enum ResearchStatus {
  IDLE,
  GENERATING_QUERIES,
  SEARCHING,
  GRADING,
  /** Kept for wire compatibility with existing clients; the workflow never sets it. */
  REWRITING,
  SYNTHESIZING,
  COMPLETE,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
