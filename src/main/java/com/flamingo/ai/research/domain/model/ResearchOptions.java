package com.flamingo.ai.research.domain.model;

/**
 * Per-request overrides for a research run. Any {@code null} component falls back to the
 * configured default.
 */
public record ResearchOptions(
    Integer maxIterations,
    Double qualityThreshold,
    Integer minRelevantDocs,
    Integer queriesPerIteration) {

  public ResearchOptions(Integer maxIterations, Double qualityThreshold, Integer minRelevantDocs) {
    this(maxIterations, qualityThreshold, minRelevantDocs, null);
  }

  public static ResearchOptions defaults() {
    return new ResearchOptions(null, null, null, null);
  }
}
