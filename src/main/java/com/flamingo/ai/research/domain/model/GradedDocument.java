package com.flamingo.ai.research.domain.model;

/**
 * A search document with its relevance verdict.
 *
 * @param document the graded document
 * @param relevanceScore score in [0, 1]
 * @param reasoning short explanation from the grader
 * @param isRelevant whether the score met the run's quality threshold
 */
public record GradedDocument(
    SearchDocument document, double relevanceScore, String reasoning, boolean isRelevant) {

  public String url() {
    return document.url();
  }
}
