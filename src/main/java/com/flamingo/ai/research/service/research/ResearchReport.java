package com.flamingo.ai.research.service.research;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchState;
import java.util.List;

/**
 * Externally visible summary of a finished research run, derived from its terminal state.
 *
 * @param topic researched topic
 * @param status terminal status
 * @param synthesis the report text, empty when the run failed
 * @param error failure cause, {@code null} on success
 * @param stats aggregate counters
 * @param sources relevant documents for citation, in grading order
 * @param logs human-readable trace of the run
 */
public record ResearchReport(
    String topic,
    ResearchStatus status,
    String synthesis,
    String error,
    Stats stats,
    List<Source> sources,
    List<String> logs) {

  public static ResearchReport from(ResearchState state) {
    Stats stats =
        new Stats(
            state.getIteration() + 1,
            state.getQueries().size(),
            state.getSearchResults().size(),
            state.getGradedDocuments().size(),
            state.getRelevantDocuments().size());
    List<Source> sources = state.getRelevantDocuments().stream().map(Source::from).toList();
    return new ResearchReport(
        state.getTopic(),
        state.getStatus(),
        state.getStatus() == ResearchStatus.ERROR ? "" : state.getSynthesis(),
        state.getError(),
        stats,
        sources,
        state.getLogs());
  }

  public boolean isSuccessful() {
    return status == ResearchStatus.COMPLETE;
  }

  /** Aggregate counters for a run. */
  public record Stats(
      int iterations,
      int queriesGenerated,
      int documentsSearched,
      int documentsGraded,
      int relevantDocuments) {}

  /** A cited source. */
  public record Source(String title, String url, double relevanceScore) {

    static Source from(GradedDocument doc) {
      return new Source(doc.document().title(), doc.url(), doc.relevanceScore());
    }
  }
}
