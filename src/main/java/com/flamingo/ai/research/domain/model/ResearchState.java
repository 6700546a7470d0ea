package com.flamingo.ai.research.domain.model;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a research session. Each workflow node reads one snapshot and returns a
 * {@link StateUpdate}; the engine produces the next snapshot by merging the two.
 */
@Value
@Builder(toBuilder = true)
public class ResearchState {

  String topic;

  @Builder.Default List<ResearchQuery> queries = List.of();

  /** Unique by url, in first-seen order. */
  @Builder.Default List<SearchDocument> searchResults = List.of();

  /** One entry per graded url. */
  @Builder.Default List<GradedDocument> gradedDocuments = List.of();

  /** The subset of {@link #gradedDocuments} with {@code isRelevant = true}. */
  @Builder.Default List<GradedDocument> relevantDocuments = List.of();

  int iteration;
  int maxIterations;
  boolean needsMoreResearch;
  double qualityThreshold;
  int minRelevantDocs;
  int queriesPerIteration;

  @Builder.Default String synthesis = "";
  @Builder.Default ResearchStatus status = ResearchStatus.IDLE;
  String error;

  @Builder.Default List<String> logs = List.of();

  /** Creates the seed state for a new session. */
  public static ResearchState initial(
      String topic,
      int maxIterations,
      double qualityThreshold,
      int minRelevantDocs,
      int queriesPerIteration) {
    return ResearchState.builder()
        .topic(topic)
        .maxIterations(maxIterations)
        .qualityThreshold(qualityThreshold)
        .minRelevantDocs(minRelevantDocs)
        .queriesPerIteration(queriesPerIteration)
        .needsMoreResearch(true)
        .logs(List.of("Starting research on: \"" + topic + "\""))
        .build();
  }

  /** Queries generated for the iteration currently in progress. */
  public List<ResearchQuery> currentQueries() {
    return queries.stream().filter(q -> q.iteration() == iteration).toList();
  }
}
