package com.flamingo.ai.research.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.research.domain.enums.ResearchStatus;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Partial state returned by a workflow node.
 *
 * <p>List fields hold additions only: {@code queries}, {@code gradedDocuments},
 * {@code relevantDocuments} and {@code logs} are appended, {@code searchResults} is unioned by
 * url. Scalar fields replace the current value when non-null.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class StateUpdate {

  @Singular List<ResearchQuery> queries;
  @Singular List<SearchDocument> searchResults;
  @Singular List<GradedDocument> gradedDocuments;
  @Singular List<GradedDocument> relevantDocuments;
  @Singular List<String> logs;

  Integer iteration;
  Boolean needsMoreResearch;
  String synthesis;
  ResearchStatus status;
  String error;

  public static StateUpdate empty() {
    return StateUpdate.builder().build();
  }
}
