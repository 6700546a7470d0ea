package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.domain.model.StateUpdate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Applies a node's {@link StateUpdate} to a snapshot.
 *
 * <ul>
 *   <li>queries, logs: appended
 *   <li>searchResults: union by url, first seen wins
 *   <li>gradedDocuments: appended, skipping urls that are already graded
 *   <li>relevantDocuments: appended, only relevant entries whose url is not yet present
 *   <li>iteration, needsMoreResearch, synthesis, status, error: replaced when set
 * </ul>
 */
@Component
public class StateMerger {

  public ResearchState merge(ResearchState state, StateUpdate update) {
    ResearchState.ResearchStateBuilder next = state.toBuilder();

    if (!update.getQueries().isEmpty()) {
      next.queries(concat(state.getQueries(), update.getQueries()));
    }
    if (!update.getSearchResults().isEmpty()) {
      next.searchResults(unionByUrl(state.getSearchResults(), update.getSearchResults()));
    }
    if (!update.getGradedDocuments().isEmpty()) {
      next.gradedDocuments(
          appendNewUrls(state.getGradedDocuments(), update.getGradedDocuments(), false));
    }
    if (!update.getRelevantDocuments().isEmpty()) {
      next.relevantDocuments(
          appendNewUrls(state.getRelevantDocuments(), update.getRelevantDocuments(), true));
    }
    if (!update.getLogs().isEmpty()) {
      next.logs(concat(state.getLogs(), update.getLogs()));
    }

    if (update.getIteration() != null) {
      next.iteration(update.getIteration());
    }
    if (update.getNeedsMoreResearch() != null) {
      next.needsMoreResearch(update.getNeedsMoreResearch());
    }
    if (update.getSynthesis() != null) {
      next.synthesis(update.getSynthesis());
    }
    if (update.getStatus() != null) {
      next.status(update.getStatus());
    }
    if (update.getError() != null) {
      next.error(update.getError());
    }
    return next.build();
  }

  private static <T> List<T> concat(List<T> current, List<T> additions) {
    List<T> merged = new ArrayList<>(current.size() + additions.size());
    merged.addAll(current);
    merged.addAll(additions);
    return List.copyOf(merged);
  }

  private static List<SearchDocument> unionByUrl(
      List<SearchDocument> current, List<SearchDocument> additions) {
    Map<String, SearchDocument> byUrl = new LinkedHashMap<>();
    current.forEach(doc -> byUrl.putIfAbsent(doc.url(), doc));
    additions.forEach(doc -> byUrl.putIfAbsent(doc.url(), doc));
    return List.copyOf(byUrl.values());
  }

  private static List<GradedDocument> appendNewUrls(
      List<GradedDocument> current, List<GradedDocument> additions, boolean relevantOnly) {
    Set<String> seen = new HashSet<>();
    current.forEach(doc -> seen.add(doc.url()));
    List<GradedDocument> merged = new ArrayList<>(current);
    for (GradedDocument doc : additions) {
      if (relevantOnly && !doc.isRelevant()) {
        continue;
      }
      if (seen.add(doc.url())) {
        merged.add(doc);
      }
    }
    return List.copyOf(merged);
  }
}
