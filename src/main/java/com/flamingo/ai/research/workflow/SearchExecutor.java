package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.ResearchQuery;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.exception.SearchException;
import com.flamingo.ai.research.service.search.SearchBackend;
import io.micrometer.core.annotation.Timed;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs every query of the current iteration against the search backend in parallel and merges
 * the results, deduplicated by url.
 *
 * <p>A failure of any single query fails the stage.
 */
@Component
@Slf4j
public class SearchExecutor implements ResearchNode {

  public static final String NAME = "search";

  private final SearchBackend searchBackend;
  private final Executor searchExecutor;
  private final long timeoutMs;

  public SearchExecutor(
      SearchBackend searchBackend,
      @Qualifier("searchExecutor") Executor searchExecutor,
      ResearchConfig researchConfig) {
    this.searchBackend = searchBackend;
    this.searchExecutor = searchExecutor;
    this.timeoutMs = researchConfig.getSearch().getTimeoutMs();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  @Timed(value = "research.node.search", description = "Time to run an iteration's searches")
  public StateUpdate apply(ResearchState state) {
    List<ResearchQuery> queries = state.currentQueries();

    List<CompletableFuture<List<SearchDocument>>> futures =
        queries.stream()
            .map(
                query ->
                    CompletableFuture.supplyAsync(() -> runQuery(query.text()), searchExecutor)
                        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
            .toList();

    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException e) {
      throw toSearchException(e.getCause() != null ? e.getCause() : e);
    }

    // Joined in query order so first-seen is deterministic
    Map<String, SearchDocument> unique = new LinkedHashMap<>();
    for (CompletableFuture<List<SearchDocument>> future : futures) {
      for (SearchDocument doc : future.join()) {
        if (doc.url() == null || doc.url().isBlank()) {
          log.debug("Skipping search result without url: {}", doc.title());
          continue;
        }
        unique.putIfAbsent(doc.url(), doc);
      }
    }

    Set<String> known =
        state.getSearchResults().stream().map(SearchDocument::url).collect(Collectors.toSet());
    long newCount = unique.keySet().stream().filter(url -> !known.contains(url)).count();

    log.debug(
        "Iteration {}: {} unique results ({} new) from {} queries",
        state.getIteration(),
        unique.size(),
        newCount,
        queries.size());

    return StateUpdate.builder()
        .searchResults(unique.values())
        .status(ResearchStatus.SEARCHING)
        .log(
            String.format(
                "Found %d unique documents from %d queries (%d new)",
                unique.size(), queries.size(), newCount))
        .build();
  }

  private List<SearchDocument> runQuery(String query) {
    List<SearchDocument> results = searchBackend.search(query);
    return results != null ? results : List.of();
  }

  private static SearchException toSearchException(Throwable cause) {
    if (cause instanceof SearchException searchException) {
      return searchException;
    }
    if (cause instanceof TimeoutException) {
      return new SearchException("Search timed out", cause);
    }
    return new SearchException("Search failed: " + cause.getMessage(), cause);
  }
}
