package com.flamingo.ai.research.service.search;

import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.exception.SearchException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Web search through the Tavily API. */
@Service
@ConditionalOnProperty(name = "research.search.provider", havingValue = "tavily")
@RequiredArgsConstructor
@Slf4j
public class TavilySearchBackend implements SearchBackend {

  static final int SNIPPET_CHARS = 200;

  private final TavilySearchClient client;

  @Override
  @Timed(value = "research.search.tavily", description = "Time for one Tavily search")
  @Retry(name = "search")
  public List<SearchDocument> search(String query) {
    List<TavilySearchClient.TavilyResult> results;
    try {
      results = client.search(query);
    } catch (RuntimeException e) {
      throw new SearchException("Tavily search failed for '" + query + "': " + e.getMessage(), e);
    }

    log.debug("Tavily returned {} results for '{}'", results.size(), query);
    return results.stream()
        .filter(r -> r.url() != null && !r.url().isBlank())
        .map(TavilySearchBackend::toDocument)
        .toList();
  }

  @VisibleForTesting
  static SearchDocument toDocument(TavilySearchClient.TavilyResult result) {
    String content = result.content() != null ? result.content() : "";
    String title =
        result.title() != null && !result.title().isBlank() ? result.title() : "Untitled";
    String snippet =
        content.length() > SNIPPET_CHARS ? content.substring(0, SNIPPET_CHARS) : content;
    return new SearchDocument(title, result.url(), snippet, content.isEmpty() ? null : content);
  }
}
