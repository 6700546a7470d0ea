package com.flamingo.ai.research.service.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.model.SearchDocument;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MockSearchBackend Tests")
class MockSearchBackendTest {

  private final MockSearchBackend backend = new MockSearchBackend(new ResearchConfig());

  @Test
  @DisplayName("Should return keyword-specific documents")
  void shouldMatchKeywordBucket() {
    List<SearchDocument> results = backend.search("What is LangChain?");

    assertThat(results).hasSize(3);
    assertThat(results).allMatch(doc -> doc.url().contains("langchain"));
    assertThat(results.get(0).title())
        .isEqualTo("LangChain Documentation - \"What is LangChain?\"");
    assertThat(results.get(0).snippet()).endsWith("Related to your search: What is LangChain?");
  }

  @Test
  @DisplayName("Should fall back to generic documents for unknown topics")
  void shouldUseDefaultBucket() {
    List<SearchDocument> results = backend.search("quantum computing");

    assertThat(results)
        .extracting(SearchDocument::url)
        .containsExactly(
            "https://example.com/intro",
            "https://example.com/advanced",
            "https://example.com/best-practices");
    assertThat(results.get(0).snippet())
        .endsWith("Relevant information about: quantum computing");
  }

  @Test
  @DisplayName("Should keep urls stable across queries")
  void shouldKeepStableUrls() {
    assertThat(backend.search("machine learning basics"))
        .extracting(SearchDocument::url)
        .isEqualTo(
            backend.search("advanced machine learning").stream().map(SearchDocument::url).toList());
  }

  @Test
  @DisplayName("Should return nothing for a blank query")
  void shouldHandleBlankQuery() {
    assertThat(backend.search(" ")).isEmpty();
  }
}
