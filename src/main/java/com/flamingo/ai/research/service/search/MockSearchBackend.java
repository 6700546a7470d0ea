package com.flamingo.ai.research.service.search;

import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.exception.SearchException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline search backend over a small keyword-indexed corpus. Results keep stable urls so that
 * repeated queries exercise deduplication, while titles and snippets mention the query.
 */
@Component
@ConditionalOnProperty(
    name = "research.search.provider",
    havingValue = "mock",
    matchIfMissing = true)
@Slf4j
public class MockSearchBackend implements SearchBackend {

  private static final String DEFAULT_BUCKET = "default";

  private static final Map<String, List<SearchDocument>> CORPUS = new LinkedHashMap<>();

  static {
    CORPUS.put(
        "langchain",
        List.of(
            new SearchDocument(
                "LangChain Documentation",
                "https://js.langchain.com/docs/",
                "Official LangChain.js documentation for building LLM applications.",
                "LangChain is a framework for developing applications powered by language models."
                    + " It enables applications that are context-aware and can reason."),
            new SearchDocument(
                "Building Agents with LangChain",
                "https://js.langchain.com/docs/modules/agents/",
                "Learn how to create autonomous agents that can use tools and make decisions.",
                "Agents use LLMs to determine which actions to take and in what order. An action"
                    + " can either be using a tool and observing its output, or returning to the"
                    + " user."),
            new SearchDocument(
                "LangGraph: Cyclic Workflows",
                "https://langchain-ai.github.io/langgraphjs/",
                "Build stateful, multi-actor applications with cyclic workflows.",
                "LangGraph extends LangChain to enable cyclical computation graphs, allowing for"
                    + " iterative refinement and multi-agent collaboration.")));
    CORPUS.put(
        "machine learning",
        List.of(
            new SearchDocument(
                "Machine Learning Fundamentals",
                "https://example.com/ml-fundamentals",
                "Core concepts of machine learning including supervised and unsupervised"
                    + " learning.",
                "Machine learning is a subset of AI that enables systems to learn and improve from"
                    + " experience without being explicitly programmed."),
            new SearchDocument(
                "Neural Networks Explained",
                "https://example.com/neural-networks",
                "Understanding how neural networks process information and learn patterns.",
                "Neural networks are computing systems inspired by the biological neural networks"
                    + " that constitute animal brains.")));
    CORPUS.put(
        DEFAULT_BUCKET,
        List.of(
            new SearchDocument(
                "Introduction to the Topic",
                "https://example.com/intro",
                "A comprehensive introduction covering the fundamental concepts and key"
                    + " principles.",
                "This article provides a thorough overview of the subject matter, explaining the"
                    + " core concepts that form the foundation of understanding in this area."),
            new SearchDocument(
                "Advanced Concepts Explained",
                "https://example.com/advanced",
                "Deep dive into advanced topics and their practical applications.",
                "Building on basic knowledge, this resource explores sophisticated techniques and"
                    + " real-world applications."),
            new SearchDocument(
                "Best Practices Guide",
                "https://example.com/best-practices",
                "Industry-standard best practices and recommendations.",
                "Learn from experts about proven methodologies and approaches that lead to"
                    + " successful outcomes in this field.")));
  }

  private final long latencyMs;

  public MockSearchBackend(ResearchConfig researchConfig) {
    this.latencyMs = researchConfig.getSearch().getMock().getLatencyMs();
    log.info("Mock search backend enabled (simulated latency {} ms)", latencyMs);
  }

  @Override
  public List<SearchDocument> search(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    simulateLatency();

    String normalized = query.toLowerCase(Locale.ROOT);
    String bucket =
        CORPUS.keySet().stream()
            .filter(keyword -> !keyword.equals(DEFAULT_BUCKET))
            .filter(normalized::contains)
            .findFirst()
            .orElse(DEFAULT_BUCKET);
    String context =
        bucket.equals(DEFAULT_BUCKET) ? "Relevant information about" : "Related to your search";

    log.debug("Mock search for '{}' matched bucket '{}'", query, bucket);
    return CORPUS.get(bucket).stream()
        .map(
            doc ->
                new SearchDocument(
                    doc.title() + " - \"" + query + "\"",
                    doc.url(),
                    doc.snippet() + " " + context + ": " + query,
                    doc.content()))
        .toList();
  }

  private void simulateLatency() {
    if (latencyMs <= 0) {
      return;
    }
    try {
      Thread.sleep(latencyMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchException("Search interrupted", e);
    }
  }
}
