package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.service.llm.GradeResponseParser;
import com.flamingo.ai.research.service.llm.RelevanceModel;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Scores every not-yet-graded search result against the topic.
 *
 * <p>Each document is graded independently and in parallel. A document whose grading call fails,
 * times out, is rejected by a saturated pool or returns an unusable reply is kept with a fixed low
 * score instead of being dropped, so one bad call never fails the run.
 */
@Component
@Slf4j
public class RelevanceGrader implements ResearchNode {

  public static final String NAME = "grade";

  static final String FALLBACK_REASONING = "Failed to grade document";

  private final RelevanceModel relevanceModel;
  private final GradeResponseParser parser;
  private final Executor gradingExecutor;
  private final MeterRegistry meterRegistry;
  private final double fallbackScore;
  private final long timeoutMs;

  public RelevanceGrader(
      RelevanceModel relevanceModel,
      GradeResponseParser parser,
      @Qualifier("gradingExecutor") Executor gradingExecutor,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry) {
    this.relevanceModel = relevanceModel;
    this.parser = parser;
    this.gradingExecutor = gradingExecutor;
    this.meterRegistry = meterRegistry;
    this.fallbackScore = researchConfig.getGrading().getFallbackScore();
    this.timeoutMs = researchConfig.getGrading().getTimeoutMs();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  @Timed(value = "research.node.grade", description = "Time to grade new documents")
  public StateUpdate apply(ResearchState state) {
    Set<String> gradedUrls =
        state.getGradedDocuments().stream()
            .map(GradedDocument::url)
            .collect(Collectors.toSet());
    List<SearchDocument> newDocuments =
        state.getSearchResults().stream().filter(doc -> !gradedUrls.contains(doc.url())).toList();

    if (newDocuments.isEmpty()) {
      log.debug("No new documents to grade for '{}'", state.getTopic());
      return StateUpdate.builder()
          .status(ResearchStatus.GRADING)
          .log("No new documents to grade")
          .build();
    }

    double threshold = state.getQualityThreshold();
    List<CompletableFuture<GradedDocument>> futures =
        newDocuments.stream().map(doc -> submit(state.getTopic(), doc, threshold)).toList();

    List<GradedDocument> graded = futures.stream().map(CompletableFuture::join).toList();
    List<GradedDocument> relevant = graded.stream().filter(GradedDocument::isRelevant).toList();
    long failed =
        graded.stream().filter(doc -> FALLBACK_REASONING.equals(doc.reasoning())).count();

    log.debug(
        "Graded {} documents for '{}': {} relevant, {} fallbacks",
        graded.size(),
        state.getTopic(),
        relevant.size(),
        failed);

    StateUpdate.StateUpdateBuilder update =
        StateUpdate.builder()
            .gradedDocuments(graded)
            .relevantDocuments(relevant)
            .status(ResearchStatus.GRADING)
            .log(String.format("Graded %d documents:", graded.size()))
            .log(String.format("  ✓ %d relevant (score >= %s)", relevant.size(), threshold))
            .log(String.format("  ✗ %d not relevant", graded.size() - relevant.size()));
    if (failed > 0) {
      update.log(
          String.format(
              "  ! %d could not be graded and were scored %s", failed, fallbackScore));
    }
    return update.build();
  }

  private CompletableFuture<GradedDocument> submit(
      String topic, SearchDocument doc, double threshold) {
    try {
      return CompletableFuture.supplyAsync(() -> grade(topic, doc, threshold), gradingExecutor)
          .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
          .exceptionally(e -> fallback(doc, e));
    } catch (RejectedExecutionException e) {
      log.warn("Grading pool rejected {}: {}, using fallback score", doc.url(), e.getMessage());
      return CompletableFuture.completedFuture(fallbackDocument(doc));
    }
  }

  private GradedDocument grade(String topic, SearchDocument doc, double threshold) {
    String response = relevanceModel.grade(topic, doc);
    return parser
        .parse(response)
        .map(
            grade ->
                new GradedDocument(
                    doc, grade.score(), grade.reasoning(), grade.score() >= threshold))
        .orElseGet(
            () -> {
              log.warn("Unparseable grade for {}, using fallback score", doc.url());
              return fallbackDocument(doc);
            });
  }

  private GradedDocument fallback(SearchDocument doc, Throwable error) {
    Throwable cause = error.getCause() != null ? error.getCause() : error;
    log.warn("Grading failed for {}: {}, using fallback score", doc.url(), cause.toString());
    return fallbackDocument(doc);
  }

  private GradedDocument fallbackDocument(SearchDocument doc) {
    meterRegistry.counter("research.grading.fallback").increment();
    return new GradedDocument(doc, fallbackScore, FALLBACK_REASONING, false);
  }
}
