package com.flamingo.ai.research.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.exception.LlmServiceException;
import com.flamingo.ai.research.service.llm.GradeResponseParser;
import com.flamingo.ai.research.service.llm.RelevanceModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RelevanceGrader Tests")
class RelevanceGraderTest {

  private static final SearchDocument A = new SearchDocument("A", "https://a", "about a");
  private static final SearchDocument B = new SearchDocument("B", "https://b", "about b");

  @Mock private RelevanceModel relevanceModel;

  private SimpleMeterRegistry meterRegistry;
  private ResearchConfig researchConfig;
  private RelevanceGrader grader;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    researchConfig = new ResearchConfig();
    grader =
        new RelevanceGrader(
            relevanceModel,
            new GradeResponseParser(new ObjectMapper()),
            Runnable::run,
            researchConfig,
            meterRegistry);
  }

  @Test
  @DisplayName("Should mark documents at or above the threshold as relevant")
  void shouldApplyThreshold() {
    when(relevanceModel.grade("topic", A)).thenReturn("{\"score\": 0.6, \"reasoning\": \"ok\"}");
    when(relevanceModel.grade("topic", B)).thenReturn("{\"score\": 0.59, \"reasoning\": \"meh\"}");

    StateUpdate update = grader.apply(stateWith(List.of(A, B), List.of()));

    assertThat(update.getGradedDocuments()).hasSize(2);
    assertThat(update.getRelevantDocuments())
        .extracting(GradedDocument::url)
        .containsExactly("https://a");
    assertThat(update.getStatus()).isEqualTo(ResearchStatus.GRADING);
    assertThat(update.getLogs())
        .containsExactly(
            "Graded 2 documents:", "  ✓ 1 relevant (score >= 0.6)", "  ✗ 1 not relevant");
  }

  @Test
  @DisplayName("Should only grade documents that have not been graded yet")
  void shouldGradeOnlyNewDocuments() {
    GradedDocument alreadyGraded = new GradedDocument(A, 0.9, "seen", true);
    when(relevanceModel.grade("topic", B)).thenReturn("{\"score\": 0.8, \"reasoning\": \"new\"}");

    StateUpdate update = grader.apply(stateWith(List.of(A, B), List.of(alreadyGraded)));

    verify(relevanceModel, never()).grade("topic", A);
    assertThat(update.getGradedDocuments())
        .extracting(GradedDocument::url)
        .containsExactly("https://b");
  }

  @Test
  @DisplayName("Should report when there is nothing new to grade")
  void shouldHandleNothingToGrade() {
    GradedDocument alreadyGraded = new GradedDocument(A, 0.9, "seen", true);

    StateUpdate update = grader.apply(stateWith(List.of(A), List.of(alreadyGraded)));

    verify(relevanceModel, never()).grade(anyString(), any());
    assertThat(update.getGradedDocuments()).isEmpty();
    assertThat(update.getStatus()).isEqualTo(ResearchStatus.GRADING);
    assertThat(update.getLogs()).containsExactly("No new documents to grade");
  }

  @Test
  @DisplayName("Should fall back when the reply is not JSON")
  void shouldFallBackOnUnparseableReply() {
    when(relevanceModel.grade("topic", A)).thenReturn("I think this is quite relevant.");

    StateUpdate update = grader.apply(stateWith(List.of(A), List.of()));

    GradedDocument graded = update.getGradedDocuments().get(0);
    assertThat(graded.relevanceScore()).isEqualTo(0.3);
    assertThat(graded.isRelevant()).isFalse();
    assertThat(graded.reasoning()).isEqualTo(RelevanceGrader.FALLBACK_REASONING);
    assertThat(update.getRelevantDocuments()).isEmpty();
    assertThat(meterRegistry.counter("research.grading.fallback").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fall back on a model failure without failing the others")
  void shouldIsolateModelFailures() {
    when(relevanceModel.grade("topic", A))
        .thenThrow(new LlmServiceException("rate limited", new IllegalStateException("429")));
    when(relevanceModel.grade("topic", B)).thenReturn("{\"score\": 0.9, \"reasoning\": \"great\"}");

    StateUpdate update = grader.apply(stateWith(List.of(A, B), List.of()));

    assertThat(update.getGradedDocuments())
        .extracting(GradedDocument::relevanceScore)
        .containsExactly(0.3, 0.9);
    assertThat(update.getRelevantDocuments())
        .extracting(GradedDocument::url)
        .containsExactly("https://b");
    assertThat(update.getLogs()).contains("  ! 1 could not be graded and were scored 0.3");
  }

  @Test
  @DisplayName("Should fall back when grading times out")
  void shouldFallBackOnTimeout() {
    researchConfig.getGrading().setTimeoutMs(50);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      RelevanceGrader slowGrader =
          new RelevanceGrader(
              relevanceModel,
              new GradeResponseParser(new ObjectMapper()),
              pool,
              researchConfig,
              meterRegistry);
      when(relevanceModel.grade(eq("topic"), any()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(500);
                return "{\"score\": 1.0}";
              });

      StateUpdate update = slowGrader.apply(stateWith(List.of(A), List.of()));

      assertThat(update.getGradedDocuments().get(0).relevanceScore()).isEqualTo(0.3);
      assertThat(update.getGradedDocuments().get(0).isRelevant()).isFalse();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should fall back when the grading pool rejects a document")
  void shouldFallBackWhenPoolRejects() {
    AtomicInteger submissions = new AtomicInteger();
    Executor saturated =
        task -> {
          if (submissions.incrementAndGet() > 1) {
            throw new RejectedExecutionException("pool full");
          }
          task.run();
        };
    RelevanceGrader busyGrader =
        new RelevanceGrader(
            relevanceModel,
            new GradeResponseParser(new ObjectMapper()),
            saturated,
            researchConfig,
            meterRegistry);
    when(relevanceModel.grade("topic", A)).thenReturn("{\"score\": 0.9, \"reasoning\": \"great\"}");

    StateUpdate update = busyGrader.apply(stateWith(List.of(A, B), List.of()));

    verify(relevanceModel, never()).grade("topic", B);
    assertThat(update.getGradedDocuments())
        .extracting(GradedDocument::url, GradedDocument::relevanceScore)
        .containsExactly(tuple("https://a", 0.9), tuple("https://b", 0.3));
    assertThat(update.getGradedDocuments().get(1).reasoning())
        .isEqualTo(RelevanceGrader.FALLBACK_REASONING);
    assertThat(update.getLogs()).contains("  ! 1 could not be graded and were scored 0.3");
    assertThat(meterRegistry.counter("research.grading.fallback").count()).isEqualTo(1.0);
  }

  private static ResearchState stateWith(
      List<SearchDocument> results, List<GradedDocument> graded) {
    return ResearchState.initial("topic", 3, 0.6, 3, 3).toBuilder()
        .searchResults(results)
        .gradedDocuments(graded)
        .relevantDocuments(graded.stream().filter(GradedDocument::isRelevant).toList())
        .build();
  }
}
