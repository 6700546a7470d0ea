package com.flamingo.ai.research.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchQuery;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.domain.model.StateUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StateMerger Tests")
class StateMergerTest {

  private final StateMerger merger = new StateMerger();

  private final ResearchState initial = ResearchState.initial("quantum computing", 3, 0.6, 3, 3);

  @Test
  @DisplayName("Should append queries and logs")
  void shouldAppendQueriesAndLogs() {
    ResearchState once =
        merger.merge(
            initial,
            StateUpdate.builder().query(new ResearchQuery("q1", 0, false)).log("first").build());
    ResearchState twice =
        merger.merge(
            once,
            StateUpdate.builder().query(new ResearchQuery("q2", 1, true)).log("second").build());

    assertThat(twice.getQueries()).extracting(ResearchQuery::text).containsExactly("q1", "q2");
    assertThat(twice.getLogs())
        .containsExactly("Starting research on: \"quantum computing\"", "first", "second");
  }

  @Test
  @DisplayName("Should union search results by url keeping the first occurrence")
  void shouldUnionSearchResultsByUrl() {
    SearchDocument a = new SearchDocument("A", "https://a", "first");
    SearchDocument aAgain = new SearchDocument("A2", "https://a", "second");
    SearchDocument b = new SearchDocument("B", "https://b", "b");

    ResearchState once = merger.merge(initial, StateUpdate.builder().searchResult(a).build());
    ResearchState twice =
        merger.merge(once, StateUpdate.builder().searchResult(aAgain).searchResult(b).build());

    assertThat(twice.getSearchResults()).containsExactly(a, b);
  }

  @Test
  @DisplayName("Should never grade the same url twice")
  void shouldSkipAlreadyGradedUrls() {
    SearchDocument doc = new SearchDocument("A", "https://a", "s");
    GradedDocument first = new GradedDocument(doc, 0.9, "good", true);
    GradedDocument second = new GradedDocument(doc, 0.2, "bad", false);

    ResearchState once =
        merger.merge(
            initial,
            StateUpdate.builder().gradedDocument(first).relevantDocument(first).build());
    ResearchState twice =
        merger.merge(
            once,
            StateUpdate.builder().gradedDocument(second).relevantDocument(first).build());

    assertThat(twice.getGradedDocuments()).containsExactly(first);
    assertThat(twice.getRelevantDocuments()).containsExactly(first);
  }

  @Test
  @DisplayName("Should only keep relevant entries in relevantDocuments")
  void shouldFilterIrrelevantFromRelevantDocuments() {
    GradedDocument irrelevant =
        new GradedDocument(new SearchDocument("A", "https://a", "s"), 0.1, "off-topic", false);

    ResearchState merged =
        merger.merge(initial, StateUpdate.builder().relevantDocument(irrelevant).build());

    assertThat(merged.getRelevantDocuments()).isEmpty();
  }

  @Test
  @DisplayName("Should replace scalars only when set")
  void shouldReplaceScalarsOnlyWhenSet() {
    ResearchState updated =
        merger.merge(
            initial,
            StateUpdate.builder()
                .iteration(1)
                .needsMoreResearch(false)
                .status(ResearchStatus.SYNTHESIZING)
                .build());
    ResearchState untouched = merger.merge(updated, StateUpdate.empty());

    assertThat(untouched.getIteration()).isEqualTo(1);
    assertThat(untouched.isNeedsMoreResearch()).isFalse();
    assertThat(untouched.getStatus()).isEqualTo(ResearchStatus.SYNTHESIZING);
    assertThat(untouched.getSynthesis()).isEmpty();
    assertThat(untouched.getError()).isNull();
  }

  @Test
  @DisplayName("Should not mutate the input snapshot")
  void shouldNotMutateInput() {
    merger.merge(
        initial,
        StateUpdate.builder()
            .query(new ResearchQuery("q", 0, false))
            .searchResult(new SearchDocument("A", "https://a", "s"))
            .log("line")
            .build());

    assertThat(initial.getQueries()).isEmpty();
    assertThat(initial.getSearchResults()).isEmpty();
    assertThat(initial.getLogs()).hasSize(1);
  }
}
