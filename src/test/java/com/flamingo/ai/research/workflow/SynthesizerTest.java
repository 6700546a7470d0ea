package com.flamingo.ai.research.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchQuery;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.service.llm.RelevanceModel;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Synthesizer Tests")
class SynthesizerTest {

  @Mock private RelevanceModel relevanceModel;

  @InjectMocks private Synthesizer synthesizer;

  @Test
  @DisplayName("Should return the fixed message without calling the model when nothing is relevant")
  void shouldSkipModelWithoutEvidence() {
    StateUpdate update = synthesizer.apply(ResearchState.initial("topic", 3, 0.6, 3, 3));

    verifyNoInteractions(relevanceModel);
    assertThat(update.getSynthesis()).isEqualTo(Synthesizer.NO_EVIDENCE_MESSAGE);
    assertThat(update.getStatus()).isEqualTo(ResearchStatus.COMPLETE);
    assertThat(update.getLogs()).containsExactly("⚠ No relevant documents to synthesize");
  }

  @Test
  @DisplayName("Should synthesize a report from relevant documents")
  void shouldSynthesizeReport() {
    when(relevanceModel.generate(anyString(), anyString())).thenReturn("# Quantum report");

    StateUpdate update = synthesizer.apply(stateWithSources());

    assertThat(update.getSynthesis()).isEqualTo("# Quantum report");
    assertThat(update.getStatus()).isEqualTo(ResearchStatus.COMPLETE);
    assertThat(update.getLogs())
        .containsExactly(
            "✓ Research synthesis complete", "  Total iterations: 2", "  Sources cited: 2");
  }

  @Test
  @DisplayName("Should number sources and include process statistics in the prompt")
  void shouldBuildPrompt() {
    String prompt = Synthesizer.buildPrompt(stateWithSources());

    assertThat(prompt)
        .contains("RESEARCH TOPIC: quantum computing")
        .contains("[Source 1] Qubits")
        .contains("URL: https://q/1")
        .contains("Relevance: 90%")
        .contains("Content: full text on qubits")
        .contains("[Source 2] Gates")
        .contains("Content: gate snippet")
        .contains("- Iterations: 2")
        .contains("- Queries used: 1")
        .contains("- Relevant sources: 2");
  }

  private static ResearchState stateWithSources() {
    List<GradedDocument> relevant =
        List.of(
            new GradedDocument(
                new SearchDocument("Qubits", "https://q/1", "qubit snippet", "full text on qubits"),
                0.9,
                "core",
                true),
            new GradedDocument(
                new SearchDocument("Gates", "https://q/2", "gate snippet"), 0.75, "useful", true));
    return ResearchState.initial("quantum computing", 3, 0.6, 2, 3).toBuilder()
        .iteration(1)
        .queries(List.of(new ResearchQuery("qubits", 0, false)))
        .gradedDocuments(relevant)
        .relevantDocuments(relevant)
        .build();
  }
}
