package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.GradedDocument;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.service.llm.RelevanceModel;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the final report from the accumulated relevant documents. */
@Component
@RequiredArgsConstructor
@Slf4j
public class Synthesizer implements ResearchNode {

  public static final String NAME = "synthesize";

  public static final String NO_EVIDENCE_MESSAGE =
      "Unable to find relevant information on this topic. Please try a different research query.";

  private static final String SYSTEM_PROMPT =
      """
        You are a research synthesizer. Create a comprehensive summary based only on the \
        sources you are given. Cite sources as [Source N].""";

  private final RelevanceModel relevanceModel;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  @Timed(value = "research.node.synthesize", description = "Time to synthesize the report")
  public StateUpdate apply(ResearchState state) {
    if (state.getRelevantDocuments().isEmpty()) {
      log.info("No relevant documents for '{}', skipping synthesis call", state.getTopic());
      return StateUpdate.builder()
          .synthesis(NO_EVIDENCE_MESSAGE)
          .status(ResearchStatus.COMPLETE)
          .log("⚠ No relevant documents to synthesize")
          .build();
    }

    String synthesis = relevanceModel.generate(SYSTEM_PROMPT, buildPrompt(state));
    log.info(
        "Synthesis for '{}' complete: {} chars from {} sources",
        state.getTopic(),
        synthesis.length(),
        state.getRelevantDocuments().size());

    return StateUpdate.builder()
        .synthesis(synthesis)
        .status(ResearchStatus.COMPLETE)
        .log("✓ Research synthesis complete")
        .log("  Total iterations: " + (state.getIteration() + 1))
        .log("  Sources cited: " + state.getRelevantDocuments().size())
        .build();
  }

  @VisibleForTesting
  static String buildPrompt(ResearchState state) {
    List<GradedDocument> sources = state.getRelevantDocuments();
    String context =
        IntStream.range(0, sources.size())
            .mapToObj(i -> formatSource(i + 1, sources.get(i)))
            .collect(Collectors.joining("\n---\n"));

    return String.format(
        """
            RESEARCH TOPIC: %s

            SOURCES:
            %s

            RESEARCH PROCESS:
            - Iterations: %d
            - Queries used: %d
            - Documents reviewed: %d
            - Relevant sources: %d

            Create a well-organized research summary that:
            1. Introduces the topic
            2. Covers key findings from the sources
            3. Identifies any gaps or areas needing further research
            4. Concludes with main takeaways

            Use markdown formatting for readability.""",
        state.getTopic(),
        context,
        state.getIteration() + 1,
        state.getQueries().size(),
        state.getGradedDocuments().size(),
        sources.size());
  }

  private static String formatSource(int index, GradedDocument doc) {
    return String.format(
        "[Source %d] %s%nURL: %s%nRelevance: %d%%%nContent: %s",
        index,
        doc.document().title(),
        doc.url(),
        Math.round(doc.relevanceScore() * 100),
        doc.document().body());
  }
}
