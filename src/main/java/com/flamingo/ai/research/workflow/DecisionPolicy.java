package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.StateUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether the research loop runs another iteration or moves on to synthesis.
 *
 * <p>Rules, in order:
 *
 * <ol>
 *   <li>enough relevant documents: stop
 *   <li>last allowed iteration reached: stop with partial evidence
 *   <li>otherwise: continue and advance the iteration
 * </ol>
 *
 * <p>This is the only place the iteration counter moves, so the loop runs at most {@code
 * maxIterations} times.
 */
@Component
@Slf4j
public class DecisionPolicy implements ResearchNode {

  public static final String NAME = "decide";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public StateUpdate apply(ResearchState state) {
    int totalRelevant = state.getRelevantDocuments().size();
    int iteration = state.getIteration();

    if (totalRelevant >= state.getMinRelevantDocs()) {
      log.info(
          "Sufficient evidence for '{}': {} relevant documents after iteration {}",
          state.getTopic(),
          totalRelevant,
          iteration);
      return stop(
          state,
          String.format(
              "✓ Found %d relevant documents (threshold: %d). Proceeding to synthesis.",
              totalRelevant, state.getMinRelevantDocs()));
    }

    if (iteration >= state.getMaxIterations() - 1) {
      log.info(
          "Iteration budget exhausted for '{}' with {} of {} relevant documents",
          state.getTopic(),
          totalRelevant,
          state.getMinRelevantDocs());
      return stop(
          state,
          String.format(
              "⚠ Max iterations (%d) reached with only %d relevant docs. "
                  + "Proceeding with available information.",
              state.getMaxIterations(), totalRelevant));
    }

    log.info(
        "Insufficient evidence for '{}' ({}/{}), starting iteration {}",
        state.getTopic(),
        totalRelevant,
        state.getMinRelevantDocs(),
        iteration + 1);
    return StateUpdate.builder()
        .needsMoreResearch(true)
        .iteration(iteration + 1)
        .log(
            String.format(
                "↻ Only %d/%d relevant docs found. Rewriting queries for iteration %d...",
                totalRelevant, state.getMinRelevantDocs(), iteration + 2))
        .build();
  }

  private static StateUpdate stop(ResearchState state, String reason) {
    return StateUpdate.builder()
        .needsMoreResearch(false)
        .iteration(state.getIteration())
        .status(ResearchStatus.SYNTHESIZING)
        .log(reason)
        .build();
  }
}
