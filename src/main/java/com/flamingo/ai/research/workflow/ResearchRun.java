package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.ResearchStep;
import com.flamingo.ai.research.domain.model.StateUpdate;
import java.util.Iterator;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;

/**
 * A single, non-restartable execution of the research state machine. Each call to {@link #next()}
 * runs exactly one node and merges its update, so a caller that stops iterating stops the
 * workflow. After the terminal node, one end marker is produced and iteration ends.
 *
 * <p>Not thread-safe; one consumer drives a run.
 */
@Slf4j
final class ResearchRun implements Iterator<ResearchStep> {

  private enum Stage {
    GENERATE_QUERIES,
    SEARCH,
    GRADE,
    DECIDE,
    SYNTHESIZE,
    DONE
  }

  private final ResearchNodes nodes;
  private final StateMerger merger;

  private ResearchState state;
  private Stage stage = Stage.GENERATE_QUERIES;
  private boolean ended;

  ResearchRun(ResearchNodes nodes, StateMerger merger, ResearchState initialState) {
    this.nodes = nodes;
    this.merger = merger;
    this.state = initialState;
  }

  @Override
  public boolean hasNext() {
    return !ended;
  }

  @Override
  public ResearchStep next() {
    if (ended) {
      throw new NoSuchElementException("Research run already finished");
    }
    if (stage == Stage.DONE) {
      ended = true;
      return ResearchStep.end(state);
    }

    ResearchNode node = nodeFor(stage);
    StateUpdate update;
    try {
      update = node.apply(state);
      state = merger.merge(state, update);
      stage = transition(stage, state);
    } catch (RuntimeException e) {
      log.error(
          "Research on '{}' failed in {}: {}", state.getTopic(), node.name(), e.getMessage(), e);
      update = failure(node.name(), e);
      state = merger.merge(state, update);
      stage = Stage.DONE;
    }
    return new ResearchStep(node.name(), update, state);
  }

  /** Current snapshot. */
  ResearchState state() {
    return state;
  }

  private ResearchNode nodeFor(Stage current) {
    return switch (current) {
      case GENERATE_QUERIES -> nodes.queryGenerator();
      case SEARCH -> nodes.searchExecutor();
      case GRADE -> nodes.relevanceGrader();
      case DECIDE -> nodes.decisionPolicy();
      case SYNTHESIZE -> nodes.synthesizer();
      case DONE -> throw new IllegalStateException("No node after completion");
    };
  }

  private static Stage transition(Stage current, ResearchState state) {
    if (state.getStatus().isTerminal()) {
      return Stage.DONE;
    }
    return switch (current) {
      case GENERATE_QUERIES -> Stage.SEARCH;
      case SEARCH -> Stage.GRADE;
      case GRADE -> Stage.DECIDE;
      case DECIDE -> state.isNeedsMoreResearch() ? Stage.GENERATE_QUERIES : Stage.SYNTHESIZE;
      case SYNTHESIZE, DONE -> Stage.DONE;
    };
  }

  private static StateUpdate failure(String nodeName, RuntimeException e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return StateUpdate.builder()
        .status(ResearchStatus.ERROR)
        .error(message)
        .log(String.format("✗ Research failed during %s: %s", nodeName, message))
        .build();
  }
}
