package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.StateUpdate;

/** One stage of the research workflow: reads a snapshot, returns a partial update. */
public interface ResearchNode {

  /** Stable name reported in streamed updates. */
  String name();

  /**
   * Executes the stage. Must not mutate {@code state}.
   *
   * @param state current snapshot
   * @return additions and replacements to merge onto {@code state}
   */
  StateUpdate apply(ResearchState state);
}
