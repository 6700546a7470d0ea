package com.flamingo.ai.research.domain.model;

/**
 * One element of a streamed research run: the node that just executed, the partial update it
 * produced and the merged snapshot after applying it.
 *
 * <p>The last element of every stream is the end marker ({@link #END_NODE}), which carries the
 * terminal state and an empty update.
 */
public record ResearchStep(String nodeName, StateUpdate update, ResearchState state) {

  public static final String END_NODE = "__end__";

  public static ResearchStep end(ResearchState finalState) {
    return new ResearchStep(END_NODE, StateUpdate.empty(), finalState);
  }

  public boolean isEnd() {
    return END_NODE.equals(nodeName);
  }
}
