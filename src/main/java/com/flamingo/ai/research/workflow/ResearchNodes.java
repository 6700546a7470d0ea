package com.flamingo.ai.research.workflow;

import org.springframework.stereotype.Component;

/** The fixed set of nodes the research state machine sequences. */
@Component
public record ResearchNodes(
    QueryGenerator queryGenerator,
    SearchExecutor searchExecutor,
    RelevanceGrader relevanceGrader,
    DecisionPolicy decisionPolicy,
    Synthesizer synthesizer) {}
