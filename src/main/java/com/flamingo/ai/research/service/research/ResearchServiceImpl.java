package com.flamingo.ai.research.service.research;

import com.flamingo.ai.research.api.dto.response.ResearchStreamEvent;
import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.ResearchOptions;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.ResearchStep;
import com.flamingo.ai.research.workflow.ResearchWorkflowEngine;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/** Implementation of ResearchService on top of the workflow engine. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchServiceImpl implements ResearchService {

  private final ResearchWorkflowEngine engine;

  @Override
  public ResearchReport research(String topic, ResearchOptions options) {
    ResearchState state = engine.run(topic, options);
    if (state.getStatus() == ResearchStatus.ERROR) {
      log.warn("Research on '{}' ended in error: {}", state.getTopic(), state.getError());
    }
    return ResearchReport.from(state);
  }

  @Override
  public Flux<ResearchStreamEvent> streamResearch(String topic, ResearchOptions options) {
    return engine.stream(topic, options).map(ResearchServiceImpl::toEvent);
  }

  private static ResearchStreamEvent toEvent(ResearchStep step) {
    if (!step.isEnd()) {
      return ResearchStreamEvent.update(step.nodeName(), step.update(), step.state().getStatus());
    }
    ResearchState finalState = step.state();
    if (finalState.getStatus() == ResearchStatus.ERROR) {
      String errorId = UUID.randomUUID().toString().substring(0, 8);
      log.warn("Research stream [{}] ended in error: {}", errorId, finalState.getError());
      return ResearchStreamEvent.error(
          errorId, finalState.getError(), ResearchReport.from(finalState));
    }
    return ResearchStreamEvent.done(ResearchReport.from(finalState));
  }
}
