package com.flamingo.ai.research.service.research;

import com.flamingo.ai.research.api.dto.response.ResearchStreamEvent;
import com.flamingo.ai.research.domain.model.ResearchOptions;
import reactor.core.publisher.Flux;

/** Service interface for running research requests. */
public interface ResearchService {

  /**
   * Runs a research request to completion.
   *
   * @param topic the research topic
   * @param options per-request overrides, may be {@code null}
   * @return the report of the finished run, successful or not
   */
  ResearchReport research(String topic, ResearchOptions options);

  /**
   * Streams a research request as events: one per workflow node, then a final done or error
   * event.
   *
   * @param topic the research topic
   * @param options per-request overrides, may be {@code null}
   * @return a Flux of stream events
   */
  Flux<ResearchStreamEvent> streamResearch(String topic, ResearchOptions options);
}
