package com.flamingo.ai.research.api.rest;

import com.flamingo.ai.research.api.dto.request.ResearchRequest;
import com.flamingo.ai.research.api.dto.response.ResearchStreamEvent;
import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.service.research.ResearchReport;
import com.flamingo.ai.research.service.research.ResearchService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for research runs, blocking and streamed over Server-Sent Events. */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

  private final ResearchService researchService;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeStreams = new AtomicInteger(0);

  /**
   * Runs research to completion.
   *
   * @param request topic and optional overrides
   * @return the report; 500 when the run ended in error
   */
  @PostMapping
  public ResponseEntity<ResearchReport> research(@Valid @RequestBody ResearchRequest request) {
    log.info("Research requested for topic '{}'", request.getTopic());
    ResearchReport report = researchService.research(request.getTopic(), request.options());
    HttpStatus status = report.isSuccessful() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
    return ResponseEntity.status(status).body(report);
  }

  /**
   * Streams research progress using Server-Sent Events.
   *
   * @param request topic and optional overrides
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ResearchStreamEvent> streamResearch(@Valid @RequestBody ResearchRequest request) {
    log.info("Starting research stream for topic '{}'", request.getTopic());
    Flux<ResearchStreamEvent> events =
        researchService.streamResearch(request.getTopic(), request.options());

    activeStreams.incrementAndGet();
    meterRegistry.gauge("research.streams.active", activeStreams);

    return events
        .doOnComplete(
            () -> {
              activeStreams.decrementAndGet();
              log.debug("Research stream completed for '{}'", request.getTopic());
            })
        .doOnError(
            e -> {
              activeStreams.decrementAndGet();
              log.error("Research stream error for '{}': {}", request.getTopic(), e.getMessage());
              meterRegistry.counter("research.streams.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeStreams.decrementAndGet();
              log.debug("Research stream cancelled for '{}'", request.getTopic());
            });
  }

  /** Describes the endpoint and its defaults. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> describe() {
    ResearchConfig.Defaults defaults = researchConfig.getDefaults();
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("maxIterations", "number (default: " + defaults.getMaxIterations() + ")");
    config.put(
        "qualityThreshold", "number 0-1 (default: " + defaults.getQualityThreshold() + ")");
    config.put("minRelevantDocs", "number (default: " + defaults.getMinRelevantDocs() + ")");
    config.put(
        "queriesPerIteration", "number (default: " + defaults.getQueriesPerIteration() + ")");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ready");
    body.put("description", "Autonomous Research Agent API");
    body.put(
        "endpoints",
        Map.of(
            "POST /api/research", "Run research on a topic and return the report",
            "POST /api/research/stream", "Run research and stream progress as SSE"));
    body.put("body", Map.of("topic", "string (required, 3-500 chars)", "config", config));
    return ResponseEntity.ok(body);
  }
}
