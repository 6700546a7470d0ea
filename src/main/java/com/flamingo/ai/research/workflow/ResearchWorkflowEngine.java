package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.model.ResearchOptions;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.ResearchStep;
import com.flamingo.ai.research.exception.ResearchValidationException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs the research workflow: generate queries, search, grade, decide, and either loop back to
 * query generation or synthesize the report.
 *
 * <p>Two execution modes share one state machine ({@link ResearchRun}): {@link #run} blocks until a
 * terminal status, {@link #stream} emits one {@link ResearchStep} per executed node followed by an
 * end marker.
 */
@Service
@Slf4j
public class ResearchWorkflowEngine {

  static final String CANCELLED_OUTCOME = "cancelled";

  private final ResearchNodes nodes;
  private final StateMerger merger;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;
  private final Scheduler streamScheduler;

  public ResearchWorkflowEngine(
      ResearchNodes nodes,
      StateMerger merger,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry,
      @Qualifier("researchStreamExecutor") Executor researchStreamExecutor) {
    this.nodes = nodes;
    this.merger = merger;
    this.researchConfig = researchConfig;
    this.meterRegistry = meterRegistry;
    this.streamScheduler = Schedulers.fromExecutor(researchStreamExecutor);
  }

  /**
   * Executes the whole workflow on the calling thread.
   *
   * @param topic research topic
   * @param options per-request overrides, may be {@code null}
   * @return the terminal state, with status {@code complete} or {@code error}
   * @throws ResearchValidationException if the topic or options are invalid
   */
  @Timed(value = "research.run", description = "Time for a blocking research run")
  public ResearchState run(String topic, ResearchOptions options) {
    ResearchRun run = start(topic, options);
    countStart();
    while (run.hasNext()) {
      run.next();
    }
    ResearchState result = run.state();
    recordOutcome(result);
    return result;
  }

  /**
   * Streams the workflow node by node. Nothing runs, and the run is not counted as started, until
   * subscription; each downstream request executes one node, and cancelling stops further nodes (a
   * node already running finishes) and records a {@code cancelled} outcome.
   *
   * @param topic research topic
   * @param options per-request overrides, may be {@code null}
   * @return a single-use stream of steps ending with {@link ResearchStep#end}
   * @throws ResearchValidationException if the topic or options are invalid
   */
  public Flux<ResearchStep> stream(String topic, ResearchOptions options) {
    ResearchRun run = start(topic, options);
    String normalizedTopic = run.state().getTopic();
    AtomicBoolean subscribed = new AtomicBoolean();

    Flux<ResearchStep> steps =
        Flux.<ResearchStep>generate(
                sink -> {
                  ResearchStep step = run.next();
                  sink.next(step);
                  if (step.isEnd()) {
                    recordOutcome(step.state());
                    sink.complete();
                  }
                })
            .doOnSubscribe(subscription -> countStart())
            .doOnCancel(
                () -> {
                  meterRegistry
                      .counter("research.runs.finished", "status", CANCELLED_OUTCOME)
                      .increment();
                  log.info("Research stream for '{}' cancelled by consumer", normalizedTopic);
                });

    return Flux.defer(
            () ->
                subscribed.compareAndSet(false, true)
                    ? steps
                    : Flux.<ResearchStep>error(
                        new IllegalStateException("Research stream can only be consumed once")))
        .subscribeOn(streamScheduler);
  }

  private ResearchRun start(String topic, ResearchOptions options) {
    ResearchState initial = initialState(topic, options);
    log.info(
        "Starting research on '{}' (maxIterations={}, threshold={}, minRelevantDocs={})",
        initial.getTopic(),
        initial.getMaxIterations(),
        initial.getQualityThreshold(),
        initial.getMinRelevantDocs());
    return new ResearchRun(nodes, merger, initial);
  }

  private void countStart() {
    meterRegistry.counter("research.runs.started").increment();
  }

  /**
   * Validates the request and builds the seed state.
   *
   * @throws ResearchValidationException if the topic or options are invalid
   */
  @VisibleForTesting
  ResearchState initialState(String topic, ResearchOptions options) {
    String normalized = validateTopic(topic);
    ResearchOptions overrides = options != null ? options : ResearchOptions.defaults();
    ResearchConfig.Defaults defaults = researchConfig.getDefaults();

    int maxIterations = orDefault(overrides.maxIterations(), defaults.getMaxIterations());
    double qualityThreshold =
        overrides.qualityThreshold() != null
            ? overrides.qualityThreshold()
            : defaults.getQualityThreshold();
    int minRelevantDocs = orDefault(overrides.minRelevantDocs(), defaults.getMinRelevantDocs());
    int queriesPerIteration =
        orDefault(overrides.queriesPerIteration(), defaults.getQueriesPerIteration());

    if (maxIterations < 1) {
      throw new ResearchValidationException("maxIterations", "maxIterations must be at least 1");
    }
    if (Double.isNaN(qualityThreshold) || qualityThreshold < 0.0 || qualityThreshold > 1.0) {
      throw new ResearchValidationException(
          "qualityThreshold", "qualityThreshold must be between 0 and 1");
    }
    if (minRelevantDocs < 0) {
      throw new ResearchValidationException(
          "minRelevantDocs", "minRelevantDocs must not be negative");
    }
    if (queriesPerIteration < 1) {
      throw new ResearchValidationException(
          "queriesPerIteration", "queriesPerIteration must be at least 1");
    }

    return ResearchState.initial(
        normalized, maxIterations, qualityThreshold, minRelevantDocs, queriesPerIteration);
  }

  private String validateTopic(String topic) {
    ResearchConfig.Topic limits = researchConfig.getTopic();
    if (topic == null || topic.isBlank()) {
      throw new ResearchValidationException("topic", "Topic is required");
    }
    String trimmed = topic.trim();
    if (trimmed.length() < limits.getMinLength()) {
      throw new ResearchValidationException(
          "topic", "Topic must be at least " + limits.getMinLength() + " characters");
    }
    if (trimmed.length() > limits.getMaxLength()) {
      throw new ResearchValidationException(
          "topic", "Topic must be at most " + limits.getMaxLength() + " characters");
    }
    return trimmed;
  }

  private void recordOutcome(ResearchState state) {
    String outcome = state.getStatus().wireName();
    meterRegistry.counter("research.runs.finished", "status", outcome).increment();
    log.info(
        "Research on '{}' finished with status {} after {} iteration(s), {} relevant of {} graded",
        state.getTopic(),
        outcome,
        state.getIteration() + 1,
        state.getRelevantDocuments().size(),
        state.getGradedDocuments().size());
  }

  private static int orDefault(Integer value, int fallback) {
    return value != null ? value : fallback;
  }
}
