package com.flamingo.ai.research.workflow;

import com.flamingo.ai.research.domain.enums.ResearchStatus;
import com.flamingo.ai.research.domain.model.ResearchQuery;
import com.flamingo.ai.research.domain.model.ResearchState;
import com.flamingo.ai.research.domain.model.StateUpdate;
import com.flamingo.ai.research.service.llm.RelevanceModel;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Produces the search queries for the current iteration. The first pass asks for diverse angles
 * on the topic; later passes list the earlier queries as insufficient and ask for new ones.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryGenerator implements ResearchNode {

  public static final String NAME = "generate_queries";

  /** Leading list markers the model sometimes adds despite instructions: "1.", "2)", "-", "•". */
  private static final Pattern LIST_MARKER = Pattern.compile("^(?:\\d+[.)]|[-*•])\\s*");

  private final RelevanceModel relevanceModel;
  private final MeterRegistry meterRegistry;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  @Timed(value = "research.node.generate_queries", description = "Time to generate queries")
  public StateUpdate apply(ResearchState state) {
    boolean isRewrite = state.getIteration() > 0;
    int count = state.getQueriesPerIteration();

    String systemPrompt =
        isRewrite ? rewritePrompt(state.getQueries(), count) : initialPrompt(count);
    String response = relevanceModel.generate(systemPrompt, "Topic: " + state.getTopic());

    List<ResearchQuery> queries =
        parseQueries(response, count).stream()
            .map(text -> new ResearchQuery(text, state.getIteration(), isRewrite))
            .toList();

    meterRegistry.counter("research.queries.generated").increment(queries.size());
    log.debug(
        "Iteration {}: generated {} {} queries for '{}'",
        state.getIteration(),
        queries.size(),
        isRewrite ? "rewritten" : "initial",
        state.getTopic());

    StateUpdate.StateUpdateBuilder update =
        StateUpdate.builder()
            .queries(queries)
            .status(ResearchStatus.GENERATING_QUERIES)
            .log(
                String.format(
                    "[Iteration %d] Generated %d %s queries:",
                    state.getIteration() + 1,
                    queries.size(),
                    isRewrite ? "rewritten" : "initial"));
    queries.forEach(q -> update.log("  • " + q.text()));
    return update.build();
  }

  @VisibleForTesting
  static List<String> parseQueries(String response, int limit) {
    if (response == null || response.isBlank()) {
      return List.of();
    }
    return response
        .lines()
        .map(String::trim)
        .map(line -> LIST_MARKER.matcher(line).replaceFirst(""))
        .map(QueryGenerator::stripQuotes)
        .filter(line -> !line.isEmpty())
        .limit(limit)
        .toList();
  }

  private static String stripQuotes(String line) {
    if (line.length() >= 2 && line.startsWith("\"") && line.endsWith("\"")) {
      return line.substring(1, line.length() - 1).trim();
    }
    return line;
  }

  private static String initialPrompt(int count) {
    return String.format(
        """
            You are a research assistant. Generate %d diverse search queries to research the \
            topic thoroughly.

            Consider different aspects:
            - Foundational/introductory content
            - Technical/detailed information
            - Practical applications or examples

            Return ONLY the queries, one per line, no numbering or bullets.""",
        count);
  }

  private static String rewritePrompt(List<ResearchQuery> previous, int count) {
    String previousQueries =
        previous.stream().map(q -> "- " + q.text()).collect(Collectors.joining("\n"));
    return String.format(
        """
            You are a research assistant. The previous search queries did not yield enough \
            relevant results.

            Previous queries that didn't work well:
            %s

            Generate %d NEW and DIFFERENT search queries that might find better information.
            Be more specific, try different angles, or use alternative terminology.

            Return ONLY the queries, one per line, no numbering or bullets.""",
        previousQueries, count);
  }
}
