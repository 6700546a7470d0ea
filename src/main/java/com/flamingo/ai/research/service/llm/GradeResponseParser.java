package com.flamingo.ai.research.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts a relevance verdict from free-form grader output. The first substring that parses as a
 * JSON object with a numeric {@code score} wins; surrounding prose and code fences are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GradeResponseParser {

  static final String NO_REASONING = "No reasoning provided";

  private final ObjectMapper objectMapper;

  /**
   * Parses a grader reply.
   *
   * @param response raw model text
   * @return the verdict with its score clamped to [0, 1], or empty when no usable object is found
   */
  public Optional<Grade> parse(String response) {
    if (response == null || response.isBlank()) {
      return Optional.empty();
    }

    int start = response.indexOf('{');
    while (start >= 0) {
      Optional<JsonNode> node = readObject(response.substring(start));
      if (node.isPresent()) {
        return toGrade(node.get());
      }
      start = response.indexOf('{', start + 1);
    }

    log.debug("No JSON object found in grader response");
    return Optional.empty();
  }

  private Optional<JsonNode> readObject(String candidate) {
    try {
      JsonNode node = objectMapper.readTree(candidate);
      return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  private Optional<Grade> toGrade(JsonNode node) {
    JsonNode score = node.get("score");
    double value;
    if (score != null && score.isNumber()) {
      value = score.asDouble();
    } else if (score != null && score.isTextual()) {
      try {
        value = Double.parseDouble(score.asText().trim());
      } catch (NumberFormatException e) {
        log.debug("Grader score is not numeric: {}", score.asText());
        return Optional.empty();
      }
    } else {
      log.debug("Grader response has no numeric score");
      return Optional.empty();
    }
    if (Double.isNaN(value)) {
      return Optional.empty();
    }

    JsonNode reasoning = node.get("reasoning");
    String text =
        reasoning != null && reasoning.isTextual() && !reasoning.asText().isBlank()
            ? reasoning.asText()
            : NO_REASONING;
    return Optional.of(new Grade(Math.max(0.0, Math.min(1.0, value)), text));
  }

  /** Parsed relevance verdict. */
  public record Grade(double score, String reasoning) {}
}
