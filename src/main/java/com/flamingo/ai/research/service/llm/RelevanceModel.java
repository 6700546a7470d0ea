package com.flamingo.ai.research.service.llm;

import com.flamingo.ai.research.domain.model.SearchDocument;

/**
 * Language model collaborator used by the research workflow.
 *
 * <p>Implementations throw {@link com.flamingo.ai.research.exception.LlmServiceException} when the
 * backend is unreachable or errors.
 */
public interface RelevanceModel {

  /**
   * Free-form generation, used for query generation and synthesis.
   *
   * @param systemPrompt instructions for the model
   * @param userPrompt the request
   * @return the model's text reply
   */
  String generate(String systemPrompt, String userPrompt);

  /**
   * Rates one document against the topic. Must be deterministic for a given input.
   *
   * @param topic the research topic
   * @param document the document to grade
   * @return text expected to contain a JSON object {@code {"score": n, "reasoning": "..."}}
   */
  String grade(String topic, SearchDocument document);
}
