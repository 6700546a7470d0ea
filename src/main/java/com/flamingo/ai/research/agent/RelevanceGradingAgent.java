package com.flamingo.ai.research.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that rates how relevant one web document is to a research topic.
 *
 * <p>Returns the raw model text. Callers extract the JSON object themselves so that a malformed
 * reply can be handled per document instead of failing the whole batch.
 */
public interface RelevanceGradingAgent {

  @SystemMessage(
      """
        You are a document relevance grader. Evaluate if a document is relevant to the
        research topic.

        Scoring Guidelines:
        - 0.9-1.0 = Directly and substantially covers the topic
        - 0.6-0.8 = Relevant, covers an important aspect of the topic
        - 0.3-0.5 = Tangentially related
        - 0.0-0.2 = Not relevant

        Return ONLY a JSON object: {"score": 0.X, "reasoning": "brief explanation"}
        """)
  @UserMessage(
      """
        TOPIC: {{topic}}

        DOCUMENT:
        Title: {{title}}
        URL: {{url}}
        Content: {{content}}
        """)
  String grade(
      @V("topic") String topic,
      @V("title") String title,
      @V("url") String url,
      @V("content") String content);
}
