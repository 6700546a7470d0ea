package com.flamingo.ai.research.service.llm;

import com.flamingo.ai.research.agent.RelevanceGradingAgent;
import com.flamingo.ai.research.config.ResearchConfig;
import com.flamingo.ai.research.domain.model.SearchDocument;
import com.flamingo.ai.research.exception.LlmServiceException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link RelevanceModel} backed by LangChain4j chat models. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jRelevanceModel implements RelevanceModel {

  private final ChatModel chatModel;
  private final RelevanceGradingAgent gradingAgent;
  private final ResearchConfig researchConfig;

  @Override
  @Timed(value = "research.llm.generate", description = "Time for a generation call")
  @CircuitBreaker(name = "llm")
  public String generate(String systemPrompt, String userPrompt) {
    List<ChatMessage> messages =
        List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt));
    try {
      ChatResponse response = chatModel.chat(messages);
      String text = response.aiMessage().text();
      log.debug("Generation returned {} chars", text != null ? text.length() : 0);
      return text != null ? text : "";
    } catch (RuntimeException e) {
      throw new LlmServiceException("Generation request failed: " + e.getMessage(), e);
    }
  }

  @Override
  @Timed(value = "research.llm.grade", description = "Time for a grading call")
  @CircuitBreaker(name = "llm")
  public String grade(String topic, SearchDocument document) {
    String excerpt = document.excerpt(researchConfig.getGrading().getContentPreviewChars());
    try {
      return gradingAgent.grade(topic, document.title(), document.url(), excerpt);
    } catch (RuntimeException e) {
      throw new LlmServiceException(
          "Grading request failed for " + document.url() + ": " + e.getMessage(), e);
    }
  }
}
