package com.flamingo.ai.research.config;

import com.flamingo.ai.research.agent.RelevanceGradingAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /**
   * Relevance grading agent. Uses the zero-temperature grading model so the same document gets the
   * same verdict across runs.
   */
  @Bean
  public RelevanceGradingAgent relevanceGradingAgent(
      @Qualifier("gradingChatModel") ChatModel gradingChatModel) {
    return AiServices.builder(RelevanceGradingAgent.class).chatModel(gradingChatModel).build();
  }
}
