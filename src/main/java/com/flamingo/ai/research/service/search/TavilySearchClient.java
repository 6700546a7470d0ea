package com.flamingo.ai.research.service.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.research.config.ResearchConfig;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the Tavily search API. Encapsulates all WebClient communication. */
@Component
@ConditionalOnProperty(name = "research.search.provider", havingValue = "tavily")
@Slf4j
public class TavilySearchClient {

  private final WebClient webClient;
  private final String apiKey;
  private final int maxResults;
  private final String searchDepth;
  private final long timeoutMs;

  public TavilySearchClient(ResearchConfig researchConfig) {
    ResearchConfig.Search.Tavily tavily = researchConfig.getSearch().getTavily();
    if (tavily.getApiKey() == null || tavily.getApiKey().isBlank()) {
      throw new IllegalStateException(
          "Tavily API key is required. Set TAVILY_API_KEY environment variable.");
    }
    this.apiKey = tavily.getApiKey();
    this.maxResults = tavily.getMaxResults();
    this.searchDepth = tavily.getSearchDepth();
    this.timeoutMs = researchConfig.getSearch().getTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(tavily.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Tavily search client initialized: baseUrl={}", tavily.getBaseUrl());
  }

  /**
   * Calls the Tavily /search endpoint.
   *
   * @param query the search query
   * @return raw results in Tavily rank order
   */
  public List<TavilyResult> search(String query) {
    var request = new TavilySearchRequest(apiKey, query, maxResults, searchDepth);
    TavilySearchResponse response =
        webClient
            .post()
            .uri("/search")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(TavilySearchResponse.class)
            .timeout(Duration.ofMillis(timeoutMs))
            .block();
    return response != null && response.results() != null ? response.results() : List.of();
  }

  record TavilySearchRequest(
      @JsonProperty("api_key") String apiKey,
      String query,
      @JsonProperty("max_results") int maxResults,
      @JsonProperty("search_depth") String searchDepth) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilySearchResponse(List<TavilyResult> results) {}

  /** One Tavily search hit. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TavilyResult(String title, String url, String content, Double score) {}
}
