package com.flamingo.ai.research.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the research workflow. */
@Configuration
@ConfigurationProperties(prefix = "research")
@Getter
@Setter
public class ResearchConfig {

  private Defaults defaults = new Defaults();
  private Topic topic = new Topic();
  private Grading grading = new Grading();
  private Search search = new Search();
  private Concurrency concurrency = new Concurrency();

  /** Stopping criteria used when a request does not override them. */
  @Getter
  @Setter
  public static class Defaults {
    private int maxIterations = 3;
    private double qualityThreshold = 0.6;
    private int minRelevantDocs = 3;
    private int queriesPerIteration = 3;
  }

  @Getter
  @Setter
  public static class Topic {
    private int minLength = 3;
    private int maxLength = 500;
  }

  @Getter
  @Setter
  public static class Grading {
    /** Characters of snippet or content shown to the grader per document. */
    private int contentPreviewChars = 500;

    /** Score recorded when a document cannot be graded. */
    private double fallbackScore = 0.3;

    private long timeoutMs = 30_000;
  }

  @Getter
  @Setter
  public static class Search {
    /** Backend to use: "mock" (default) or "tavily". */
    private String provider = "mock";

    /** Upper bound for one query against the backend. */
    private long timeoutMs = 20_000;

    private Mock mock = new Mock();
    private Tavily tavily = new Tavily();

    @Getter
    @Setter
    public static class Mock {
      /** Simulated network delay per query. */
      private long latencyMs = 0;
    }

    @Getter
    @Setter
    public static class Tavily {
      private String baseUrl = "https://api.tavily.com";
      private String apiKey = "";
      private int maxResults = 5;
      private String searchDepth = "basic";
    }
  }

  @Getter
  @Setter
  public static class Concurrency {
    private int searchPoolSize = 6;
    private int gradingPoolSize = 8;
    private int streamPoolSize = 4;
    private int streamMaxPoolSize = 16;
  }
}
