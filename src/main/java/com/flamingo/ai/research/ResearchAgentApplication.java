package com.flamingo.ai.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the research agent service. */
@SpringBootApplication
public class ResearchAgentApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResearchAgentApplication.class, args);
  }
}
