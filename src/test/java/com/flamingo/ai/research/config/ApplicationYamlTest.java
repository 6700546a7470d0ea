package com.flamingo.ai.research.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

@DisplayName("application.yml Tests")
class ApplicationYamlTest {

  private Properties properties;

  @BeforeEach
  void setUp() {
    YamlPropertiesFactoryBean factory = new YamlPropertiesFactoryBean();
    factory.setResources(new ClassPathResource("application.yml"));
    properties = factory.getObject();
  }

  @Test
  @DisplayName("Should only expose actuator endpoints that have a backing registry")
  void shouldExposeOnlyAvailableEndpoints() {
    List<String> exposed =
        Arrays.stream(
                properties.getProperty("management.endpoints.web.exposure.include").split(","))
            .map(String::trim)
            .toList();

    assertThat(exposed).containsExactly("health", "info", "metrics");
    assertThat(isPresent("io.micrometer.prometheusmetrics.PrometheusMeterRegistry")).isFalse();
  }

  @Test
  @DisplayName("Should retry search failures only")
  void shouldRetrySearchFailures() {
    assertThat(properties.getProperty("resilience4j.retry.instances.search.retry-exceptions[0]"))
        .isEqualTo("com.flamingo.ai.research.exception.SearchException");
  }

  private static boolean isPresent(String className) {
    try {
      Class.forName(className);
      return true;
    } catch (ClassNotFoundException e) {
      return false;
    }
  }
}
