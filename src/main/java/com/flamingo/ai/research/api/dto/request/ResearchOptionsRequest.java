package com.flamingo.ai.research.api.dto.request;

import com.flamingo.ai.research.domain.model.ResearchOptions;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional stopping-criteria overrides for a research request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchOptionsRequest {

  @Min(value = 1, message = "maxIterations must be at least 1")
  @Max(value = 10, message = "maxIterations must not exceed 10")
  private Integer maxIterations;

  @DecimalMin(value = "0.0", message = "qualityThreshold must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "qualityThreshold must be between 0 and 1")
  private Double qualityThreshold;

  @Min(value = 0, message = "minRelevantDocs must not be negative")
  private Integer minRelevantDocs;

  @Min(value = 1, message = "queriesPerIteration must be at least 1")
  @Max(value = 10, message = "queriesPerIteration must not exceed 10")
  private Integer queriesPerIteration;

  public ResearchOptions toOptions() {
    return new ResearchOptions(
        maxIterations, qualityThreshold, minRelevantDocs, queriesPerIteration);
  }
}
