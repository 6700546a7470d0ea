package com.flamingo.ai.research.api.dto.request;

import com.flamingo.ai.research.domain.model.ResearchOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a research run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {

  @NotBlank(message = "Topic is required")
  @Size(min = 3, max = 500, message = "Topic must be between 3 and 500 characters")
  private String topic;

  /** Optional overrides. If null, configured defaults apply. */
  @Valid private ResearchOptionsRequest config;

  public ResearchOptions options() {
    return config != null ? config.toOptions() : ResearchOptions.defaults();
  }
}
