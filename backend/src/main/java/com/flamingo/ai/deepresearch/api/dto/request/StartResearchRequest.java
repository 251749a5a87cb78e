package com.flamingo.ai.deepresearch.api.dto.request;

import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a research session. Unset options fall back to the defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartResearchRequest {

  @NotBlank(message = "Topic is required")
  @Size(max = 2000, message = "Topic must be at most 2000 characters")
  private String topic;

  @Min(value = ResearchOptions.MIN_LOOPS, message = "maxLoops must be at least 1")
  @Max(value = ResearchOptions.MAX_LOOPS, message = "maxLoops must be at most 10")
  private Integer maxLoops;

  /** tavily, duckduckgo or searxng. */
  private String searchApi;

  private Boolean fetchFullPage;

  /** Applies the overrides of this request to the given defaults. */
  public ResearchOptions applyTo(ResearchOptions defaults) {
    ResearchOptions.ResearchOptionsBuilder builder = defaults.toBuilder();
    if (maxLoops != null) {
      builder.maxLoops(maxLoops);
    }
    if (searchApi != null && !searchApi.isBlank()) {
      builder.searchApi(SearchApi.fromValue(searchApi));
    }
    if (fetchFullPage != null) {
      builder.fetchFullPage(fetchFullPage);
    }
    return builder.build();
  }
}
