package com.flamingo.ai.deepresearch.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.exception.ResearchConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResearchOptionsTest {

  @Test
  @DisplayName("should take defaults from the configuration")
  void shouldTakeDefaults_fromConfig() {
    ResearchConfig config = new ResearchConfig();
    config.setMaxLoops(4);
    config.setSearchApi(SearchApi.TAVILY);

    ResearchOptions options = ResearchOptions.defaults(config);

    assertThat(options.maxLoops()).isEqualTo(4);
    assertThat(options.searchApi()).isEqualTo(SearchApi.TAVILY);
    assertThat(options.fetchFullPage()).isTrue();
    assertThat(options.resultsPerQuery()).isEqualTo(3);
  }

  @Test
  @DisplayName("should reject a loop budget outside 1-10")
  void shouldRejectMaxLoops_whenOutOfRange() {
    ResearchOptions defaults = ResearchOptions.defaults(new ResearchConfig());

    assertThatThrownBy(() -> defaults.toBuilder().maxLoops(0).build().validate())
        .isInstanceOf(ResearchConfigurationException.class)
        .hasMessageContaining("max_loops");
    assertThatThrownBy(() -> defaults.toBuilder().maxLoops(11).build().validate())
        .isInstanceOf(ResearchConfigurationException.class);
    assertThat(defaults.toBuilder().maxLoops(10).build().validate().maxLoops()).isEqualTo(10);
  }

  @Test
  @DisplayName("should reject a missing search API")
  void shouldRejectOptions_whenSearchApiMissing() {
    ResearchOptions options =
        ResearchOptions.defaults(new ResearchConfig()).toBuilder().searchApi(null).build();

    assertThatThrownBy(options::validate).isInstanceOf(ResearchConfigurationException.class);
  }
}
