package com.flamingo.ai.deepresearch.service.research;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResearchProgressTest {

  @Test
  @DisplayName("should reach 100 only when finished")
  void shouldReachHundred_onlyWhenFinished() {
    assertThat(ResearchProgress.estimate(ResearchPhase.FINALIZING, 3, 3, false)).isEqualTo(95.0);
    assertThat(ResearchProgress.estimate(ResearchPhase.REFLECTING, 3, 3, false)).isLessThan(95.0);
    assertThat(ResearchProgress.estimate(ResearchPhase.FINALIZING, 3, 3, true)).isEqualTo(100.0);
  }

  @Test
  @DisplayName("should grow monotonically through the phases of consecutive loops")
  void shouldGrowMonotonically() {
    ResearchPhase[] order = {
      ResearchPhase.QUERYING,
      ResearchPhase.SEARCHING,
      ResearchPhase.DEDUPLICATING,
      ResearchPhase.SUMMARIZING,
      ResearchPhase.REFLECTING
    };
    double previous = ResearchProgress.estimate(ResearchPhase.INITIALIZING, 0, 2, false);
    for (int loop = 1; loop <= 2; loop++) {
      for (ResearchPhase phase : order) {
        double current = ResearchProgress.estimate(phase, loop, 2, false);
        assertThat(current).isGreaterThan(previous);
        previous = current;
      }
    }
  }
}
