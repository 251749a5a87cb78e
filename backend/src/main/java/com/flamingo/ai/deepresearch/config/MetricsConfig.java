package com.flamingo.ai.deepresearch.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on research, summary, reflection and history services.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
