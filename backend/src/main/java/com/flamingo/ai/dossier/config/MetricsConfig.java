package com.flamingo.ai.dossier.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for build metrics and the wall clock used for "generated at" stamps. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on pipeline stages.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
