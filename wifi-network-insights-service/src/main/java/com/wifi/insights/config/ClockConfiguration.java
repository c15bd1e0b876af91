package com.wifi.insights.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the time source for insight identity and timestamps. Components read time only
 * through this bean so tests can pin it with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
