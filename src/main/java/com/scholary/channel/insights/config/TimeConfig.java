package com.scholary.channel.insights.config;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Time sources, exposed as beans so tests can replace them. */
@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Drives cache expiry for the job registry and the result cache. */
  @Bean
  public Ticker ticker() {
    return Ticker.systemTicker();
  }
}
