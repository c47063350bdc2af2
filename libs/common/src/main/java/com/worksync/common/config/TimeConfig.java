/*
 * Where: shared configuration
 * What: exposes the system UTC Clock as a bean
 * Why: services read time through an injected Clock so tests can pin it
 */
package com.worksync.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
