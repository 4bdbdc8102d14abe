/*
 * Where: Shared configuration
 * What: Exposes the system UTC clock as a bean
 * Why: Schedulers read "now" from an injectable Clock so tests can pin it
 */
package com.raidledger.common.config;

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
