package io.statefleet.fleet.config;

import io.statefleet.fleet.fleethealth.FleetHealthProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FleetHealthProperties.class)
public class FleetHealthConfig {

  /** Source of "now" for overdue calculations and record timestamps. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
