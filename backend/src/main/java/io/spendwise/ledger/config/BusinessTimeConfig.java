package io.spendwise.ledger.config;

import io.spendwise.ledger.recurring.RecurringProcessingProperties;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Business time zone and the clock every "now" in the application is read from. */
@Configuration
@EnableConfigurationProperties(RecurringProcessingProperties.class)
public class BusinessTimeConfig {

  @Bean
  public ZoneId businessZone(RecurringProcessingProperties properties) {
    return properties.zone();
  }

  @Bean
  public Clock clock(ZoneId businessZone) {
    return Clock.system(businessZone);
  }
}
