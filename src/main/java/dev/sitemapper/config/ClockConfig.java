package dev.sitemapper.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} behind page {@code lastmod} dates and snapshot timestamps.
 *
 * <p>Uses {@code sitemapper.time-zone} when set, otherwise the system default zone.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock(@Value("${sitemapper.time-zone:}") String timeZone) {
    if (timeZone.isBlank()) {
      return Clock.systemDefaultZone();
    }
    return Clock.system(ZoneId.of(timeZone));
  }
}
