package com.dronetrack.tracker.affiliation;

import com.dronetrack.tracker.config.TrackerProperties;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for optional affiliation lookup.
 *
 * <p>When disabled, every drone is reported as {@link Affiliation#UNKNOWN}.
 */
@Configuration
public class AffiliationConfig {

  /**
   * Creates the file-backed resolver when {@code dronetrack.affiliation.enabled=true}.
   *
   * @param properties tracker configuration properties
   * @return resolver reading the configured INI file
   */
  @Bean
  @ConditionalOnProperty(prefix = "dronetrack.affiliation", name = "enabled", havingValue = "true")
  public AffiliationResolver affiliationResolver(TrackerProperties properties) {
    String path = properties.getAffiliation().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("dronetrack.affiliation.enabled=true but dronetrack.affiliation.path is empty");
    }
    return new IniAffiliationResolver(Path.of(path));
  }
}
