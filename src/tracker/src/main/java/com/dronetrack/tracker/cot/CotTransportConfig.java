package com.dronetrack.tracker.cot;

import com.dronetrack.tracker.config.TrackerProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Spring configuration for the optional CoT network output. */
@Configuration
public class CotTransportConfig {

  /**
   * Opens the UDP transport when {@code dronetrack.cot.enabled=true}.
   *
   * @param properties tracker configuration properties
   * @return transport sending to the configured host and port
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "dronetrack.cot", name = "enabled", havingValue = "true")
  public CotTransport cotTransport(TrackerProperties properties) {
    TrackerProperties.Cot cot = properties.getCot();
    if (cot.getHost() == null || cot.getHost().isBlank()) {
      throw new IllegalStateException("dronetrack.cot.enabled=true but dronetrack.cot.host is empty");
    }
    return new UdpCotTransport(cot.getHost(), cot.getPort(), cot.getMulticastTtl());
  }
}
