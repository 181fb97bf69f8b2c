package com.dronetrack.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the tracker service.
 *
 * <p>The tracker consumes Remote-ID telemetry from Redis, maintains the live drone registry, and
 * republishes CoT events and sink messages at a controlled rate.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TrackerApplication {
  /**
   * Starts the tracker application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(TrackerApplication.class, args);
  }
}
