package com.dronetrack.tracker.ingest;

import com.dronetrack.tracker.affiliation.AffiliationResolver;
import com.dronetrack.tracker.config.TrackerProperties;
import com.dronetrack.tracker.registry.DroneRegistry;
import com.dronetrack.tracker.telemetry.Observation;
import com.dronetrack.tracker.telemetry.TelemetryNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies inbound Remote-ID messages to the drone registry.
 *
 * <p>Messages with a serial id are keyed by it (optionally prefixed) and tagged with their
 * affiliation. Messages without one are matched to an existing drone by MAC address.
 */
public class TelemetryIngestService {
  private static final Logger LOGGER = LoggerFactory.getLogger(TelemetryIngestService.class);

  private final TelemetryNormalizer normalizer;
  private final DroneRegistry registry;
  private final ObjectMapper objectMapper;
  private final Optional<AffiliationResolver> affiliationResolver;
  private final String idPrefix;
  private final Counter receivedCounter;
  private final Counter invalidJsonCounter;
  private final Counter unparseableCounter;
  private final Counter uncorrelatedCounter;

  public TelemetryIngestService(
      TelemetryNormalizer normalizer,
      DroneRegistry registry,
      ObjectMapper objectMapper,
      Optional<AffiliationResolver> affiliationResolver,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    this.normalizer = normalizer;
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.affiliationResolver = affiliationResolver;
    String prefix = properties.getIngest().getIdPrefix();
    this.idPrefix = prefix == null ? "" : prefix.trim();
    this.receivedCounter = meterRegistry.counter("tracker.messages.received");
    this.invalidJsonCounter = meterRegistry.counter("tracker.messages.dropped", "reason", "invalid_json");
    this.unparseableCounter = meterRegistry.counter("tracker.messages.dropped", "reason", "unparseable");
    this.uncorrelatedCounter = meterRegistry.counter("tracker.messages.dropped", "reason", "uncorrelated");
  }

  /** Decodes a JSON payload and applies it. */
  public IngestResult ingestPayload(String payload) {
    Object message;
    try {
      message = objectMapper.readValue(payload, Object.class);
    } catch (JsonProcessingException ex) {
      receivedCounter.increment();
      invalidJsonCounter.increment();
      LOGGER.debug("Failed to parse payload", ex);
      return IngestResult.INVALID_JSON;
    }
    return ingest(message);
  }

  /**
   * Applies one decoded message.
   *
   * @param message a list of message parts or a single map
   * @return the outcome
   */
  public IngestResult ingest(Object message) {
    receivedCounter.increment();
    Optional<Observation> normalized = normalizer.normalize(message);
    if (normalized.isEmpty()) {
      unparseableCounter.increment();
      return IngestResult.UNPARSEABLE;
    }

    Observation observation = normalized.get();
    if (observation.hasId()) {
      observation.setId(canonicalId(observation.getId()));
      affiliationResolver.ifPresent(resolver ->
          observation.setAffiliation(resolver.resolve(observation.getId())));
      registry.upsert(observation);
      return IngestResult.UPSERTED;
    }
    if (registry.correlateByMac(observation)) {
      return IngestResult.CORRELATED;
    }
    uncorrelatedCounter.increment();
    LOGGER.debug("Dropping message without id; no drone matches MAC '{}'", observation.getMac());
    return IngestResult.UNCORRELATED;
  }

  String canonicalId(String id) {
    if (idPrefix.isEmpty() || id.startsWith(idPrefix)) {
      return id;
    }
    return idPrefix + id;
  }
}
