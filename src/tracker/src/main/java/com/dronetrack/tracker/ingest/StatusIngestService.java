package com.dronetrack.tracker.ingest;

import com.dronetrack.tracker.dispatch.DispatchScheduler;
import com.dronetrack.tracker.status.SystemStatus;
import com.dronetrack.tracker.status.SystemStatusParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Forwards sensor status reports to the CoT transport and the sinks. Status never touches the registry. */
public class StatusIngestService {
  private static final Logger LOGGER = LoggerFactory.getLogger(StatusIngestService.class);

  private final SystemStatusParser parser;
  private final DispatchScheduler scheduler;
  private final ObjectMapper objectMapper;
  private final Counter receivedCounter;
  private final Counter invalidJsonCounter;
  private final Counter unparseableCounter;

  public StatusIngestService(
      SystemStatusParser parser,
      DispatchScheduler scheduler,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.parser = parser;
    this.scheduler = scheduler;
    this.objectMapper = objectMapper;
    this.receivedCounter = meterRegistry.counter("tracker.status.received");
    this.invalidJsonCounter = meterRegistry.counter("tracker.status.dropped", "reason", "invalid_json");
    this.unparseableCounter = meterRegistry.counter("tracker.status.dropped", "reason", "unparseable");
  }

  public IngestResult ingestPayload(String payload) {
    receivedCounter.increment();
    Object message;
    try {
      message = objectMapper.readValue(payload, Object.class);
    } catch (JsonProcessingException ex) {
      invalidJsonCounter.increment();
      LOGGER.warn("Status JSON decode failed: {}", ex.getOriginalMessage());
      return IngestResult.INVALID_JSON;
    }
    Optional<SystemStatus> status = parser.parse(message);
    if (status.isEmpty()) {
      unparseableCounter.increment();
      return IngestResult.UNPARSEABLE;
    }
    scheduler.publishSystemStatus(status.get());
    return IngestResult.STATUS_PUBLISHED;
  }
}
