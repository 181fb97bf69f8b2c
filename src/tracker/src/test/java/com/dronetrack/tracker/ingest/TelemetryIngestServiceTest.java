package com.dronetrack.tracker.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dronetrack.tracker.affiliation.Affiliation;
import com.dronetrack.tracker.affiliation.AffiliationResolver;
import com.dronetrack.tracker.config.TrackerProperties;
import com.dronetrack.tracker.registry.DroneRecord;
import com.dronetrack.tracker.registry.DroneRegistry;
import com.dronetrack.tracker.support.MutableClock;
import com.dronetrack.tracker.telemetry.TelemetryNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryIngestServiceTest {
  private static final String SERIAL_X = """
      [
        {"MAC": "M", "RSSI": -60},
        {"Basic ID": {"id_type": "Serial Number (ANSI/CTA-2063-A)", "id": "X", "ua_type": 2}},
        {"Location/Vector Message": {"latitude": 1.0, "longitude": 1.0}}
      ]
      """;
  private static final String CAA_C = """
      [
        {"MAC": "M"},
        {"Basic ID": {"id_type": "CAA Assigned Registration ID", "id": "C"}}
      ]
      """;

  private SimpleMeterRegistry meterRegistry;
  private TrackerProperties properties;
  private DroneRegistry registry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    properties = new TrackerProperties();
    registry = new DroneRegistry(
        30, Duration.ofSeconds(60), MutableClock.startingAt("2025-06-01T12:00:00Z"), id -> { }, meterRegistry);
  }

  private TelemetryIngestService service(Optional<AffiliationResolver> resolver) {
    return new TelemetryIngestService(
        new TelemetryNormalizer(), registry, new ObjectMapper(), resolver, properties, meterRegistry);
  }

  @Test
  void serialThenCaaMessages_produceOneRecordWithBothIds() {
    TelemetryIngestService service = service(Optional.empty());

    assertEquals(IngestResult.UPSERTED, service.ingestPayload(SERIAL_X));
    assertEquals(IngestResult.CORRELATED, service.ingestPayload(CAA_C));

    assertEquals(1, registry.size());
    DroneRecord record = registry.get("drone-X").orElseThrow();
    assertEquals("C", record.getCaa());
    assertEquals("Helicopter or Multirotor", record.getUaTypeName());
    assertEquals(2.0, meterRegistry.counter("tracker.messages.received").count());
  }

  @Test
  void caaMessageWithoutKnownMac_isDropped() {
    TelemetryIngestService service = service(Optional.empty());

    assertEquals(IngestResult.UNCORRELATED, service.ingestPayload(CAA_C));

    assertEquals(0, registry.size());
    assertEquals(1.0, meterRegistry.counter("tracker.messages.dropped", "reason", "uncorrelated").count());
  }

  @Test
  void invalidJson_isCountedAndDropped() {
    TelemetryIngestService service = service(Optional.empty());

    assertEquals(IngestResult.INVALID_JSON, service.ingestPayload("{not json"));

    assertEquals(1.0, meterRegistry.counter("tracker.messages.dropped", "reason", "invalid_json").count());
    assertEquals(1.0, meterRegistry.counter("tracker.messages.received").count());
  }

  @Test
  void scalarPayload_isUnparseable() {
    TelemetryIngestService service = service(Optional.empty());

    IngestResult result = service.ingestPayload("\"hello\"");

    assertEquals(IngestResult.UNPARSEABLE, result);
    assertEquals(1.0, meterRegistry.counter("tracker.messages.dropped", "reason", "unparseable").count());
  }

  @Test
  void defaultIdPrefix_isAppliedOnce() {
    TelemetryIngestService service = service(Optional.empty());

    service.ingestPayload(SERIAL_X);

    assertTrue(registry.get("drone-X").isPresent());
    assertEquals("drone-X", service.canonicalId("drone-X"));
    assertEquals("drone-Y", service.canonicalId("Y"));
  }

  @Test
  void emptyIdPrefix_keepsSerialAsIs() {
    properties.getIngest().setIdPrefix("");
    TelemetryIngestService service = service(Optional.empty());

    service.ingestPayload(SERIAL_X);

    assertTrue(registry.get("X").isPresent());
  }

  @Test
  void affiliation_isResolvedForCanonicalId() {
    TelemetryIngestService service = service(Optional.of(
        uid -> "drone-X".equals(uid) ? Affiliation.AUTHORIZED : Affiliation.UNKNOWN));

    service.ingestPayload(SERIAL_X);

    assertEquals(Affiliation.AUTHORIZED, registry.get("drone-X").orElseThrow().getAffiliation());
  }

  @Test
  void messageWithoutIdOrMac_isDropped() {
    TelemetryIngestService service = service(Optional.empty());

    IngestResult result = service.ingestPayload("[{\"Self-ID Message\": {\"text\": \"hello\"}}]");

    assertEquals(IngestResult.UNCORRELATED, result);
    assertTrue(registry.activeRecords().isEmpty());
  }
}
