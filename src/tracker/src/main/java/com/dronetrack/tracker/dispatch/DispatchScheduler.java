package com.dronetrack.tracker.dispatch;

import com.dronetrack.tracker.cot.CotEncoder;
import com.dronetrack.tracker.cot.CotTransport;
import com.dronetrack.tracker.registry.DroneEvictionListener;
import com.dronetrack.tracker.registry.DroneRecord;
import com.dronetrack.tracker.registry.DroneRegistry;
import com.dronetrack.tracker.registry.DroneSnapshot;
import com.dronetrack.tracker.sink.SinkRouter;
import com.dronetrack.tracker.status.SystemStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-tick driver of outbound updates.
 *
 * <p>On every tick this component:
 * <ul>
 *   <li>selects active records whose last send is at least one rate-limit interval old</li>
 *   <li>sends the drone, pilot and home CoT events as independent calls on the dispatcher</li>
 *   <li>routes the same update to every sink on the sink's own lane</li>
 *   <li>marks each selected record as sent whatever the call outcomes</li>
 *   <li>notifies sinks of drones idle past the inactivity timeout, then drops them</li>
 * </ul>
 *
 * <p>Runs on the ingest loop thread; outbound calls only see immutable snapshots.
 */
public class DispatchScheduler {
  private static final Logger LOGGER = LoggerFactory.getLogger(DispatchScheduler.class);
  static final String COT_TARGET = "cot";

  private final DroneRegistry registry;
  private final CotEncoder encoder;
  private final Optional<CotTransport> transport;
  private final SinkRouter sinkRouter;
  private final DroneEvictionListener evictionListener;
  private final CallDispatcher dispatcher;
  private final Duration rateLimit;
  private final MeterRegistry meterRegistry;
  private final Counter updatesCounter;
  private final Counter systemUpdatesCounter;
  private final Counter inactiveEvictions;
  private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();

  public DispatchScheduler(
      DroneRegistry registry,
      CotEncoder encoder,
      Optional<CotTransport> transport,
      SinkRouter sinkRouter,
      DroneEvictionListener evictionListener,
      CallDispatcher dispatcher,
      Duration rateLimit,
      MeterRegistry meterRegistry) {
    this.registry = registry;
    this.encoder = encoder;
    this.transport = transport;
    this.sinkRouter = sinkRouter;
    this.evictionListener = evictionListener;
    this.dispatcher = dispatcher;
    this.rateLimit = rateLimit;
    this.meterRegistry = meterRegistry;
    this.updatesCounter = meterRegistry.counter("tracker.dispatch.updates");
    this.systemUpdatesCounter = meterRegistry.counter("tracker.dispatch.system_updates");
    this.inactiveEvictions = meterRegistry.counter("tracker.drones.evicted", "reason", "inactive");
  }

  /**
   * Runs one dispatch pass followed by the inactivity sweep.
   *
   * @param now the tick time
   * @return number of records an update was sent for
   */
  public int tick(Instant now) {
    int sent = 0;
    for (DroneRecord record : registry.activeRecords()) {
      if (registry.isExpired(record, now)) {
        continue;
      }
      if (Duration.between(record.getLastSentTime(), now).compareTo(rateLimit) < 0) {
        continue;
      }
      dispatch(record, now);
      sent++;
    }

    List<String> expired = registry.sweep(now);
    for (String id : expired) {
      try {
        evictionListener.onEvict(id);
      } catch (RuntimeException ex) {
        LOGGER.warn("Eviction notice failed for drone {}", id, ex);
      }
      registry.remove(id);
      inactiveEvictions.increment();
      LOGGER.debug("Drone {} inactive, removed", id);
    }
    return sent;
  }

  private void dispatch(DroneRecord record, Instant now) {
    Duration age = Duration.between(record.getLastUpdateTime(), now);
    double staleOffset = seconds(registry.inactivityTimeout()) - seconds(age);
    DroneSnapshot drone = record.snapshot();

    transport.ifPresent(cot -> {
      track(dispatcher.submit(COT_TARGET, () -> cot.sendEvent(encoder.encodeMain(drone, staleOffset))));
      if (drone.hasPilotLocation()) {
        track(dispatcher.submit(COT_TARGET, () -> cot.sendEvent(encoder.encodePilot(drone, staleOffset))));
      }
      if (drone.hasHomeLocation()) {
        track(dispatcher.submit(COT_TARGET, () -> cot.sendEvent(encoder.encodeHome(drone, staleOffset))));
      }
    });
    sinkRouter.publish(drone);

    LOGGER.debug(
        "Sent update for drone {} (moved {} deg since last send)",
        drone.id(),
        Math.hypot(drone.lat() - record.getLastSentLat(), drone.lon() - record.getLastSentLon()));
    record.markSent(now);
    updatesCounter.increment();
  }

  /**
   * Sends a sensor status report as a CoT event and forwards it to the sinks.
   *
   * <p>Status events carry no stale offset and stay valid for the default period.
   */
  public void publishSystemStatus(SystemStatus status) {
    transport.ifPresent(cot ->
        track(dispatcher.submit(COT_TARGET, () -> cot.sendEvent(encoder.encodeSystemStatus(status)))));
    sinkRouter.publishSystem(status);
    systemUpdatesCounter.increment();
    LOGGER.debug("Sent status of sensor {}", status.serialNumber());
  }

  private void track(CompletableFuture<DeliveryOutcome> outcome) {
    outcome.thenAccept(result -> {
      if (!result.success()) {
        failureCounters
            .computeIfAbsent(result.target(), t -> meterRegistry.counter("tracker.delivery.failures", "target", t))
            .increment();
        LOGGER.warn("Delivery to {} failed", result.target(), result.error());
      }
    });
  }

  private static double seconds(Duration duration) {
    return duration.toNanos() / 1_000_000_000d;
  }
}
