package com.dronetrack.tracker.sink;

import com.dronetrack.tracker.dispatch.CallDispatcher;
import com.dronetrack.tracker.dispatch.DeliveryOutcome;
import com.dronetrack.tracker.registry.DroneSnapshot;
import com.dronetrack.tracker.status.SystemStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans drone updates out to every registered {@link DroneSink}.
 *
 * <p>Every sink owns a lane, a {@link CallDispatcher} used by that sink alone. Each sink
 * operation is a separate time-bounded call on the sink's lane, so:
 * <ul>
 *   <li>a slow or failing sink never delays another sink or the CoT transport</li>
 *   <li>calls reach one sink in routing order, so an eviction notice is never overtaken by an
 *       earlier update of the same drone</li>
 * </ul>
 *
 * <p>Capabilities are read once when the router is built.
 */
public class SinkRouter {
  private static final Logger LOGGER = LoggerFactory.getLogger(SinkRouter.class);
  private static final double MARKER_ALTITUDE = 0.0;

  private final List<Registration> registrations;
  private final AtomicBoolean closed = new AtomicBoolean();

  public SinkRouter(
      List<? extends DroneSink> sinks,
      Function<String, ? extends CallDispatcher> laneFactory,
      MeterRegistry meterRegistry) {
    List<Registration> registered = new ArrayList<>();
    for (DroneSink sink : sinks) {
      Set<SinkCapability> declared = sink.capabilities();
      Set<SinkCapability> capabilities = declared == null || declared.isEmpty()
          ? EnumSet.noneOf(SinkCapability.class)
          : EnumSet.copyOf(declared);
      registered.add(new Registration(
          sink,
          capabilities,
          laneFactory.apply(sink.name()),
          meterRegistry.counter("tracker.delivery.failures", "target", sink.name())));
      LOGGER.info("Registered sink {} with capabilities {}", sink.name(), capabilities);
    }
    this.registrations = List.copyOf(registered);
  }

  /**
   * Publishes a drone, and its pilot and home points when they are known.
   *
   * @return one pending outcome per routed call, in sink order
   */
  public List<CompletableFuture<DeliveryOutcome>> publish(DroneSnapshot drone) {
    List<CompletableFuture<DeliveryOutcome>> outcomes = new ArrayList<>();
    for (Registration registration : registrations) {
      DroneSink sink = registration.sink();
      if (registration.supports(SinkCapability.PUBLISH_DRONE)) {
        outcomes.add(route(registration, "publishDrone", () -> sink.publishDrone(drone)));
      }
      if (drone.hasPilotLocation() && registration.supports(SinkCapability.PUBLISH_PILOT)) {
        outcomes.add(route(registration, "publishPilot", () ->
            sink.publishPilot(drone.id(), drone.pilotLat(), drone.pilotLon(), MARKER_ALTITUDE)));
      }
      if (drone.hasHomeLocation() && registration.supports(SinkCapability.PUBLISH_HOME)) {
        outcomes.add(route(registration, "publishHome", () ->
            sink.publishHome(drone.id(), drone.homeLat(), drone.homeLon(), MARKER_ALTITUDE)));
      }
    }
    return outcomes;
  }

  /** Forwards a sensor status report to every capable sink. */
  public List<CompletableFuture<DeliveryOutcome>> publishSystem(SystemStatus status) {
    List<CompletableFuture<DeliveryOutcome>> outcomes = new ArrayList<>();
    for (Registration registration : registrations) {
      if (registration.supports(SinkCapability.PUBLISH_SYSTEM)) {
        DroneSink sink = registration.sink();
        outcomes.add(route(registration, "publishSystem", () -> sink.publishSystem(status)));
      }
    }
    return outcomes;
  }

  /** Tells every capable sink that the drone is gone, after any update already routed to it. */
  public List<CompletableFuture<DeliveryOutcome>> onEvict(String droneId) {
    List<CompletableFuture<DeliveryOutcome>> outcomes = new ArrayList<>();
    for (Registration registration : registrations) {
      if (registration.supports(SinkCapability.MARK_INACTIVE)) {
        DroneSink sink = registration.sink();
        outcomes.add(route(registration, "markInactive", () -> sink.markInactive(droneId)));
      }
    }
    return outcomes;
  }

  /**
   * Closes every capable sink once, behind its pending calls, then stops the lanes. Later calls
   * are a no-op.
   *
   * @return the close outcomes; a close still pending when its lane stopped counts as failed
   */
  public List<DeliveryOutcome> closeAll() {
    if (!closed.compareAndSet(false, true)) {
      return List.of();
    }
    Map<String, CompletableFuture<DeliveryOutcome>> pending = new LinkedHashMap<>();
    for (Registration registration : registrations) {
      if (registration.supports(SinkCapability.CLOSE)) {
        DroneSink sink = registration.sink();
        pending.put(sink.name(), route(registration, "close", sink::close));
      }
    }
    for (Registration registration : registrations) {
      registration.lane().close();
    }
    List<DeliveryOutcome> outcomes = new ArrayList<>();
    pending.forEach((name, close) -> outcomes.add(
        close.getNow(DeliveryOutcome.failed(name, new TimeoutException("close of " + name + " did not finish")))));
    return outcomes;
  }

  public int sinkCount() {
    return registrations.size();
  }

  private CompletableFuture<DeliveryOutcome> route(Registration registration, String operation, Runnable call) {
    String name = registration.sink().name();
    return registration.lane().submit(name, call).thenApply(result -> {
      if (!result.success()) {
        registration.failures().increment();
        LOGGER.warn("Sink {} failed on {}", name, operation, result.error());
      }
      return result;
    });
  }

  private record Registration(
      DroneSink sink,
      Set<SinkCapability> capabilities,
      CallDispatcher lane,
      Counter failures) {
    boolean supports(SinkCapability capability) {
      return capabilities.contains(capability);
    }
  }
}
