package com.dronetrack.tracker.sink;

import com.dronetrack.tracker.registry.DroneSnapshot;
import com.dronetrack.tracker.status.SystemStatus;
import java.util.Set;

/**
 * Downstream consumer of drone state.
 *
 * <p>A sink implements the subset of operations it lists in {@link #capabilities()}; the router
 * never calls an operation outside that set. Calls to one sink arrive one at a time, in the order
 * they were routed, on that sink's own worker thread.
 */
public interface DroneSink {

  /** Short stable name used in logs and metric tags. */
  String name();

  Set<SinkCapability> capabilities();

  default void publishDrone(DroneSnapshot drone) {
    throw new UnsupportedOperationException(name() + " does not publish drones");
  }

  default void publishPilot(String droneId, double lat, double lon, double alt) {
    throw new UnsupportedOperationException(name() + " does not publish pilots");
  }

  default void publishHome(String droneId, double lat, double lon, double alt) {
    throw new UnsupportedOperationException(name() + " does not publish home points");
  }

  default void publishSystem(SystemStatus status) {
    throw new UnsupportedOperationException(name() + " does not publish sensor status");
  }

  default void markInactive(String droneId) {
    throw new UnsupportedOperationException(name() + " does not track inactivity");
  }

  default void close() {
  }
}
