package com.dronetrack.tracker.registry;

/** Callback fired before a drone record leaves the registry. */
@FunctionalInterface
public interface DroneEvictionListener {
  void onEvict(String droneId);
}
