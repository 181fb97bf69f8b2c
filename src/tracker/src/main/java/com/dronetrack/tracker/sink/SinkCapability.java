package com.dronetrack.tracker.sink;

/** Operations a {@link DroneSink} declares support for. */
public enum SinkCapability {
  PUBLISH_DRONE,
  PUBLISH_PILOT,
  PUBLISH_HOME,
  PUBLISH_SYSTEM,
  MARK_INACTIVE,
  CLOSE
}
