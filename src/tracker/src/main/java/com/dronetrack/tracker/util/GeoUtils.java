package com.dronetrack.tracker.util;

import java.time.Duration;

/**
 * Geographic helpers for bearing calculations.
 */
public final class GeoUtils {

  private GeoUtils() {}

  /**
   * Initial great-circle bearing from the first point toward the second.
   *
   * @return bearing in degrees, normalized into [0, 360)
   */
  public static double initialBearing(double lat1, double lon1, double lat2, double lon2) {
    double phi1 = Math.toRadians(lat1);
    double phi2 = Math.toRadians(lat2);
    double deltaLambda = Math.toRadians(lon2 - lon1);

    double x = Math.sin(deltaLambda) * Math.cos(phi2);
    double y = Math.cos(phi1) * Math.sin(phi2)
        - Math.sin(phi1) * Math.cos(phi2) * Math.cos(deltaLambda);

    double bearing = (Math.toDegrees(Math.atan2(x, y)) + 360.0) % 360.0;
    return bearing >= 360.0 ? 0.0 : bearing;
  }

  /** {@code true} unless both coordinates are exactly zero, the "unknown location" sentinel. */
  public static boolean isKnownLocation(double lat, double lon) {
    return lat != 0.0 || lon != 0.0;
  }

  /** Converts fractional seconds from configuration into a {@link Duration}. */
  public static Duration seconds(double seconds) {
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }
}
