package com.dronetrack.tracker.telemetry;

import java.util.Locale;
import java.util.Optional;

/** Remote-ID unmanned aircraft type table (ASTM F3411 codes 0-15). */
public enum UaType {
  NONE(0, "No UA type defined"),
  AEROPLANE(1, "Aeroplane/Airplane (Fixed wing)"),
  HELICOPTER_OR_MULTIROTOR(2, "Helicopter or Multirotor"),
  GYROPLANE(3, "Gyroplane"),
  VTOL(4, "VTOL (Vertical Take-Off and Landing)"),
  ORNITHOPTER(5, "Ornithopter"),
  GLIDER(6, "Glider"),
  KITE(7, "Kite"),
  FREE_BALLOON(8, "Free Balloon"),
  CAPTIVE_BALLOON(9, "Captive Balloon"),
  AIRSHIP(10, "Airship (Blimp)"),
  FREE_FALL_PARACHUTE(11, "Free Fall/Parachute"),
  ROCKET(12, "Rocket"),
  TETHERED_POWERED_AIRCRAFT(13, "Tethered powered aircraft"),
  GROUND_OBSTACLE(14, "Ground Obstacle"),
  OTHER(15, "Other type");

  /** Name reported when the raw value does not resolve to a table entry. */
  public static final String UNKNOWN_NAME = "Unknown";

  private final int code;
  private final String displayName;

  UaType(int code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  public int code() {
    return code;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Resolves a raw wire value, either an integer code or a case-insensitive display name.
   *
   * @param raw value as decoded from JSON (number, string or {@code null})
   * @return matching entry, or empty when the value is outside the table
   */
  public static Optional<UaType> resolve(Object raw) {
    if (raw == null || raw instanceof Boolean) {
      return Optional.empty();
    }
    if (raw instanceof Number number) {
      return fromCode(number.intValue());
    }
    String text = raw.toString().trim();
    try {
      return fromCode(Integer.parseInt(text));
    } catch (NumberFormatException ex) {
      String lowered = text.toLowerCase(Locale.ROOT);
      for (UaType type : values()) {
        if (type.displayName.toLowerCase(Locale.ROOT).equals(lowered)) {
          return Optional.of(type);
        }
      }
      return Optional.empty();
    }
  }

  public static Optional<UaType> fromCode(Integer code) {
    if (code == null) {
      return Optional.empty();
    }
    for (UaType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
