package com.dronetrack.tracker.affiliation;

import java.util.Locale;

/** Trust classification applied to a tracked UID. */
public enum Affiliation {
  AUTHORIZED,
  UNAUTHORIZED,
  UNKNOWN;

  /** Lower-case label as used in affiliation files and sink payloads. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a section label; unrecognised or blank labels map to {@link #UNKNOWN}.
   *
   * @param label label such as {@code authorized}
   * @return parsed affiliation
   */
  public static Affiliation fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return UNKNOWN;
    }
    for (Affiliation value : values()) {
      if (value.label().equals(label.trim().toLowerCase(Locale.ROOT))) {
        return value;
      }
    }
    return UNKNOWN;
  }
}
