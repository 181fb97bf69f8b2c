package com.dronetrack.tracker.telemetry;

/**
 * Best-effort numeric coercion for loosely typed Remote-ID fields.
 *
 * <p>Front-ends send numbers as JSON numbers, as plain strings, or as strings carrying a unit
 * ({@code "0.25 m/s"}). Only the leading whitespace-delimited token is parsed; anything that still
 * fails yields the caller's fallback.
 */
public final class LenientNumbers {
  private LenientNumbers() {}

  public static double toDouble(Object raw, double fallback) {
    Double value = parse(raw);
    return value == null ? fallback : value;
  }

  public static Double toNullableDouble(Object raw) {
    return parse(raw);
  }

  public static int toInt(Object raw, int fallback) {
    Double value = parse(raw);
    return value == null ? fallback : value.intValue();
  }

  public static long toLong(Object raw, long fallback) {
    Double value = parse(raw);
    return value == null ? fallback : value.longValue();
  }

  private static Double parse(Object raw) {
    if (raw == null || raw instanceof Boolean) {
      return null;
    }
    double value;
    if (raw instanceof Number number) {
      value = number.doubleValue();
    } else {
      String token = leadingToken(raw.toString());
      if (token.isEmpty()) {
        return null;
      }
      try {
        value = Double.parseDouble(token);
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return Double.isFinite(value) ? value : null;
  }

  static String leadingToken(String text) {
    String trimmed = text.trim();
    int end = 0;
    while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
      end++;
    }
    return trimmed.substring(0, end);
  }
}
