package com.dronetrack.tracker.status;

import com.dronetrack.tracker.telemetry.LenientNumbers;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads sensor status messages ({@code serial_number}, {@code gps_data}, {@code system_stats},
 * {@code ant_sdr_temps}) into {@link SystemStatus}.
 *
 * <p>Missing sections and unparseable numbers fall back to zero; only a non-object message is
 * rejected.
 */
@Component
public class SystemStatusParser {
  private static final Logger log = LoggerFactory.getLogger(SystemStatusParser.class);

  static final String UNKNOWN_SERIAL = "unknown";
  static final String NOT_AVAILABLE = "N/A";
  private static final double BYTES_PER_MIB = 1024 * 1024;

  public Optional<SystemStatus> parse(Object message) {
    if (!(message instanceof Map<?, ?> status)) {
      log.warn(
          "Unexpected status format {}; expected map",
          message == null ? "null" : message.getClass().getSimpleName());
      return Optional.empty();
    }
    Object serial = status.get("serial_number");
    Map<?, ?> gps = section(status, "gps_data");
    Map<?, ?> stats = section(status, "system_stats");
    Map<?, ?> memory = section(stats, "memory");
    Map<?, ?> disk = section(stats, "disk");
    Map<?, ?> sdrTemps = section(status, "ant_sdr_temps");

    SystemStatus parsed = new SystemStatus(
        serial == null || serial.toString().isEmpty() ? UNKNOWN_SERIAL : serial.toString(),
        number(gps, "latitude"),
        number(gps, "longitude"),
        number(gps, "altitude"),
        number(gps, "speed"),
        number(gps, "track"),
        number(stats, "cpu_usage"),
        number(memory, "total") / BYTES_PER_MIB,
        number(memory, "available") / BYTES_PER_MIB,
        number(disk, "total") / BYTES_PER_MIB,
        number(disk, "used") / BYTES_PER_MIB,
        number(stats, "temperature"),
        number(stats, "uptime"),
        text(sdrTemps, "pluto_temp"),
        text(sdrTemps, "zynq_temp"));
    if (!parsed.hasLocation()) {
      log.warn("Status from sensor {} has no position; reporting 0.0, 0.0", parsed.serialNumber());
    }
    return Optional.of(parsed);
  }

  private static Map<?, ?> section(Map<?, ?> parent, String key) {
    Object value = parent.get(key);
    return value instanceof Map<?, ?> map ? map : Map.of();
  }

  private static double number(Map<?, ?> section, String key) {
    return LenientNumbers.toDouble(section.get(key), 0.0);
  }

  private static String text(Map<?, ?> section, String key) {
    Object value = section.get(key);
    return value == null ? NOT_AVAILABLE : value.toString();
  }
}
