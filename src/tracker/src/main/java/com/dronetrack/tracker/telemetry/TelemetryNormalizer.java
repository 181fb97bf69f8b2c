package com.dronetrack.tracker.telemetry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes raw Remote-ID messages into {@link Observation}s.
 *
 * <p>Two wire shapes are accepted:
 * <ul>
 *   <li>a list of tagged parts, each a map keyed by the Remote-ID message name (SDR front-ends)</li>
 *   <li>a single map carrying the same tagged sub-maps plus BLE advertising metadata</li>
 * </ul>
 *
 * <p>The normalizer performs no I/O and never throws: malformed fields fall back to defaults and
 * malformed top-level input yields {@link Optional#empty()}.
 */
@Component
public class TelemetryNormalizer {
  private static final Logger log = LoggerFactory.getLogger(TelemetryNormalizer.class);

  public static final String BASIC_ID = "Basic ID";
  public static final String LOCATION_VECTOR = "Location/Vector Message";
  public static final String SELF_ID = "Self-ID Message";
  public static final String OPERATOR_ID = "Operator ID Message";
  public static final String SYSTEM = "System Message";
  public static final String FREQUENCY = "Frequency Message";

  public static final String SERIAL_NUMBER_ID_TYPE = "Serial Number (ANSI/CTA-2063-A)";
  public static final String CAA_REGISTRATION_ID_TYPE = "CAA Assigned Registration ID";

  /**
   * Normalizes one decoded JSON message.
   *
   * @param message a {@link List} of part maps or a single {@link Map}
   * @return the observation, or empty when the message is unusable
   */
  public Optional<Observation> normalize(Object message) {
    if (message instanceof List<?> parts) {
      return normalizeParts(parts);
    }
    if (message instanceof Map<?, ?> map) {
      return Optional.of(normalizeMap(map));
    }
    log.error(
        "Unexpected message format {}; expected list or map",
        message == null ? "null" : message.getClass().getSimpleName());
    return Optional.empty();
  }

  private Optional<Observation> normalizeParts(List<?> parts) {
    Observation observation = new Observation();
    boolean extracted = false;
    for (Object part : parts) {
      if (!(part instanceof Map<?, ?> item)) {
        log.error("Unexpected item type in message list; expected map");
        continue;
      }
      if (item.containsKey("MAC")) {
        observation.setMac(text(item.get("MAC")));
        extracted = true;
      }
      if (item.containsKey("RSSI")) {
        observation.setRssi(LenientNumbers.toInt(item.get("RSSI"), 0));
        extracted = true;
      }
      extracted |= applyFrequency(observation, section(item, FREQUENCY));
      extracted |= applyBasicId(observation, section(item, BASIC_ID));
      extracted |= applyOperatorId(observation, section(item, OPERATOR_ID));
      extracted |= applyLocation(observation, section(item, LOCATION_VECTOR));
      extracted |= applySelfId(observation, section(item, SELF_ID));

      Map<?, ?> system = section(item, SYSTEM);
      if (system != null) {
        observation.setPilotLat(LenientNumbers.toDouble(system.get("latitude"), 0.0));
        observation.setPilotLon(LenientNumbers.toDouble(system.get("longitude"), 0.0));
        observation.setHomeLat(LenientNumbers.toDouble(system.get("home_lat"), 0.0));
        observation.setHomeLon(LenientNumbers.toDouble(system.get("home_lon"), 0.0));
        extracted = true;
      }
    }
    if (!extracted) {
      log.warn("Message list of {} part(s) carried no Remote-ID fields; skipping", parts.size());
      return Optional.empty();
    }
    return Optional.of(observation);
  }

  private Observation normalizeMap(Map<?, ?> message) {
    Observation observation = new Observation();
    observation.setIndex(LenientNumbers.toLong(message.get("index"), 0L));
    observation.setRuntime(LenientNumbers.toLong(message.get("runtime"), 0L));

    Map<?, ?> advertising = section(message, "AUX_ADV_IND");
    if (advertising != null) {
      if (advertising.containsKey("rssi")) {
        observation.setRssi(LenientNumbers.toInt(advertising.get("rssi"), 0));
      }
      Map<?, ?> extended = section(message, "aext");
      if (extended != null && extended.get("AdvA") != null) {
        observation.setMac(LenientNumbers.leadingToken(text(extended.get("AdvA"))));
      }
    }

    applyBasicId(observation, section(message, BASIC_ID));
    applyOperatorId(observation, section(message, OPERATOR_ID));
    applyLocation(observation, section(message, LOCATION_VECTOR));
    applySelfId(observation, section(message, SELF_ID));

    Map<?, ?> system = section(message, SYSTEM);
    if (system != null) {
      // BLE front-ends report the operator position only; no home point.
      observation.setPilotLat(LenientNumbers.toDouble(system.get("operator_lat"), 0.0));
      observation.setPilotLon(LenientNumbers.toDouble(system.get("operator_lon"), 0.0));
    }

    applyFrequency(observation, section(message, FREQUENCY));
    return observation;
  }

  private boolean applyBasicId(Observation observation, Map<?, ?> basic) {
    if (basic == null) {
      return false;
    }
    Optional<UaType> uaType = UaType.resolve(basic.get("ua_type"));
    observation.setUaType(uaType.map(UaType::code).orElse(null));
    observation.setUaTypeName(uaType.map(UaType::displayName).orElse(UaType.UNKNOWN_NAME));

    Object idType = basic.get("id_type");
    observation.setIdType(idType == null ? "" : idType.toString());
    if (basic.containsKey("MAC")) {
      observation.setMac(text(basic.get("MAC")));
    }
    if (basic.containsKey("RSSI")) {
      observation.setRssi(LenientNumbers.toInt(basic.get("RSSI"), observation.getRssi()));
    }

    String id = basic.get("id") == null ? "unknown" : basic.get("id").toString();
    if (SERIAL_NUMBER_ID_TYPE.equals(idType)) {
      observation.setId(id);
    } else if (CAA_REGISTRATION_ID_TYPE.equals(idType)) {
      observation.setCaa(id);
    }
    return true;
  }

  private boolean applyOperatorId(Observation observation, Map<?, ?> operator) {
    if (operator == null) {
      return false;
    }
    observation.setOperatorIdType(text(operator.get("operator_id_type")));
    observation.setOperatorId(text(operator.get("operator_id")));
    return true;
  }

  private boolean applyLocation(Observation observation, Map<?, ?> location) {
    if (location == null) {
      return false;
    }
    observation.setLat(LenientNumbers.toDouble(location.get("latitude"), 0.0));
    observation.setLon(LenientNumbers.toDouble(location.get("longitude"), 0.0));
    observation.setSpeed(LenientNumbers.toDouble(location.get("speed"), 0.0));
    observation.setVspeed(LenientNumbers.toDouble(location.get("vert_speed"), 0.0));
    observation.setAlt(LenientNumbers.toDouble(location.get("geodetic_altitude"), 0.0));
    observation.setHeight(LenientNumbers.toDouble(location.get("height_agl"), 0.0));

    observation.setOpStatus(text(location.get("op_status")));
    observation.setHeightType(text(location.get("height_type")));
    observation.setEwDir(text(location.get("ew_dir_segment")));
    observation.setDirection(LenientNumbers.toNullableDouble(location.get("direction")));
    observation.setSpeedMultiplier(LenientNumbers.toDouble(location.get("speed_multiplier"), 0.0));
    observation.setPressureAltitude(LenientNumbers.toDouble(location.get("pressure_altitude"), 0.0));
    observation.setVerticalAccuracy(text(location.get("vertical_accuracy")));
    observation.setHorizontalAccuracy(text(location.get("horizontal_accuracy")));
    observation.setBaroAccuracy(text(location.get("baro_accuracy")));
    observation.setSpeedAccuracy(text(location.get("speed_accuracy")));
    observation.setTimestamp(text(location.get("timestamp")));
    observation.setTimestampAccuracy(text(location.get("timestamp_accuracy")));
    return true;
  }

  private boolean applySelfId(Observation observation, Map<?, ?> selfId) {
    if (selfId == null) {
      return false;
    }
    observation.setDescription(text(selfId.get("text")));
    return true;
  }

  private boolean applyFrequency(Observation observation, Map<?, ?> frequency) {
    if (frequency == null) {
      return false;
    }
    observation.setFreq(LenientNumbers.toNullableDouble(frequency.get("frequency")));
    return true;
  }

  private static Map<?, ?> section(Map<?, ?> message, String key) {
    Object value = message.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Map<?, ?> map) {
      return map;
    }
    log.debug("Ignoring '{}' part with unexpected type {}", key, value.getClass().getSimpleName());
    return null;
  }

  private static String text(Object value) {
    return value == null ? "" : value.toString();
  }
}
