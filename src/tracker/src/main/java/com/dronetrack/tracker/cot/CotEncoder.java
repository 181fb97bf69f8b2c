package com.dronetrack.tracker.cot;

import com.dronetrack.tracker.affiliation.Affiliation;
import com.dronetrack.tracker.registry.DroneSnapshot;
import com.dronetrack.tracker.status.SystemStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds Cursor-on-Target XML for a drone, its pilot and its home point, and for the status of
 * the receiving sensor.
 *
 * <p>The CoT type follows the Remote-ID aircraft class and the marker color follows the drone
 * affiliation. Times are UTC with microsecond precision. When no stale offset is supplied the
 * event stays valid for ten minutes.
 */
public class CotEncoder {
  private static final Logger LOGGER = LoggerFactory.getLogger(CotEncoder.class);

  static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);
  static final Duration DEFAULT_STALE = Duration.ofMinutes(10);

  static final String FRIENDLY_AIR = "a-f-A-f";
  static final String UNKNOWN_ROTORCRAFT = "a-u-A-M-H-R";
  static final String POINT_MARKER = "b-m-p-s-m";
  static final String GROUND_SENSOR = "a-f-G-E-S";

  static final int COLOR_AUTHORIZED = -16776961;
  static final int COLOR_UNAUTHORIZED = -65536;
  static final int COLOR_UNKNOWN = -256;
  static final int COLOR_FALLBACK = -8355712;

  static final String PILOT_ICON = "com.atakmap.android.maps.public/Civilian/Person.png";
  static final String HOME_ICON = "com.atakmap.android.maps.public/Civilian/House.png";

  private static final String VERSION = "2.0";
  private static final String HOW = "m-g";
  private static final String CE = "35.0";
  private static final String LE = "999999";
  private static final String DRONE_PREFIX = "drone-";
  private static final String SENSOR_PREFIX = "wardragon-";

  private final XmlMapper xmlMapper;
  private final Clock clock;

  public CotEncoder(XmlMapper xmlMapper, Clock clock) {
    this.xmlMapper = xmlMapper;
    this.clock = clock;
  }

  /**
   * Encodes the drone itself.
   *
   * @param drone drone state
   * @param staleOffsetSeconds seconds until the event goes stale, or {@code null} for the default
   * @return UTF-8 XML with declaration
   */
  public byte[] encodeMain(DroneSnapshot drone, Double staleOffsetSeconds) {
    double course = drone.direction() == null ? 0.0 : drone.direction();
    CotEvent.Detail detail = new CotEvent.Detail(
        new CotEvent.Contact(drone.id()),
        gps(),
        new CotEvent.Track(course, drone.speed()),
        null,
        remarks(drone),
        new CotEvent.Color(colorFor(drone.affiliation())));
    return write(event(drone.id(), typeFor(drone.uaType()), drone.lat(), drone.lon(), drone.alt(),
        detail, staleOffsetSeconds));
  }

  public byte[] encodePilot(DroneSnapshot drone, Double staleOffsetSeconds) {
    String uid = "pilot-" + baseId(drone.id());
    return write(marker(drone, uid, drone.pilotLat(), drone.pilotLon(), PILOT_ICON,
        "Pilot location for drone " + drone.id(), staleOffsetSeconds));
  }

  public byte[] encodeHome(DroneSnapshot drone, Double staleOffsetSeconds) {
    String uid = "home-" + baseId(drone.id());
    return write(marker(drone, uid, drone.homeLat(), drone.homeLon(), HOME_ICON,
        "Home location for drone " + drone.id(), staleOffsetSeconds));
  }

  /** Encodes a sensor status report; the event stays valid for the default period. */
  public byte[] encodeSystemStatus(SystemStatus status) {
    String uid = SENSOR_PREFIX + status.serialNumber();
    CotEvent.Detail detail = new CotEvent.Detail(
        new CotEvent.Contact(uid),
        gps(),
        new CotEvent.Track(status.track(), status.speed()),
        null,
        remarks(status),
        null);
    return write(event(uid, GROUND_SENSOR, status.lat(), status.lon(), status.alt(), detail, null));
  }

  static String typeFor(Integer uaType) {
    if (uaType == null) {
      return UNKNOWN_ROTORCRAFT;
    }
    switch (uaType) {
      case 1:
      case 5:
      case 6:
        return FRIENDLY_AIR;
      case 2:
      case 3:
      case 4:
        return UNKNOWN_ROTORCRAFT;
      default:
        return uaType >= 7 && uaType <= 15 ? POINT_MARKER : UNKNOWN_ROTORCRAFT;
    }
  }

  static int colorFor(String affiliation) {
    if (Affiliation.AUTHORIZED.label().equals(affiliation)) {
      return COLOR_AUTHORIZED;
    }
    if (Affiliation.UNAUTHORIZED.label().equals(affiliation)) {
      return COLOR_UNAUTHORIZED;
    }
    if (Affiliation.UNKNOWN.label().equals(affiliation)) {
      return COLOR_UNKNOWN;
    }
    return COLOR_FALLBACK;
  }

  static String baseId(String id) {
    return id.startsWith(DRONE_PREFIX) ? id.substring(DRONE_PREFIX.length()) : id;
  }

  private CotEvent marker(
      DroneSnapshot drone,
      String uid,
      double lat,
      double lon,
      String icon,
      String remarks,
      Double staleOffsetSeconds) {
    CotEvent.Detail detail = new CotEvent.Detail(
        new CotEvent.Contact(uid),
        gps(),
        null,
        new CotEvent.UserIcon(icon),
        remarks,
        new CotEvent.Color(colorFor(drone.affiliation())));
    // Marker altitude follows the drone; pilot and home altitudes are not broadcast.
    return event(uid, POINT_MARKER, lat, lon, drone.alt(), detail, staleOffsetSeconds);
  }

  private CotEvent event(
      String uid,
      String type,
      double lat,
      double lon,
      double hae,
      CotEvent.Detail detail,
      Double staleOffsetSeconds) {
    Instant now = clock.instant();
    Instant stale = staleOffsetSeconds == null
        ? now.plus(DEFAULT_STALE)
        : now.plusNanos(Math.round(staleOffsetSeconds * 1_000_000_000d));
    String timestamp = TIME_FORMAT.format(now);
    return new CotEvent(
        VERSION,
        uid,
        type,
        timestamp,
        timestamp,
        TIME_FORMAT.format(stale),
        HOW,
        new CotEvent.Point(lat, lon, hae, CE, LE),
        detail);
  }

  private static CotEvent.PrecisionLocation gps() {
    return new CotEvent.PrecisionLocation("gps", "gps");
  }

  private static String remarks(DroneSnapshot drone) {
    String uaCode = drone.uaType() == null ? "n/a" : drone.uaType().toString();
    double course = drone.direction() == null ? 0.0 : drone.direction();
    return "MAC: " + drone.mac() + ", RSSI: " + drone.rssi() + "dBm; "
        + "ID Type: " + drone.idType() + "; "
        + "UA Type: " + drone.uaTypeName() + " (" + uaCode + "); "
        + "Operator ID: [" + drone.operatorIdType() + ": " + drone.operatorId() + "]; "
        + "Speed: " + drone.speed() + " m/s; Vert Speed: " + drone.vspeed() + " m/s; "
        + "Altitude: " + drone.alt() + " m; AGL: " + drone.height() + " m; "
        + "Course: " + course + "°; "
        + "Index: " + drone.index() + "; Runtime: " + drone.runtime() + "s";
  }

  private static String remarks(SystemStatus status) {
    return String.format(Locale.ROOT,
        "CPU Usage: %.1f%%, Memory Total: %.2f MB, Memory Available: %.2f MB, "
            + "Disk Total: %.2f MB, Disk Used: %.2f MB, Temperature: %.1f°C, Uptime: %.0f seconds, "
            + "Pluto Temp: %s, Zynq Temp: %s",
        status.cpuUsage(),
        status.memoryTotalMb(),
        status.memoryAvailableMb(),
        status.diskTotalMb(),
        status.diskUsedMb(),
        status.temperature(),
        status.uptime(),
        status.plutoTemp(),
        status.zynqTemp());
  }

  private byte[] write(CotEvent event) {
    try {
      byte[] xml = xmlMapper.writeValueAsBytes(event);
      if (LOGGER.isTraceEnabled()) {
        LOGGER.trace("CoT event {}: {}", event.uid(), new String(xml, StandardCharsets.UTF_8));
      }
      return xml;
    } catch (JsonProcessingException ex) {
      throw new CotEncodingException("Failed to encode CoT event " + event.uid(), ex);
    }
  }
}
