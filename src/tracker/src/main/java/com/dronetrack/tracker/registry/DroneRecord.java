package com.dronetrack.tracker.registry;

import com.dronetrack.tracker.affiliation.Affiliation;
import com.dronetrack.tracker.telemetry.Observation;
import com.dronetrack.tracker.util.GeoUtils;
import java.time.Instant;

/**
 * Live state of one tracked drone.
 *
 * <p>Owned and mutated by {@link DroneRegistry} on the control thread only. Other threads receive
 * {@link DroneSnapshot} copies.
 */
public class DroneRecord {
  private final String id;
  private String idType;
  private String caa;

  private double lat;
  private double lon;
  private Double prevLat;
  private Double prevLon;
  private double alt;
  private double height;
  private double speed;
  private double vspeed;
  private Double direction;

  private double pilotLat;
  private double pilotLon;
  private double homeLat;
  private double homeLon;

  private String mac;
  private int rssi;
  private Double freq;

  private Integer uaType;
  private String uaTypeName;
  private String operatorIdType;
  private String operatorId;
  private String description;
  private String opStatus;
  private String heightType;
  private String ewDir;
  private Double speedMultiplier;
  private Double pressureAltitude;
  private String verticalAccuracy;
  private String horizontalAccuracy;
  private String baroAccuracy;
  private String speedAccuracy;
  private String timestamp;
  private String timestampAccuracy;
  private long index;
  private long runtime;
  private Affiliation affiliation;

  private Instant lastUpdateTime;
  private Instant lastSentTime = Instant.EPOCH;
  private double lastSentLat;
  private double lastSentLon;

  DroneRecord(String id, Observation first, Instant now) {
    this.id = id;
    this.idType = first.getIdType();
    this.caa = first.getCaa();
    this.lat = first.getLat();
    this.lon = first.getLon();
    this.alt = first.getAlt();
    this.height = first.getHeight();
    this.speed = first.getSpeed();
    this.vspeed = first.getVspeed();
    this.direction = first.getDirection();
    this.pilotLat = first.getPilotLat();
    this.pilotLon = first.getPilotLon();
    this.homeLat = first.getHomeLat();
    this.homeLon = first.getHomeLon();
    this.mac = first.getMac();
    this.rssi = first.getRssi();
    this.freq = first.getFreq();
    this.uaType = first.getUaType();
    this.uaTypeName = first.getUaTypeName();
    this.operatorIdType = first.getOperatorIdType();
    this.operatorId = first.getOperatorId();
    this.description = first.getDescription();
    this.opStatus = first.getOpStatus();
    this.heightType = first.getHeightType();
    this.ewDir = first.getEwDir();
    this.speedMultiplier = first.getSpeedMultiplier();
    this.pressureAltitude = first.getPressureAltitude();
    this.verticalAccuracy = first.getVerticalAccuracy();
    this.horizontalAccuracy = first.getHorizontalAccuracy();
    this.baroAccuracy = first.getBaroAccuracy();
    this.speedAccuracy = first.getSpeedAccuracy();
    this.timestamp = first.getTimestamp();
    this.timestampAccuracy = first.getTimestampAccuracy();
    this.index = first.getIndex();
    this.runtime = first.getRuntime();
    this.affiliation = first.getAffiliation() == null ? Affiliation.UNKNOWN : first.getAffiliation();
    this.lastUpdateTime = now;
    this.lastSentLat = lat;
    this.lastSentLon = lon;
  }

  /**
   * Applies a subsequent observation.
   *
   * <p>Kinematic and radio fields are always overwritten. Optional metadata is only replaced by
   * non-empty values. When the observation carries no course, the bearing from the previous to
   * the new position is derived.
   */
  void merge(Observation update, Instant now) {
    prevLat = lat;
    prevLon = lon;

    lat = update.getLat();
    lon = update.getLon();
    speed = update.getSpeed();
    vspeed = update.getVspeed();
    alt = update.getAlt();
    height = update.getHeight();
    pilotLat = update.getPilotLat();
    pilotLon = update.getPilotLon();
    homeLat = update.getHomeLat();
    homeLon = update.getHomeLon();
    description = update.getDescription();
    mac = update.getMac();
    rssi = update.getRssi();
    index = update.getIndex();
    runtime = update.getRuntime();
    idType = update.getIdType();

    if (update.getUaType() != null) {
      uaType = update.getUaType();
      uaTypeName = update.getUaTypeName();
    } else if (uaType == null) {
      uaTypeName = keep(uaTypeName, update.getUaTypeName());
    }
    operatorIdType = keep(operatorIdType, update.getOperatorIdType());
    operatorId = keep(operatorId, update.getOperatorId());
    opStatus = keep(opStatus, update.getOpStatus());
    heightType = keep(heightType, update.getHeightType());
    ewDir = keep(ewDir, update.getEwDir());
    if (update.getSpeedMultiplier() != null) {
      speedMultiplier = update.getSpeedMultiplier();
    }
    if (update.getPressureAltitude() != null) {
      pressureAltitude = update.getPressureAltitude();
    }
    verticalAccuracy = keep(verticalAccuracy, update.getVerticalAccuracy());
    horizontalAccuracy = keep(horizontalAccuracy, update.getHorizontalAccuracy());
    baroAccuracy = keep(baroAccuracy, update.getBaroAccuracy());
    speedAccuracy = keep(speedAccuracy, update.getSpeedAccuracy());
    timestamp = keep(timestamp, update.getTimestamp());
    timestampAccuracy = keep(timestampAccuracy, update.getTimestampAccuracy());
    caa = keep(caa, update.getCaa());
    if (update.getFreq() != null) {
      freq = update.getFreq();
    }
    if (update.getAffiliation() != null) {
      affiliation = update.getAffiliation();
    }

    if (update.getDirection() != null) {
      direction = update.getDirection();
    } else {
      direction = GeoUtils.initialBearing(prevLat, prevLon, lat, lon);
    }

    lastUpdateTime = now;
  }

  /** Records an attempted delivery; failures count as sent. */
  public void markSent(Instant now) {
    lastSentTime = now;
    lastSentLat = lat;
    lastSentLon = lon;
  }

  public DroneSnapshot snapshot() {
    return new DroneSnapshot(
        id,
        idType,
        caa,
        lat,
        lon,
        alt,
        height,
        speed,
        vspeed,
        direction,
        pilotLat,
        pilotLon,
        homeLat,
        homeLon,
        mac,
        rssi,
        freq,
        uaType,
        uaTypeName,
        operatorIdType,
        operatorId,
        description,
        opStatus,
        heightType,
        ewDir,
        speedMultiplier,
        pressureAltitude,
        verticalAccuracy,
        horizontalAccuracy,
        baroAccuracy,
        speedAccuracy,
        timestamp,
        timestampAccuracy,
        index,
        runtime,
        affiliation.label(),
        lastUpdateTime.toEpochMilli());
  }

  private static String keep(String current, String incoming) {
    return incoming == null || incoming.isEmpty() ? current : incoming;
  }

  public String getId() {
    return id;
  }

  public String getCaa() {
    return caa;
  }

  public double getLat() {
    return lat;
  }

  public double getLon() {
    return lon;
  }

  public Double getPrevLat() {
    return prevLat;
  }

  public Double getPrevLon() {
    return prevLon;
  }

  public Double getDirection() {
    return direction;
  }

  public String getMac() {
    return mac;
  }

  public String getUaTypeName() {
    return uaTypeName;
  }

  public String getOperatorId() {
    return operatorId;
  }

  public String getHorizontalAccuracy() {
    return horizontalAccuracy;
  }

  public Affiliation getAffiliation() {
    return affiliation;
  }

  public Instant getLastUpdateTime() {
    return lastUpdateTime;
  }

  public Instant getLastSentTime() {
    return lastSentTime;
  }

  public double getLastSentLat() {
    return lastSentLat;
  }

  public double getLastSentLon() {
    return lastSentLon;
  }
}
