package com.dronetrack.tracker.telemetry;

import com.dronetrack.tracker.affiliation.Affiliation;

/**
 * Canonical partial view of one Remote-ID message.
 *
 * <p>Kinematic and radio fields carry the wire defaults ({@code 0.0}, {@code ""}) when the message
 * did not include them. Optional metadata uses {@code null} (or an empty string) for "not sent" so
 * that the registry can keep previously known values.
 */
public class Observation {
  private String id;
  private String idType = "";
  private String caa;

  private double lat;
  private double lon;
  private double alt;
  private double height;
  private double speed;
  private double vspeed;
  private Double direction;

  private double pilotLat;
  private double pilotLon;
  private double homeLat;
  private double homeLon;

  private String mac = "";
  private int rssi;
  private Double freq;

  private Integer uaType;
  private String uaTypeName = "";
  private String operatorIdType = "";
  private String operatorId = "";
  private String description = "";

  private String opStatus = "";
  private String heightType = "";
  private String ewDir = "";
  private Double speedMultiplier;
  private Double pressureAltitude;
  private String verticalAccuracy = "";
  private String horizontalAccuracy = "";
  private String baroAccuracy = "";
  private String speedAccuracy = "";
  private String timestamp = "";
  private String timestampAccuracy = "";

  private long index;
  private long runtime;
  private Affiliation affiliation;

  public boolean hasId() {
    return id != null && !id.isBlank();
  }

  public boolean hasMac() {
    return mac != null && !mac.isBlank();
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getIdType() {
    return idType;
  }

  public void setIdType(String idType) {
    this.idType = idType;
  }

  public String getCaa() {
    return caa;
  }

  public void setCaa(String caa) {
    this.caa = caa;
  }

  public double getLat() {
    return lat;
  }

  public void setLat(double lat) {
    this.lat = lat;
  }

  public double getLon() {
    return lon;
  }

  public void setLon(double lon) {
    this.lon = lon;
  }

  public double getAlt() {
    return alt;
  }

  public void setAlt(double alt) {
    this.alt = alt;
  }

  public double getHeight() {
    return height;
  }

  public void setHeight(double height) {
    this.height = height;
  }

  public double getSpeed() {
    return speed;
  }

  public void setSpeed(double speed) {
    this.speed = speed;
  }

  public double getVspeed() {
    return vspeed;
  }

  public void setVspeed(double vspeed) {
    this.vspeed = vspeed;
  }

  public Double getDirection() {
    return direction;
  }

  public void setDirection(Double direction) {
    this.direction = direction;
  }

  public double getPilotLat() {
    return pilotLat;
  }

  public void setPilotLat(double pilotLat) {
    this.pilotLat = pilotLat;
  }

  public double getPilotLon() {
    return pilotLon;
  }

  public void setPilotLon(double pilotLon) {
    this.pilotLon = pilotLon;
  }

  public double getHomeLat() {
    return homeLat;
  }

  public void setHomeLat(double homeLat) {
    this.homeLat = homeLat;
  }

  public double getHomeLon() {
    return homeLon;
  }

  public void setHomeLon(double homeLon) {
    this.homeLon = homeLon;
  }

  public String getMac() {
    return mac;
  }

  public void setMac(String mac) {
    this.mac = mac;
  }

  public int getRssi() {
    return rssi;
  }

  public void setRssi(int rssi) {
    this.rssi = rssi;
  }

  public Double getFreq() {
    return freq;
  }

  public void setFreq(Double freq) {
    this.freq = freq;
  }

  public Integer getUaType() {
    return uaType;
  }

  public void setUaType(Integer uaType) {
    this.uaType = uaType;
  }

  public String getUaTypeName() {
    return uaTypeName;
  }

  public void setUaTypeName(String uaTypeName) {
    this.uaTypeName = uaTypeName;
  }

  public String getOperatorIdType() {
    return operatorIdType;
  }

  public void setOperatorIdType(String operatorIdType) {
    this.operatorIdType = operatorIdType;
  }

  public String getOperatorId() {
    return operatorId;
  }

  public void setOperatorId(String operatorId) {
    this.operatorId = operatorId;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getOpStatus() {
    return opStatus;
  }

  public void setOpStatus(String opStatus) {
    this.opStatus = opStatus;
  }

  public String getHeightType() {
    return heightType;
  }

  public void setHeightType(String heightType) {
    this.heightType = heightType;
  }

  public String getEwDir() {
    return ewDir;
  }

  public void setEwDir(String ewDir) {
    this.ewDir = ewDir;
  }

  public Double getSpeedMultiplier() {
    return speedMultiplier;
  }

  public void setSpeedMultiplier(Double speedMultiplier) {
    this.speedMultiplier = speedMultiplier;
  }

  public Double getPressureAltitude() {
    return pressureAltitude;
  }

  public void setPressureAltitude(Double pressureAltitude) {
    this.pressureAltitude = pressureAltitude;
  }

  public String getVerticalAccuracy() {
    return verticalAccuracy;
  }

  public void setVerticalAccuracy(String verticalAccuracy) {
    this.verticalAccuracy = verticalAccuracy;
  }

  public String getHorizontalAccuracy() {
    return horizontalAccuracy;
  }

  public void setHorizontalAccuracy(String horizontalAccuracy) {
    this.horizontalAccuracy = horizontalAccuracy;
  }

  public String getBaroAccuracy() {
    return baroAccuracy;
  }

  public void setBaroAccuracy(String baroAccuracy) {
    this.baroAccuracy = baroAccuracy;
  }

  public String getSpeedAccuracy() {
    return speedAccuracy;
  }

  public void setSpeedAccuracy(String speedAccuracy) {
    this.speedAccuracy = speedAccuracy;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }

  public String getTimestampAccuracy() {
    return timestampAccuracy;
  }

  public void setTimestampAccuracy(String timestampAccuracy) {
    this.timestampAccuracy = timestampAccuracy;
  }

  public long getIndex() {
    return index;
  }

  public void setIndex(long index) {
    this.index = index;
  }

  public long getRuntime() {
    return runtime;
  }

  public void setRuntime(long runtime) {
    this.runtime = runtime;
  }

  public Affiliation getAffiliation() {
    return affiliation;
  }

  public void setAffiliation(Affiliation affiliation) {
    this.affiliation = affiliation;
  }
}
