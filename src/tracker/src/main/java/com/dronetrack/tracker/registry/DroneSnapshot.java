package com.dronetrack.tracker.registry;

import com.dronetrack.tracker.util.GeoUtils;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable copy of a {@link DroneRecord}, safe to hand to encoding and delivery threads.
 *
 * <p>Serialized with snake_case field names for sink payloads.
 */
public record DroneSnapshot(
    @JsonProperty("id") String id,
    @JsonProperty("id_type") String idType,
    @JsonProperty("caa") String caa,
    @JsonProperty("lat") double lat,
    @JsonProperty("lon") double lon,
    @JsonProperty("alt") double alt,
    @JsonProperty("height") double height,
    @JsonProperty("speed") double speed,
    @JsonProperty("vspeed") double vspeed,
    @JsonProperty("direction") Double direction,
    @JsonProperty("pilot_lat") double pilotLat,
    @JsonProperty("pilot_lon") double pilotLon,
    @JsonProperty("home_lat") double homeLat,
    @JsonProperty("home_lon") double homeLon,
    @JsonProperty("mac") String mac,
    @JsonProperty("rssi") int rssi,
    @JsonProperty("freq") Double freq,
    @JsonProperty("ua_type") Integer uaType,
    @JsonProperty("ua_type_name") String uaTypeName,
    @JsonProperty("operator_id_type") String operatorIdType,
    @JsonProperty("operator_id") String operatorId,
    @JsonProperty("description") String description,
    @JsonProperty("op_status") String opStatus,
    @JsonProperty("height_type") String heightType,
    @JsonProperty("ew_dir") String ewDir,
    @JsonProperty("speed_multiplier") Double speedMultiplier,
    @JsonProperty("pressure_altitude") Double pressureAltitude,
    @JsonProperty("vertical_accuracy") String verticalAccuracy,
    @JsonProperty("horizontal_accuracy") String horizontalAccuracy,
    @JsonProperty("baro_accuracy") String baroAccuracy,
    @JsonProperty("speed_accuracy") String speedAccuracy,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("timestamp_accuracy") String timestampAccuracy,
    @JsonProperty("index") long index,
    @JsonProperty("runtime") long runtime,
    @JsonProperty("affiliation") String affiliation,
    @JsonProperty("last_update_epoch_ms") long lastUpdateEpochMs) {

  public boolean hasPilotLocation() {
    return GeoUtils.isKnownLocation(pilotLat, pilotLon);
  }

  public boolean hasHomeLocation() {
    return GeoUtils.isKnownLocation(homeLat, homeLon);
  }
}
