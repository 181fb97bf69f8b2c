package com.dronetrack.tracker.status;

import com.dronetrack.tracker.util.GeoUtils;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health and position report of the receiving sensor.
 *
 * <p>Memory and disk sizes are in MiB. SDR temperatures are passed through as reported, with
 * {@code N/A} when the front-end does not send them.
 */
public record SystemStatus(
    @JsonProperty("serial_number") String serialNumber,
    @JsonProperty("lat") double lat,
    @JsonProperty("lon") double lon,
    @JsonProperty("alt") double alt,
    @JsonProperty("speed") double speed,
    @JsonProperty("track") double track,
    @JsonProperty("cpu_usage") double cpuUsage,
    @JsonProperty("memory_total_mb") double memoryTotalMb,
    @JsonProperty("memory_available_mb") double memoryAvailableMb,
    @JsonProperty("disk_total_mb") double diskTotalMb,
    @JsonProperty("disk_used_mb") double diskUsedMb,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("uptime") double uptime,
    @JsonProperty("pluto_temp") String plutoTemp,
    @JsonProperty("zynq_temp") String zynqTemp) {

  public boolean hasLocation() {
    return GeoUtils.isKnownLocation(lat, lon);
  }
}
