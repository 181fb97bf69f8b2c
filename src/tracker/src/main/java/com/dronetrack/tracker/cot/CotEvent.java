package com.dronetrack.tracker.cot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/** Jackson XML model of a Cursor-on-Target {@code <event>}. */
@JacksonXmlRootElement(localName = "event")
@JsonPropertyOrder({"version", "uid", "type", "time", "start", "stale", "how", "point", "detail"})
public record CotEvent(
    @JacksonXmlProperty(isAttribute = true) String version,
    @JacksonXmlProperty(isAttribute = true) String uid,
    @JacksonXmlProperty(isAttribute = true) String type,
    @JacksonXmlProperty(isAttribute = true) String time,
    @JacksonXmlProperty(isAttribute = true) String start,
    @JacksonXmlProperty(isAttribute = true) String stale,
    @JacksonXmlProperty(isAttribute = true) String how,
    Point point,
    Detail detail
) {

  @JsonPropertyOrder({"lat", "lon", "hae", "ce", "le"})
  public record Point(
      @JacksonXmlProperty(isAttribute = true) double lat,
      @JacksonXmlProperty(isAttribute = true) double lon,
      @JacksonXmlProperty(isAttribute = true) double hae,
      @JacksonXmlProperty(isAttribute = true) String ce,
      @JacksonXmlProperty(isAttribute = true) String le
  ) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"contact", "precisionlocation", "track", "usericon", "remarks", "color"})
  public record Detail(
      Contact contact,
      PrecisionLocation precisionlocation,
      Track track,
      UserIcon usericon,
      String remarks,
      Color color
  ) {}

  public record Contact(@JacksonXmlProperty(isAttribute = true) String callsign) {}

  @JsonPropertyOrder({"geopointsrc", "altsrc"})
  public record PrecisionLocation(
      @JacksonXmlProperty(isAttribute = true) String geopointsrc,
      @JacksonXmlProperty(isAttribute = true) String altsrc
  ) {}

  @JsonPropertyOrder({"course", "speed"})
  public record Track(
      @JacksonXmlProperty(isAttribute = true) double course,
      @JacksonXmlProperty(isAttribute = true) double speed
  ) {}

  public record UserIcon(@JacksonXmlProperty(isAttribute = true) String iconsetpath) {}

  public record Color(@JacksonXmlProperty(isAttribute = true) int argb) {}
}
