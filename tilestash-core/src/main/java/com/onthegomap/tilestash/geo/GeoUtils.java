package com.onthegomap.tilestash.geo;

import org.locationtech.jts.geom.Envelope;

/**
 * A collection of utilities for converting between latitude/longitude and web mercator coordinates.
 */
public class GeoUtils {

  private static final double RADIANS_PER_DEGREE = Math.PI / 180;
  private static final double DEGREES_PER_RADIAN = 180 / Math.PI;

  /** Northern-most latitude that web mercator can represent, southern-most is its negation. */
  public static final double MAX_LAT = 85.0511;

  /** Bounds of the whole web mercator world in latitude/longitude coordinates. */
  public static final Envelope WORLD_LAT_LON_BOUNDS = new Envelope(-180, 180, -MAX_LAT, MAX_LAT);

  private GeoUtils() {}

  /**
   * Returns the longitude for a web mercator coordinate {@code x} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldLon(double x) {
    return x * 360 - 180;
  }

  /**
   * Returns the latitude for a web mercator {@code y} coordinate where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldLat(double y) {
    double n = Math.PI - 2 * Math.PI * y;
    return DEGREES_PER_RADIAN * Math.atan(0.5 * (Math.exp(n) - Math.exp(-n)));
  }

  /**
   * Returns the web mercator X coordinate for {@code longitude} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldX(double longitude) {
    return (longitude + 180) / 360;
  }

  /**
   * Returns the web mercator Y coordinate for {@code latitude} where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   * <p>
   * Latitudes beyond {@link #MAX_LAT} are clamped to the limit.
   */
  public static double getWorldY(double latitude) {
    double lat = clampLatitude(latitude);
    double sin = Math.sin(lat * RADIANS_PER_DEGREE);
    return 0.5 - 0.25 * Math.log((1 + sin) / (1 - sin)) / Math.PI;
  }

  public static double clampLatitude(double latitude) {
    return Math.max(-MAX_LAT, Math.min(MAX_LAT, latitude));
  }
}
