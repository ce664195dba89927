package com.onthegomap.tilestash.geo;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Envelope;

/**
 * The coordinate of a <a href="https://wiki.openstreetmap.org/wiki/Slippy_map_tilenames">slippy map tile</a>.
 *
 * @param x column of the tile where 0 is the western-most tile just to the east the international date line and 2^z-1
 *          is the eastern-most tile
 * @param y row of the tile where 0 is the northern-most tile and 2^z-1 is the southern-most tile
 * @param z zoom level
 */
@Immutable
public record TileCoord(int x, int y, int z) {

  public static final int MAX_ZOOM = 22;

  public TileCoord {
    if (z < 0 || z > MAX_ZOOM) {
      throw new IllegalArgumentException("Invalid zoom " + z);
    }
  }

  public static TileCoord ofXYZ(int x, int y, int z) {
    return new TileCoord(x, y, z);
  }

  /**
   * Returns the tile containing a latitude/longitude coordinate at a given zoom level.
   * <p>
   * Latitudes past the web mercator limit are clamped, and the resulting indices are clamped into {@code [0, 2^z-1]}.
   */
  public static TileCoord aroundLngLat(double lng, double lat, int zoom) {
    double factor = 1 << zoom;
    double x = GeoUtils.getWorldX(lng) * factor;
    double y = GeoUtils.getWorldY(lat) * factor;
    int max = (1 << zoom) - 1;
    return TileCoord.ofXYZ(clamp((int) Math.floor(x), max), clamp((int) Math.floor(y), max), zoom);
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(max, value));
  }

  /** Returns the row of this tile in the complementary (TMS) scheme where row 0 is the southern-most. */
  public int tmsY() {
    return (1 << z) - 1 - y;
  }

  /** Returns the latitude/longitude bounds of this tile: west/east as min/max X and south/north as min/max Y. */
  public Envelope bounds() {
    double worldWidthAtZoom = Math.pow(2, z);
    return new Envelope(
      GeoUtils.getWorldLon(x / worldWidthAtZoom),
      GeoUtils.getWorldLon((x + 1) / worldWidthAtZoom),
      GeoUtils.getWorldLat(y / worldWidthAtZoom),
      GeoUtils.getWorldLat((y + 1) / worldWidthAtZoom)
    );
  }

  @Override
  public String toString() {
    return "{x=" + x + " y=" + y + " z=" + z + '}';
  }
}
