package com.onthegomap.tilestash.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.locationtech.jts.geom.Envelope;

/**
 * The rectangle of tiles enclosing a latitude/longitude bounding box at one zoom level.
 * <p>
 * The rectangle is derived from the tiles containing the north-west and south-east corners, so it covers every tile
 * that touches the box and may include tiles outside of any non-rectangular area of interest.
 */
public record TileGrid(int z, int minX, int minY, int maxX, int maxY) {

  public static TileGrid forZoom(Envelope latLonBounds, int zoom) {
    TileCoord northWest = TileCoord.aroundLngLat(latLonBounds.getMinX(), latLonBounds.getMaxY(), zoom);
    TileCoord southEast = TileCoord.aroundLngLat(latLonBounds.getMaxX(), latLonBounds.getMinY(), zoom);
    return new TileGrid(zoom,
      Math.min(northWest.x(), southEast.x()),
      Math.min(northWest.y(), southEast.y()),
      Math.max(northWest.x(), southEast.x()),
      Math.max(northWest.y(), southEast.y())
    );
  }

  /** Returns the number of tiles in the rectangle. */
  public long count() {
    return (long) (maxX - minX + 1) * (maxY - minY + 1);
  }

  /** Returns every tile in the rectangle, column by column, with rows ascending within a column. */
  public List<TileCoord> tiles() {
    List<TileCoord> result = new ArrayList<>(Math.toIntExact(count()));
    for (int x = minX; x <= maxX; x++) {
      for (int y = minY; y <= maxY; y++) {
        result.add(TileCoord.ofXYZ(x, y, z));
      }
    }
    return result;
  }

  public boolean contains(TileCoord coord) {
    return coord.z() == z && coord.x() >= minX && coord.x() <= maxX && coord.y() >= minY && coord.y() <= maxY;
  }

  /** Returns {@code west,south,east,north} of a tile, the order WMS 1.1.1 expects in its {@code bbox} parameter. */
  public static String bboxParam(TileCoord coord) {
    Envelope env = coord.bounds();
    return String.format(Locale.ROOT, "%s,%s,%s,%s",
      env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY());
  }
}
