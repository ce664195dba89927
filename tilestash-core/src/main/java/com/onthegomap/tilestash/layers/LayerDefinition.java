package com.onthegomap.tilestash.layers;

import com.onthegomap.tilestash.geo.TileCoord;
import com.onthegomap.tilestash.geo.TileGrid;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Envelope;

/**
 * A named set of tiles to make available offline: a remote source, the zoom levels to download and the region to
 * cover.
 */
public interface LayerDefinition {

  /** Catalogue id, also used as the layer id in the tile cache and for checkpoints. */
  String id();

  LayerKind kind();

  List<Integer> zoomLevels();

  Envelope region();

  /** Returns the fully-built remote URL of one tile. */
  String tileUrl(TileCoord coord);

  default TileRequest request(TileCoord coord) {
    return TileRequest.of(id(), coord, tileUrl(coord));
  }

  /**
   * Returns every tile to download for this layer, zoom by zoom, keyed and de-duplicated by cache key.
   */
  default List<TileRequest> targetTiles() {
    Map<String, TileRequest> result = new LinkedHashMap<>();
    for (int zoom : zoomLevels()) {
      for (TileCoord coord : TileGrid.forZoom(region(), zoom).tiles()) {
        TileRequest request = request(coord);
        result.putIfAbsent(request.cacheKey(), request);
      }
    }
    return new ArrayList<>(result.values());
  }

  /** Returns the number of tiles {@link #targetTiles()} enumerates without building their URLs. */
  default long targetTileCount() {
    long count = 0;
    for (int zoom : zoomLevels()) {
      count += TileGrid.forZoom(region(), zoom).count();
    }
    return count;
  }
}
