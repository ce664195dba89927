package com.onthegomap.tilestash.layers;

import com.onthegomap.tilestash.geo.TileCoord;

/**
 * One tile to fetch: where it lives on the remote server and the key it is stored under in the tile cache.
 */
public record TileRequest(String layerId, TileCoord coord, String remoteUrl, String cacheKey) {

  public static TileRequest of(String layerId, TileCoord coord, String remoteUrl) {
    return new TileRequest(layerId, coord, remoteUrl, CacheKeys.forUrl(remoteUrl));
  }

  public int zoom() {
    return coord.z();
  }

  public int column() {
    return coord.x();
  }

  public int row() {
    return coord.y();
  }
}
