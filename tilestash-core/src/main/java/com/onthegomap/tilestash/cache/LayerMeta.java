package com.onthegomap.tilestash.cache;

/**
 * Per-layer summary stored alongside the cached tiles.
 *
 * @param lastUpdated epoch milliseconds of the last change
 */
public record LayerMeta(
  String layerId,
  long totalTiles,
  long downloadedTiles,
  long lastUpdated,
  LayerStatus status
) {}
