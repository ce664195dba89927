package com.onthegomap.tilestash.download;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Durable record of the tiles of a layer that were already stored, so an interrupted download can resume.
 *
 * @param completedTileKeys cache keys of stored tiles
 * @param lastUpdated       epoch milliseconds of the save
 */
public record DownloadCheckpoint(
  String layerId,
  Set<String> completedTileKeys,
  long totalTiles,
  long lastUpdated,
  List<Integer> zoomLevels
) {

  public DownloadCheckpoint {
    completedTileKeys = completedTileKeys == null ? Set.of() : Set.copyOf(completedTileKeys);
    zoomLevels = zoomLevels == null ? List.of() : List.copyOf(zoomLevels);
  }

  public boolean isStale(long nowMillis, Duration maxAge) {
    return nowMillis - lastUpdated >= maxAge.toMillis();
  }

  /** Returns the completed share of the layer as a whole percentage. */
  public int progress() {
    return totalTiles <= 0 ? 0 : (int) Math.round(completedTileKeys.size() * 100d / totalTiles);
  }
}
