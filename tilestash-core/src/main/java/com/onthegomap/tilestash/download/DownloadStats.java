package com.onthegomap.tilestash.download;

/**
 * Snapshot of a layer download.
 *
 * @param downloadedTiles           tiles present so far, including skipped ones
 * @param skippedTiles              tiles that were already present when the run started
 * @param estimatedSecondsRemaining {@code -1} when the download stopped because the host went offline
 */
public record DownloadStats(
  long totalTiles,
  long downloadedTiles,
  long failedTiles,
  long retriedTiles,
  long skippedTiles,
  long elapsedSeconds,
  long estimatedSecondsRemaining
) {

  /** Returns the share of target tiles present as a whole percentage. */
  public int percent() {
    return totalTiles == 0 ? 100 : (int) Math.round(downloadedTiles * 100d / totalTiles);
  }
}
