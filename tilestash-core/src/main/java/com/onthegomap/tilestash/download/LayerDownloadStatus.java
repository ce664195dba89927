package com.onthegomap.tilestash.download;

/**
 * What is known about a layer offline: whether it finished, how many tiles are cached, and the progress of an
 * interrupted download.
 */
public record LayerDownloadStatus(
  boolean isDownloaded,
  long tileCount,
  boolean hasCheckpoint,
  int checkpointProgress
) {}
