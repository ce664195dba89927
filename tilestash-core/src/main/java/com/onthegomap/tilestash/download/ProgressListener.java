package com.onthegomap.tilestash.download;

/** Receives progress updates from a layer download. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NOOP = (percent, stats) -> {
  };

  void onProgress(int percent, DownloadStats stats);
}
