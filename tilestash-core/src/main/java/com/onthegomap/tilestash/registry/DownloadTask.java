package com.onthegomap.tilestash.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.onthegomap.tilestash.download.DownloadStats;
import com.onthegomap.tilestash.layers.LayerKind;

/**
 * Immutable snapshot of one bulk download as seen by subscribers.
 *
 * @param progress    percentage in {@code [0, 100]}
 * @param error       localized message when {@link #status()} is {@link TaskStatus#ERROR}, otherwise null
 * @param startedAt   epoch milliseconds, null for tasks that never started
 * @param completedAt epoch milliseconds, null until complete
 */
public record DownloadTask(
  String id,
  @JsonProperty("type") LayerKind kind,
  TaskStatus status,
  int progress,
  String error,
  Long startedAt,
  Long completedAt,
  DownloadStats stats
) {

  public DownloadTask {
    if (progress < 0 || progress > 100) {
      throw new IllegalArgumentException("progress must be in [0, 100], was " + progress);
    }
  }

  static DownloadTask started(String id, LayerKind kind, long now) {
    return new DownloadTask(id, kind, TaskStatus.DOWNLOADING, 0, null, now, null, null);
  }

  static DownloadTask failedToStart(String id, LayerKind kind, String error) {
    return new DownloadTask(id, kind, TaskStatus.ERROR, 0, error, null, null, null);
  }

  /** Returns a copy with updated progress that never moves backwards while downloading. */
  DownloadTask withProgress(int newProgress, DownloadStats newStats) {
    int clamped = Math.max(0, Math.min(100, newProgress));
    int next = status == TaskStatus.DOWNLOADING ? Math.max(progress, clamped) : clamped;
    return new DownloadTask(id, kind, status, next, error, startedAt, completedAt, newStats == null ? stats : newStats);
  }

  DownloadTask completed(long now) {
    return new DownloadTask(id, kind, TaskStatus.COMPLETE, 100, null, startedAt, now, stats);
  }

  DownloadTask failed(String message) {
    return new DownloadTask(id, kind, TaskStatus.ERROR, progress, message, startedAt, completedAt, stats);
  }
}
