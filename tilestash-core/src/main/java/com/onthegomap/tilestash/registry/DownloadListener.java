package com.onthegomap.tilestash.registry;

import java.util.Map;

/** Receives a snapshot of every task, by id, whenever any of them changes. */
@FunctionalInterface
public interface DownloadListener {

  void onTasksChanged(Map<String, DownloadTask> tasks);
}
