package com.onthegomap.tilestash.download;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.onthegomap.tilestash.store.KeyValueStore;
import com.onthegomap.tilestash.util.JsonUtils;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link DownloadCheckpoint} documents in a {@link KeyValueStore}.
 * <p>
 * Storage failures are logged and reported as a missing checkpoint or a failed save, never thrown.
 */
public class CheckpointStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointStore.class);
  static final String KEY_PREFIX = "download_checkpoint_";

  private final KeyValueStore store;
  private final Duration maxAge;
  private final Clock clock;

  public CheckpointStore(KeyValueStore store, Duration maxAge, Clock clock) {
    this.store = store;
    this.maxAge = maxAge;
    this.clock = clock;
  }

  /** Returns the checkpoint of {@code layerId}, or empty if there is none, it is unreadable, or it is stale. */
  public Optional<DownloadCheckpoint> load(String layerId) {
    try {
      Optional<String> json = store.get(KEY_PREFIX + layerId);
      if (json.isEmpty()) {
        return Optional.empty();
      }
      DownloadCheckpoint checkpoint = JsonUtils.mapper().readValue(json.get(), DownloadCheckpoint.class);
      if (checkpoint.isStale(clock.millis(), maxAge)) {
        LOGGER.info("Ignoring checkpoint of {} from {}", layerId, Instant.ofEpochMilli(checkpoint.lastUpdated()));
        return Optional.empty();
      }
      return Optional.of(checkpoint);
    } catch (IOException e) {
      LOGGER.warn("Failed to load checkpoint of {}: {}", layerId, e.toString());
      return Optional.empty();
    }
  }

  /** Persists {@code checkpoint} and returns false if that failed. */
  public boolean save(DownloadCheckpoint checkpoint) {
    try {
      store.put(KEY_PREFIX + checkpoint.layerId(), JsonUtils.mapper().writeValueAsString(checkpoint));
      return true;
    } catch (JsonProcessingException e) {
      LOGGER.warn("Failed to serialize checkpoint of {}: {}", checkpoint.layerId(), e.toString());
      return false;
    } catch (IOException e) {
      LOGGER.warn("Failed to save checkpoint of {}: {}", checkpoint.layerId(), e.toString());
      return false;
    }
  }

  public void delete(String layerId) {
    try {
      store.remove(KEY_PREFIX + layerId);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete checkpoint of {}: {}", layerId, e.toString());
    }
  }

  public Clock clock() {
    return clock;
  }
}
