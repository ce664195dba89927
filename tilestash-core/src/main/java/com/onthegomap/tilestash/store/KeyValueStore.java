package com.onthegomap.tilestash.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage for small JSON documents by string key, such as download checkpoints and task snapshots.
 * <p>
 * Values carry their own timestamps, the store does not expire anything.
 */
public interface KeyValueStore {

  Optional<String> get(String key) throws IOException;

  void put(String key, String json) throws IOException;

  void remove(String key) throws IOException;
}
