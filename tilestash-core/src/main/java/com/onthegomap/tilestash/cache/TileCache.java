package com.onthegomap.tilestash.cache;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Storage for individually downloaded tiles, keyed by cache key and grouped by layer.
 * <p>
 * Writes are idempotent: putting the same key again replaces the bytes and leaves a single entry.
 */
public interface TileCache extends AutoCloseable {

  void put(String key, byte[] data, String layerId) throws IOException;

  /** Returns the bytes stored under {@code key} or {@code null} if absent. */
  byte[] get(String key) throws IOException;

  long count(String layerId) throws IOException;

  void setLayerMeta(LayerMeta meta) throws IOException;

  Optional<LayerMeta> getLayerMeta(String layerId) throws IOException;

  /** Removes every tile and the metadata of a layer. */
  void clearLayer(String layerId) throws IOException;

  /** Returns ids of layers with metadata in the cache. */
  List<String> cachedLayerIds() throws IOException;

  /** Returns the number of tiles and payload bytes across every layer. */
  CacheStats stats() throws IOException;

  /** Removes every tile and all layer metadata. */
  void clearAll() throws IOException;

  /** Returns true if the layer finished downloading. */
  default boolean isCached(String layerId) throws IOException {
    return getLayerMeta(layerId).map(meta -> meta.status() == LayerStatus.COMPLETE).orElse(false);
  }

  @Override
  default void close() throws IOException {}
}
