package com.onthegomap.tilestash.cache;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** A {@link TileCache} on the heap, for tests and short-lived processes. */
public class InMemoryTileCache implements TileCache {

  private record Entry(byte[] data, String layerId) {}

  private final Map<String, Entry> tiles = new ConcurrentHashMap<>();
  private final Map<String, LayerMeta> meta = new ConcurrentHashMap<>();

  @Override
  public void put(String key, byte[] data, String layerId) {
    tiles.put(key, new Entry(data, layerId));
  }

  @Override
  public byte[] get(String key) {
    Entry entry = tiles.get(key);
    return entry == null ? null : entry.data;
  }

  @Override
  public long count(String layerId) {
    return tiles.values().stream().filter(e -> e.layerId.equals(layerId)).count();
  }

  @Override
  public void setLayerMeta(LayerMeta layerMeta) {
    meta.put(layerMeta.layerId(), layerMeta);
  }

  @Override
  public Optional<LayerMeta> getLayerMeta(String layerId) {
    return Optional.ofNullable(meta.get(layerId));
  }

  @Override
  public void clearLayer(String layerId) {
    tiles.values().removeIf(e -> e.layerId.equals(layerId));
    meta.remove(layerId);
  }

  @Override
  public List<String> cachedLayerIds() {
    return meta.keySet().stream().sorted().toList();
  }

  @Override
  public CacheStats stats() {
    return new CacheStats(tiles.size(), tiles.values().stream().mapToLong(e -> e.data.length).sum());
  }

  @Override
  public void clearAll() {
    tiles.clear();
    meta.clear();
  }

  public int size() {
    return tiles.size();
  }
}
