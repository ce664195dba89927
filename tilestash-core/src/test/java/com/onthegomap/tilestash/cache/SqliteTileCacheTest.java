package com.onthegomap.tilestash.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteTileCacheTest {

  private static final byte[] A = {1, 2, 3};
  private static final byte[] B = {4, 5, 6, 7};

  @Test
  void testPutIsIdempotent() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      cache.put("key", A, "LOW");
      cache.put("key", A, "LOW");
      assertArrayEquals(A, cache.get("key"));
      assertEquals(1, cache.count("LOW"));
    }
  }

  @Test
  void testGetReturnsLatestWrite() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      cache.put("key", A, "LOW");
      cache.put("key", B, "LOW");
      assertArrayEquals(B, cache.get("key"));
      assertEquals(1, cache.count("LOW"));
    }
  }

  @Test
  void testMissingKey() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      assertNull(cache.get("missing"));
      assertEquals(0, cache.count("LOW"));
      assertEquals(Optional.empty(), cache.getLayerMeta("LOW"));
      assertFalse(cache.isCached("LOW"));
    }
  }

  @Test
  void testCountPerLayer() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      cache.put("1", A, "LOW");
      cache.put("2", A, "LOW");
      cache.put("3", A, "HIGH");
      assertEquals(2, cache.count("LOW"));
      assertEquals(1, cache.count("HIGH"));
    }
  }

  @Test
  void testLayerMeta() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      cache.setLayerMeta(new LayerMeta("LOW", 100, 10, 1000, LayerStatus.DOWNLOADING));
      assertFalse(cache.isCached("LOW"));
      cache.setLayerMeta(new LayerMeta("LOW", 100, 95, 2000, LayerStatus.COMPLETE));
      assertEquals(Optional.of(new LayerMeta("LOW", 100, 95, 2000, LayerStatus.COMPLETE)), cache.getLayerMeta("LOW"));
      assertTrue(cache.isCached("LOW"));
      cache.setLayerMeta(new LayerMeta("HIGH", 10, 0, 3000, LayerStatus.ERROR));
      assertEquals(List.of("HIGH", "LOW"), cache.cachedLayerIds());
    }
  }

  @Test
  void testClearLayer() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      cache.put("1", A, "LOW");
      cache.put("2", A, "HIGH");
      cache.setLayerMeta(new LayerMeta("LOW", 1, 1, 1, LayerStatus.COMPLETE));
      cache.clearLayer("LOW");
      assertNull(cache.get("1"));
      assertArrayEquals(A, cache.get("2"));
      assertEquals(Optional.empty(), cache.getLayerMeta("LOW"));
    }
  }

  @Test
  void testPersistsAcrossReopen(@TempDir Path tempDir) throws IOException {
    Path file = tempDir.resolve("nested").resolve("tiles.db");
    try (var cache = SqliteTileCache.open(file)) {
      cache.put("key", B, "BASEMAP_OSM");
      cache.setLayerMeta(new LayerMeta("BASEMAP_OSM", 1, 1, 1, LayerStatus.COMPLETE));
    }
    assertTrue(Files.exists(file));
    try (var cache = SqliteTileCache.open(file)) {
      assertArrayEquals(B, cache.get("key"));
      assertTrue(cache.isCached("BASEMAP_OSM"));
    }
  }

  @Test
  void testStatsAndClearAll() throws IOException {
    try (var cache = SqliteTileCache.newInMemoryDatabase()) {
      assertEquals(new CacheStats(0, 0), cache.stats());
      cache.put("1", A, "LOW");
      cache.put("2", B, "HIGH");
      cache.put("2", B, "HIGH");
      cache.setLayerMeta(new LayerMeta("LOW", 1, 1, 1, LayerStatus.COMPLETE));
      assertEquals(new CacheStats(2, A.length + B.length), cache.stats());

      cache.clearAll();
      assertEquals(new CacheStats(0, 0), cache.stats());
      assertNull(cache.get("1"));
      assertEquals(List.of(), cache.cachedLayerIds());
      assertFalse(cache.isCached("LOW"));
    }
  }
}
