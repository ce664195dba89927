package com.onthegomap.tilestash.cache;

/**
 * Size of everything in a {@link TileCache}.
 *
 * @param totalBytes sum of the stored tile payloads, not including storage overhead
 */
public record CacheStats(long tileCount, long totalBytes) {}
