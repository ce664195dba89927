package com.onthegomap.tilestash.layers;

import java.util.regex.Pattern;

/**
 * Derives tile cache keys from request URLs.
 * <p>
 * Base map hosts serve identical tiles from several subdomains, so the subdomain is rewritten to {@code a} and a tile
 * fetched through any of them maps to the same entry.
 */
public class CacheKeys {

  private static final Pattern OSM = Pattern.compile("^https://[abcd]\\.tile\\.openstreetmap\\.org");
  private static final Pattern CARTO = Pattern.compile("^https://[abcd]\\.basemaps\\.cartocdn\\.com");
  private static final Pattern OPEN_TOPO = Pattern.compile("^https://[abc]\\.tile\\.opentopomap\\.org");

  private CacheKeys() {}

  public static String forUrl(String url) {
    String result = OSM.matcher(url).replaceFirst("https://a.tile.openstreetmap.org");
    result = CARTO.matcher(result).replaceFirst("https://a.basemaps.cartocdn.com");
    return OPEN_TOPO.matcher(result).replaceFirst("https://a.tile.opentopomap.org");
  }
}
