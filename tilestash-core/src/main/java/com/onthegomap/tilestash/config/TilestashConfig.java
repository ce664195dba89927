package com.onthegomap.tilestash.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.locationtech.jts.geom.Envelope;

/**
 * Holder for common parameters used by the download, cache and package components.
 */
public record TilestashConfig(
  Arguments arguments,
  Envelope region,
  Path dataDir,
  Path tileCacheFile,
  Path stateDir,
  Path packagesDir,
  String httpUserAgent,
  Duration directTimeout,
  Duration relayTimeout,
  Duration raceTimeout,
  List<String> relays,
  int minTileBytes,
  int basemapRetries,
  Duration basemapRetryWait,
  Duration basemapTimeout,
  boolean constrainedDevice,
  int concurrency,
  int constrainedConcurrency,
  int cacheLookupBatch,
  Duration progressInterval,
  Duration checkpointInterval,
  Duration checkpointMaxAge,
  Duration retryDelay,
  double retryMaxFailedRatio,
  double successRatio,
  Duration errorDisplay,
  Locale locale
) {

  /** Latitude/longitude bounds of Brazil, the region every default layer is downloaded for. */
  public static final Envelope BRAZIL_BOUNDS = new Envelope(-74, -34, -34, 6);

  public static final List<String> DEFAULT_RELAYS = List.of(
    "https://api.allorigins.win/raw?url=",
    "https://corsproxy.io/?",
    "https://api.codetabs.com/v1/proxy?quest="
  );

  public TilestashConfig {
    if (concurrency < 1 || constrainedConcurrency < 1) {
      throw new IllegalArgumentException(
        "Concurrency must be >= 1, was " + concurrency + " and " + constrainedConcurrency);
    }
    if (cacheLookupBatch < 1) {
      throw new IllegalArgumentException("Cache lookup batch must be >= 1, was " + cacheLookupBatch);
    }
    if (minTileBytes < 0) {
      throw new IllegalArgumentException("Minimum tile size must be >= 0, was " + minTileBytes);
    }
    if (basemapRetries < 0) {
      throw new IllegalArgumentException("Base map retries must be >= 0, was " + basemapRetries);
    }
    if (successRatio <= 0 || successRatio > 1) {
      throw new IllegalArgumentException("Success ratio must be in (0, 1], was " + successRatio);
    }
    if (retryMaxFailedRatio < 0 || retryMaxFailedRatio > 1) {
      throw new IllegalArgumentException("Retry failure ratio must be in [0, 1], was " + retryMaxFailedRatio);
    }
    if (region.isNull()) {
      throw new IllegalArgumentException("Region must not be empty");
    }
    relays = List.copyOf(relays);
  }

  public static TilestashConfig defaults() {
    return from(Arguments.of());
  }

  public static TilestashConfig from(Arguments arguments) {
    Path dataDir = arguments.file("data_dir", "directory holding the tile cache, state and packages", Path.of("data"));
    return new TilestashConfig(
      arguments,
      arguments.bounds("region", "bounds to download tiles for", BRAZIL_BOUNDS),
      dataDir,
      arguments.file("tile_cache", "sqlite file that stores downloaded tiles", dataDir.resolve("tiles.db")),
      arguments.file("state_dir", "directory for checkpoints and task snapshots", dataDir.resolve("state")),
      arguments.file("packages_dir", "directory with .mbtiles packages and packages.json",
        dataDir.resolve("packages")),
      arguments.getString("http_user_agent", "User-Agent header to set when downloading tiles",
        "Tilestash downloader (https://github.com/onthegomap/tilestash)"),
      arguments.getDuration("direct_timeout", "timeout for a direct tile request", "4s"),
      arguments.getDuration("relay_timeout", "timeout for the preferred relay", "5s"),
      arguments.getDuration("race_timeout", "timeout for the remaining relays raced together", "6s"),
      arguments.getList("relays", "relay URL prefixes that take the encoded tile URL as a suffix", DEFAULT_RELAYS),
      arguments.getInteger("min_tile_bytes", "smallest response that counts as a valid tile", 500),
      arguments.getInteger("basemap_retries", "retries per base map tile", 2),
      arguments.getDuration("basemap_retry_wait", "pause between base map tile retries", "300ms"),
      arguments.getDuration("basemap_timeout", "timeout for one base map tile request", "10s"),
      arguments.getBoolean("constrained_device", "use the lower concurrency limit", false),
      arguments.getInteger("concurrency", "tiles fetched concurrently per batch", 20),
      arguments.getInteger("constrained_concurrency", "tiles fetched concurrently on a constrained device", 10),
      arguments.getInteger("cache_lookup_batch", "cache lookups per batch when checking for existing tiles", 50),
      arguments.getDuration("progress_interval", "minimum time between progress updates", "500ms"),
      arguments.getDuration("checkpoint_interval", "maximum time between checkpoint saves", "10s"),
      arguments.getDuration("checkpoint_max_age", "age after which a checkpoint is ignored", "24h"),
      arguments.getDuration("retry_delay", "pause before retrying failed tiles", "1s"),
      arguments.getDouble("retry_max_failed_ratio", "only retry when fewer than this share of tiles failed", 0.3),
      arguments.getDouble("success_ratio", "share of tiles that must be present to mark a layer complete", 0.9),
      arguments.getDuration("error_display", "how long a no-connection error stays visible", "3s"),
      Locale.forLanguageTag(arguments.getString("locale", "language for user-facing messages", "pt-BR"))
    );
  }

  /** Returns the number of tiles to fetch concurrently in one batch on this host. */
  public int effectiveConcurrency() {
    return constrainedDevice ? constrainedConcurrency : concurrency;
  }
}
