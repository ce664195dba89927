package com.onthegomap.tilestash;

import com.onthegomap.tilestash.cache.CacheStats;
import com.onthegomap.tilestash.config.Arguments;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.download.LayerDownloadStatus;
import com.onthegomap.tilestash.layers.LayerDefinition;
import com.onthegomap.tilestash.layers.LayerKind;
import com.onthegomap.tilestash.net.Connectivity;
import com.onthegomap.tilestash.packaged.PackagedTile;
import com.onthegomap.tilestash.util.Format;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line tasks. Each returns the process exit status.
 */
class Tasks {

  private static final Logger LOGGER = LoggerFactory.getLogger(Tasks.class);
  private static final Format FORMAT = Format.defaultInstance();

  private Tasks() {}

  private static Tilestash open(Arguments arguments) {
    return Tilestash.create(TilestashConfig.from(arguments), Connectivity.alwaysOnline());
  }

  /** {@code download --layer=LOW [--kind=chart|basemap]} */
  static int download(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    String layer = arguments.getString("layer", "layer to download, for example LOW or OSM");
    LayerKind kind = LayerKind.from(arguments.getString("kind", "chart or basemap", "chart"));
    try (Tilestash tilestash = open(arguments)) {
      var subscription = tilestash.registry().subscribe(tasks -> {
        var task = tasks.get(kind.layerId(layer));
        if (task != null && task.stats() != null) {
          LOGGER.info("{} {}% {}/{} tiles, {} failed, eta {}s", task.id(), task.progress(),
            FORMAT.integer(task.stats().downloadedTiles()), FORMAT.integer(task.stats().totalTiles()),
            FORMAT.integer(task.stats().failedTiles()), task.stats().estimatedSecondsRemaining());
        }
      });
      boolean success = tilestash.registry().start(layer, kind).join();
      subscription.close();
      tilestash.registry().task(kind.layerId(layer))
        .ifPresent(task -> LOGGER.info("{}: {}{}", task.id(), task.status().id(),
          task.error() == null ? "" : (" - " + task.error())));
      return success ? 0 : 1;
    }
  }

  /** {@code status --layer=LOW [--kind=chart|basemap]} */
  static int status(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    String layer = arguments.getString("layer", "layer to report on");
    LayerKind kind = LayerKind.from(arguments.getString("kind", "chart or basemap", "chart"));
    try (Tilestash tilestash = open(arguments)) {
      LayerDownloadStatus status = tilestash.engine().status(kind.layerId(layer));
      System.out.printf("layer=%s downloaded=%s tiles=%d checkpoint=%s checkpointProgress=%d%%%n",
        kind.layerId(layer), status.isDownloaded(), status.tileCount(), status.hasCheckpoint(),
        status.checkpointProgress());
      return 0;
    }
  }

  /** {@code layers}: lists every layer that can be downloaded. */
  static int layers(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    try (Tilestash tilestash = open(arguments)) {
      for (LayerDefinition layer : tilestash.catalog().all()) {
        System.out.printf("%-14s %-8s zooms=%s tiles=%s%n", layer.id(), layer.kind().id(), layer.zoomLevels(),
          FORMAT.integer(layer.targetTileCount()));
      }
      return 0;
    }
  }

  /** {@code cache-info}: tile count and size of the tile cache, and which layers finished. */
  static int cacheInfo(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    try (Tilestash tilestash = open(arguments)) {
      CacheStats stats = tilestash.tileCache().stats();
      System.out.printf("tiles=%s size=%sB%n", FORMAT.integer(stats.tileCount()), FORMAT.storage(stats.totalBytes()));
      for (String layerId : tilestash.tileCache().cachedLayerIds()) {
        tilestash.tileCache().getLayerMeta(layerId).ifPresent(meta -> System.out.printf("%-14s %-11s %s/%s%n",
          layerId, meta.status().id(), FORMAT.integer(meta.downloadedTiles()), FORMAT.integer(meta.totalTiles())));
      }
      return 0;
    }
  }

  /** {@code clear-cache}: removes every cached tile and download checkpoint. */
  static int clearCache(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    try (Tilestash tilestash = open(arguments)) {
      CacheStats before = tilestash.tileCache().stats();
      tilestash.clearCache();
      LOGGER.info("Cleared {} tiles ({}B)", FORMAT.integer(before.tileCount()), FORMAT.storage(before.totalBytes()));
      return 0;
    }
  }

  /** {@code package-info --file=<id>} */
  static int packageInfo(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    String fileId = arguments.getString("file", "package file id");
    try (Tilestash tilestash = open(arguments)) {
      var info = tilestash.packages().databaseInfo(fileId);
      if (info.isEmpty()) {
        System.err.println("Package not available: " + fileId);
        return 1;
      }
      System.out.println(info.get());
      System.out.println("zooms=" + tilestash.packages().availableZooms(fileId));
      tilestash.packages().metadata(fileId).forEach((k, v) -> System.out.println(k + "=" + v));
      return 0;
    }
  }

  /** {@code package-tile --file=<id> --z=5 --x=3 --y=7 --output=tile.png} */
  static int packageTile(String[] args) throws Exception {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    String fileId = arguments.getString("file", "package file id");
    int z = arguments.getInteger("z", "zoom", 0);
    int x = arguments.getInteger("x", "column", 0);
    int y = arguments.getInteger("y", "row, 0 is north", 0);
    Path output = arguments.file("output", "where to write the tile", Path.of("tile"));
    try (Tilestash tilestash = open(arguments)) {
      Optional<PackagedTile> tile = tilestash.packages().getTile(fileId, z, x, y);
      if (tile.isEmpty()) {
        System.err.println("Tile not found: " + z + "/" + x + "/" + y);
        return 1;
      }
      Files.write(output, tile.get().data());
      LOGGER.info("Wrote {} {} to {}", FORMAT.storage(tile.get().data().length), tile.get().mimeType(), output);
      return 0;
    }
  }
}
