package com.onthegomap.tilestash;

import com.onthegomap.tilestash.cache.SqliteTileCache;
import com.onthegomap.tilestash.cache.TileCache;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.download.BulkDownloadEngine;
import com.onthegomap.tilestash.download.CheckpointStore;
import com.onthegomap.tilestash.fetch.RemoteTileFetcher;
import com.onthegomap.tilestash.layers.LayerCatalog;
import com.onthegomap.tilestash.layers.LayerDefinition;
import com.onthegomap.tilestash.net.Connectivity;
import com.onthegomap.tilestash.packaged.DirectoryPackageRegistry;
import com.onthegomap.tilestash.packaged.PackagedTileStore;
import com.onthegomap.tilestash.registry.DownloadTaskRegistry;
import com.onthegomap.tilestash.store.FileKeyValueStore;
import com.onthegomap.tilestash.store.KeyValueStore;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The services of one tilestash process, wired from a {@link TilestashConfig}: a sqlite tile cache, file-based
 * state, the download engine and task registry, and the package store.
 * <p>
 * Closing it stops the registry, releases open packages and closes the tile cache.
 */
public class Tilestash implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Tilestash.class);

  private final TilestashConfig config;
  private final LayerCatalog catalog;
  private final TileCache tileCache;
  private final BulkDownloadEngine engine;
  private final DownloadTaskRegistry registry;
  private final PackagedTileStore packages;

  private Tilestash(TilestashConfig config, LayerCatalog catalog, TileCache tileCache, KeyValueStore state,
    Connectivity connectivity, Clock clock) {
    this.config = config;
    this.catalog = catalog;
    this.tileCache = tileCache;
    CheckpointStore checkpoints = new CheckpointStore(state, config.checkpointMaxAge(), clock);
    RemoteTileFetcher fetcher = new RemoteTileFetcher(config, tileCache);
    this.engine = new BulkDownloadEngine(config, catalog, tileCache, fetcher, checkpoints, connectivity);
    this.registry = new DownloadTaskRegistry(config, engine, state, connectivity, clock);
    this.packages = new PackagedTileStore(new DirectoryPackageRegistry(config.packagesDir()));
  }

  /** Opens the tile cache and state directory from {@code config} and initializes the registry. */
  public static Tilestash create(TilestashConfig config, Connectivity connectivity) {
    LOGGER.info("Using data directory {}", config.dataDir().toAbsolutePath());
    Tilestash result = new Tilestash(
      config,
      LayerCatalog.defaults(config.region()),
      SqliteTileCache.open(config.tileCacheFile()),
      new FileKeyValueStore(config.stateDir()),
      connectivity,
      Clock.systemUTC()
    );
    result.registry.initialize();
    return result;
  }

  public TilestashConfig config() {
    return config;
  }

  public LayerCatalog catalog() {
    return catalog;
  }

  public TileCache tileCache() {
    return tileCache;
  }

  public BulkDownloadEngine engine() {
    return engine;
  }

  public DownloadTaskRegistry registry() {
    return registry;
  }

  public PackagedTileStore packages() {
    return packages;
  }

  /**
   * Removes every cached tile, all layer metadata and the checkpoint of every catalogue layer, so the next download
   * of any layer starts from scratch.
   */
  public void clearCache() throws IOException {
    tileCache.clearAll();
    for (LayerDefinition layer : catalog.all()) {
      engine.clearCheckpoint(layer.id());
    }
  }

  @Override
  public void close() throws IOException {
    registry.close();
    packages.close();
    tileCache.close();
  }
}
