package com.onthegomap.tilestash.download;

import com.onthegomap.tilestash.cache.LayerMeta;
import com.onthegomap.tilestash.cache.LayerStatus;
import com.onthegomap.tilestash.cache.TileCache;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.fetch.RemoteTileFetcher;
import com.onthegomap.tilestash.layers.LayerCatalog;
import com.onthegomap.tilestash.layers.LayerDefinition;
import com.onthegomap.tilestash.layers.LayerKind;
import com.onthegomap.tilestash.layers.TileRequest;
import com.onthegomap.tilestash.net.Connectivity;
import com.onthegomap.tilestash.stats.Counter;
import com.onthegomap.tilestash.util.Format;
import com.onthegomap.tilestash.util.LogUtil;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes one layer of the {@link LayerCatalog} available offline by downloading every tile of its zoom levels into
 * the {@link TileCache}.
 * <p>
 * Tiles are fetched in fixed-size batches and a batch only starts once every fetch of the previous batch settled, so
 * a checkpoint always reflects whole batches. Downloads resume from a {@link DownloadCheckpoint} when one exists, and
 * stop with a checkpoint as soon as the host goes offline.
 * <p>
 * {@link #download(String, ProgressListener)} never throws: per-tile failures only affect statistics and whether
 * enough tiles were stored for the layer to count as complete.
 */
public class BulkDownloadEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(BulkDownloadEngine.class);
  private static final Format FORMAT = Format.defaultInstance();

  private final TilestashConfig config;
  private final LayerCatalog catalog;
  private final TileCache cache;
  private final RemoteTileFetcher fetcher;
  private final CheckpointStore checkpoints;
  private final Connectivity connectivity;
  private final Clock clock;

  public BulkDownloadEngine(TilestashConfig config, LayerCatalog catalog, TileCache cache, RemoteTileFetcher fetcher,
    CheckpointStore checkpoints, Connectivity connectivity) {
    this.config = config;
    this.catalog = catalog;
    this.cache = cache;
    this.fetcher = fetcher;
    this.checkpoints = checkpoints;
    this.connectivity = connectivity;
    this.clock = checkpoints.clock();
  }

  /**
   * Downloads every missing tile of {@code layerId}.
   *
   * @return true if at least the configured share of the layer's tiles is now stored
   */
  public boolean download(String layerId, ProgressListener listener) {
    Optional<LayerDefinition> layer = catalog.get(layerId);
    if (layer.isEmpty()) {
      LOGGER.error("Unknown layer: {}", layerId);
      return false;
    }
    String parentStage = LogUtil.getStage();
    LogUtil.setStage(layerId);
    try {
      return new Run(layer.get(), listener == null ? ProgressListener.NOOP : listener).execute();
    } catch (RuntimeException e) {
      LOGGER.error("Download failed", e);
      return false;
    } finally {
      if (parentStage == null) {
        LogUtil.clearStage();
      } else {
        LogUtil.setStage(parentStage);
      }
    }
  }

  /** Returns whether {@code layerId} finished, how many of its tiles are cached and any pending checkpoint. */
  public LayerDownloadStatus status(String layerId) {
    boolean downloaded = false;
    long count = 0;
    try {
      downloaded = cache.isCached(layerId);
      count = cache.count(layerId);
    } catch (IOException e) {
      LOGGER.warn("Could not read cache status of {}: {}", layerId, e.toString());
    }
    Optional<DownloadCheckpoint> checkpoint = checkpoints.load(layerId);
    return new LayerDownloadStatus(downloaded, count, checkpoint.isPresent(),
      checkpoint.map(DownloadCheckpoint::progress).orElse(0));
  }

  /** Discards the checkpoint of {@code layerId} so the next download checks the cache from scratch. */
  public void clearCheckpoint(String layerId) {
    checkpoints.delete(layerId);
  }

  /** State of one call to {@link #download(String, ProgressListener)}. */
  private final class Run {

    private final LayerDefinition layer;
    private final ProgressListener listener;
    private final long startMillis = clock.millis();
    private final Set<String> completed = ConcurrentHashMap.newKeySet();
    private final Counter.Readable downloaded = Counter.newCounter();
    private final Counter.Readable failed = Counter.newCounter();
    private final Counter.Readable retried = Counter.newCounter();
    private long skipped = 0;
    private long total = 0;
    private int preferredRelay = 0;
    private long lastProgress;
    private long lastCheckpoint;

    Run(LayerDefinition layer, ProgressListener listener) {
      this.layer = layer;
      this.listener = listener;
    }

    boolean execute() {
      List<TileRequest> targets = layer.targetTiles();
      total = targets.size();
      Set<String> present = findPresent(targets);
      completed.addAll(present);
      skipped = present.size();
      downloaded.incBy(skipped);
      List<TileRequest> remaining = targets.stream().filter(t -> !completed.contains(t.cacheKey())).toList();
      LOGGER.info("{} tiles on zooms {}, {} to download, {} already present", FORMAT.integer(total),
        layer.zoomLevels(), FORMAT.integer(remaining.size()), FORMAT.integer(skipped));

      setMeta(LayerStatus.DOWNLOADING);
      emit(stats(0));

      if (remaining.isEmpty()) {
        LOGGER.info("All tiles already present");
        checkpoints.delete(layer.id());
        setMeta(LayerStatus.COMPLETE);
        emit(100, stats(0));
        return true;
      }

      int concurrency = config.effectiveConcurrency();
      LOGGER.debug("Fetching {} tiles per batch", concurrency);
      lastProgress = lastCheckpoint = clock.millis();
      for (int i = 0; i < remaining.size(); i += concurrency) {
        if (!connectivity.isOnline()) {
          return stopOffline();
        }
        runBatch(remaining.subList(i, Math.min(remaining.size(), i + concurrency)), false);
        afterBatch(remaining.size());
      }

      List<TileRequest> failedTiles = remaining.stream().filter(t -> !completed.contains(t.cacheKey())).toList();
      if (!failedTiles.isEmpty() && failedTiles.size() < total * config.retryMaxFailedRatio()) {
        if (!retry(failedTiles, concurrency)) {
          return stopOffline();
        }
      }

      return finish();
    }

    private Set<String> findPresent(List<TileRequest> targets) {
      Set<String> targetKeys = new HashSet<>();
      for (TileRequest target : targets) {
        targetKeys.add(target.cacheKey());
      }
      Optional<DownloadCheckpoint> checkpoint = checkpoints.load(layer.id());
      if (checkpoint.isPresent() && !checkpoint.get().completedTileKeys().isEmpty()) {
        Set<String> result = new HashSet<>(checkpoint.get().completedTileKeys());
        result.retainAll(targetKeys);
        LOGGER.info("Resuming from checkpoint with {} tiles done", FORMAT.integer(result.size()));
        return result;
      }
      LOGGER.info("No checkpoint, checking cache for existing tiles");
      Set<String> result = new HashSet<>();
      int minBytes = minBytes();
      int batchSize = config.cacheLookupBatch();
      for (int i = 0; i < targets.size(); i += batchSize) {
        List<TileRequest> batch = targets.subList(i, Math.min(targets.size(), i + batchSize));
        for (TileRequest request : batch) {
          try {
            byte[] bytes = cache.get(request.cacheKey());
            if (bytes != null && bytes.length >= minBytes) {
              result.add(request.cacheKey());
            }
          } catch (IOException e) {
            LOGGER.warn("Could not check cache for {}: {}", request.cacheKey(), e.toString());
          }
        }
      }
      return result;
    }

    private int minBytes() {
      return layer.kind() == LayerKind.CHART ? config.minTileBytes() : 1;
    }

    private CompletableFuture<Boolean> fetch(TileRequest request) {
      CompletableFuture<Boolean> result = layer.kind() == LayerKind.BASEMAP ?
        fetcher.fetchDirect(request, config.basemapRetries()) :
        fetcher.fetch(request, preferredRelay);
      return result.exceptionally(e -> false);
    }

    private void runBatch(List<TileRequest> batch, boolean retry) {
      CompletableFuture<?>[] futures = new CompletableFuture<?>[batch.size()];
      for (int i = 0; i < batch.size(); i++) {
        TileRequest request = batch.get(i);
        futures[i] = fetch(request).thenAccept(success -> {
          if (Boolean.TRUE.equals(success)) {
            completed.add(request.cacheKey());
            downloaded.inc();
            if (retry) {
              retried.inc();
              failed.dec();
            }
          } else if (!retry) {
            failed.inc();
          }
        });
      }
      CompletableFuture.allOf(futures).join();
    }

    private void afterBatch(int toDownload) {
      long now = clock.millis();
      if (now - lastProgress >= config.progressInterval().toMillis()) {
        long processed = downloaded.get() - skipped + failed.get();
        double elapsedSeconds = Math.max(0.001, (now - startMillis) / 1000d);
        double rate = processed > 0 ? processed / elapsedSeconds : 1;
        emit(stats(Math.round((toDownload - processed) / rate)));
        lastProgress = now;
      }
      if (now - lastCheckpoint >= config.checkpointInterval().toMillis()) {
        saveCheckpoint();
        lastCheckpoint = now;
      }
    }

    /** Returns false if the host went offline during the retry pass. */
    private boolean retry(List<TileRequest> failedTiles, int concurrency) {
      LOGGER.info("Retrying {} failed tiles", FORMAT.integer(failedTiles.size()));
      try {
        Thread.sleep(config.retryDelay().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
      preferredRelay = (preferredRelay + 1) % Math.max(1, fetcher.relayCount());
      int batchSize = Math.max(1, concurrency / 2);
      for (int i = 0; i < failedTiles.size(); i += batchSize) {
        if (!connectivity.isOnline()) {
          return false;
        }
        runBatch(failedTiles.subList(i, Math.min(failedTiles.size(), i + batchSize)), true);
      }
      return true;
    }

    private boolean stopOffline() {
      LOGGER.warn("Lost connection, saving checkpoint with {} tiles", FORMAT.integer(completed.size()));
      saveCheckpoint();
      setMeta(LayerStatus.ERROR);
      emit(stats(-1));
      return false;
    }

    private boolean finish() {
      long present = downloaded.get();
      boolean success = present >= total * config.successRatio();
      if (success) {
        checkpoints.delete(layer.id());
      } else {
        saveCheckpoint();
      }
      setMeta(success ? LayerStatus.COMPLETE : LayerStatus.ERROR);
      DownloadStats stats = new DownloadStats(total, present, total - present, retried.get(), skipped,
        elapsedSeconds(), 0);
      LOGGER.info("{} {}/{} tiles ({}) in {}", success ? "Finished" : "Incomplete", FORMAT.integer(present),
        FORMAT.integer(total), FORMAT.percent(present / (double) total),
        FORMAT.duration(Duration.ofMillis(clock.millis() - startMillis)));
      emit(100, stats);
      return success;
    }

    private long elapsedSeconds() {
      return Math.round((clock.millis() - startMillis) / 1000d);
    }

    private DownloadStats stats(long estimatedSecondsRemaining) {
      return new DownloadStats(total, downloaded.get(), failed.get(), retried.get(), skipped, elapsedSeconds(),
        estimatedSecondsRemaining);
    }

    private void saveCheckpoint() {
      checkpoints.save(new DownloadCheckpoint(layer.id(), Set.copyOf(completed), total, clock.millis(),
        layer.zoomLevels()));
    }

    private void setMeta(LayerStatus status) {
      try {
        cache.setLayerMeta(new LayerMeta(layer.id(), total, downloaded.get(), clock.millis(), status));
      } catch (IOException e) {
        LOGGER.warn("Could not update layer metadata: {}", e.toString());
      }
    }

    private void emit(DownloadStats stats) {
      emit(stats.percent(), stats);
    }

    private void emit(int percent, DownloadStats stats) {
      try {
        listener.onProgress(percent, stats);
      } catch (RuntimeException e) {
        LOGGER.warn("Progress listener failed", e);
      }
    }
  }
}
