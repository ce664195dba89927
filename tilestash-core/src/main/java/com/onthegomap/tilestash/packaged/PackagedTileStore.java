package com.onthegomap.tilestash.packaged;

import com.onthegomap.tilestash.util.Exceptions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves tiles from MBTiles packages listed in a {@link PackageRegistry}.
 * <p>
 * Packages are opened lazily on first use and stay open until {@link #close(String)} or {@link #closeAll()}. Callers
 * that ask for a package while another thread is opening it wait for that open instead of starting their own, so
 * there is never more than one handle per file id. A failed open is forgotten so a later call can try again.
 * <p>
 * Missing or unreadable packages never throw: reads return empty results.
 */
@ThreadSafe
public class PackagedTileStore implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PackagedTileStore.class);

  private final PackageRegistry registry;
  private final Map<String, CompletableFuture<PackagedTileDatabase>> handles = new ConcurrentHashMap<>();

  public PackagedTileStore(PackageRegistry registry) {
    this.registry = registry;
  }

  /**
   * Returns the open handle for {@code fileId}, opening it if this is the first request.
   *
   * @throws PackageOpenException if the package is not in the registry or cannot be opened
   */
  PackagedTileDatabase database(String fileId) {
    CompletableFuture<PackagedTileDatabase> created = new CompletableFuture<>();
    CompletableFuture<PackagedTileDatabase> existing = handles.putIfAbsent(fileId, created);
    if (existing == null) {
      try {
        created.complete(openDatabase(fileId));
      } catch (RuntimeException e) {
        handles.remove(fileId, created);
        created.completeExceptionally(e);
      }
      existing = created;
    }
    try {
      return existing.join();
    } catch (CompletionException e) {
      Throwable cause = Exceptions.unwrap(e);
      throw cause instanceof PackageOpenException poe ? poe :
        new PackageOpenException("Unable to open package " + fileId, cause);
    }
  }

  private PackagedTileDatabase openDatabase(String fileId) {
    Path path;
    try {
      path = registry.getFile(fileId)
        .orElseThrow(() -> new PackageOpenException("Package " + fileId + " not found"));
    } catch (IOException e) {
      throw new PackageOpenException("Unable to look up package " + fileId, e);
    }
    return PackagedTileDatabase.open(fileId, path);
  }

  private Optional<PackagedTileDatabase> tryDatabase(String fileId) {
    try {
      return Optional.of(database(fileId));
    } catch (PackageOpenException e) {
      LOGGER.warn("{}: {}", e.getMessage(), e.getCause() == null ? "" : e.getCause().toString());
      return Optional.empty();
    }
  }

  /**
   * Returns the tile at slippy-map coordinate {@code z/x/y} of package {@code fileId}, or empty if the package or
   * the tile is not available.
   */
  public Optional<PackagedTile> getTile(String fileId, int z, int x, int y) {
    return tryDatabase(fileId).flatMap(db -> {
      try {
        byte[] data = db.getTile(z, x, y);
        return data == null ? Optional.empty() : Optional.of(PackagedTile.of(data));
      } catch (IOException e) {
        LOGGER.warn("Error reading tile z={} x={} y={}: {}", z, x, y, e.toString());
        return Optional.empty();
      }
    });
  }

  /** Returns all name/value rows of the package's metadata table, or an empty map if unavailable. */
  public Map<String, String> metadata(String fileId) {
    return tryDatabase(fileId).map(PackagedTileDatabase::metadata).orElse(Map.of());
  }

  /** Returns the summary extracted when the package was opened. */
  public Optional<PackagedTileDatabase.Info> databaseInfo(String fileId) {
    return tryDatabase(fileId).map(PackagedTileDatabase::info);
  }

  public long tileCount(String fileId) {
    return tryDatabase(fileId).map(db -> db.info().tileCount()).orElse(0L);
  }

  public long tileCount(String fileId, int zoom) {
    return tryDatabase(fileId).map(db -> {
      try {
        return db.tileCount(zoom);
      } catch (IOException e) {
        LOGGER.warn("{}", e.toString());
        return 0L;
      }
    }).orElse(0L);
  }

  public List<Integer> availableZooms(String fileId) {
    return tryDatabase(fileId).map(db -> {
      try {
        return db.availableZooms();
      } catch (IOException e) {
        LOGGER.warn("{}", e.toString());
        return List.<Integer>of();
      }
    }).orElse(List.of());
  }

  /** Returns true if the registry has at least one complete, non-empty {@code .mbtiles} package for the chart. */
  public boolean isReady(String chartId) {
    return !fileIds(chartId).isEmpty();
  }

  /** Returns ids of the usable packages of {@code chartId}. */
  public List<String> fileIds(String chartId) {
    try {
      return registry.listAllMeta().stream()
        .filter(record -> chartId.equals(record.chartId()) && record.isUsable())
        .map(PackageRecord::id)
        .toList();
    } catch (IOException e) {
      LOGGER.warn("Could not list packages: {}", e.toString());
      return List.of();
    }
  }

  /** Returns true if {@code fileId} is currently open or being opened. */
  public boolean isOpen(String fileId) {
    return handles.containsKey(fileId);
  }

  /** Releases the handle of {@code fileId}, waiting for an in-flight open to finish first. */
  public void close(String fileId) {
    CompletableFuture<PackagedTileDatabase> handle = handles.remove(fileId);
    if (handle != null) {
      handle.thenAccept(PackagedTileDatabase::close);
    }
  }

  /** Releases every open handle. */
  public void closeAll() {
    for (String fileId : List.copyOf(handles.keySet())) {
      close(fileId);
    }
  }

  @Override
  public void close() {
    closeAll();
  }
}
