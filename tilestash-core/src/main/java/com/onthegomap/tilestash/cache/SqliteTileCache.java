package com.onthegomap.tilestash.cache;

import com.onthegomap.tilestash.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * A {@link TileCache} persisted to a sqlite file with a {@code tiles} table keyed by cache key and a
 * {@code layer_meta} table with one row per layer.
 * <p>
 * All access goes through one connection, guarded by this instance's monitor.
 */
@ThreadSafe
public class SqliteTileCache implements TileCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteTileCache.class);

  // load the sqlite driver
  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found");
    }
  }

  private final Connection connection;

  private SqliteTileCache(Connection connection) {
    this.connection = connection;
    execute("""
      CREATE TABLE IF NOT EXISTS tiles (
        key TEXT PRIMARY KEY,
        layer_id TEXT NOT NULL,
        data BLOB NOT NULL,
        timestamp INTEGER NOT NULL
      )
      """,
      "CREATE INDEX IF NOT EXISTS tiles_layer_id ON tiles (layer_id)",
      """
        CREATE TABLE IF NOT EXISTS layer_meta (
          layer_id TEXT PRIMARY KEY,
          total_tiles INTEGER NOT NULL,
          downloaded_tiles INTEGER NOT NULL,
          last_updated INTEGER NOT NULL,
          status TEXT NOT NULL
        )
        """);
  }

  /** Opens or creates the cache stored in {@code path}. */
  public static SqliteTileCache open(Path path) {
    Objects.requireNonNull(path);
    FileUtils.createParentDirectories(path);
    SQLiteConfig config = new SQLiteConfig();
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    config.setBusyTimeout(10_000);
    LOGGER.debug("Opening tile cache {}", path.toAbsolutePath());
    return new SqliteTileCache(newConnection("jdbc:sqlite:" + path.toAbsolutePath(), config));
  }

  /** Returns a cache that won't get written to disk. */
  public static SqliteTileCache newInMemoryDatabase() {
    return new SqliteTileCache(newConnection("jdbc:sqlite::memory:", new SQLiteConfig()));
  }

  private static Connection newConnection(String url, SQLiteConfig config) {
    try {
      return DriverManager.getConnection(url, config.toProperties());
    } catch (SQLException e) {
      throw new IllegalArgumentException("Unable to open " + url, e);
    }
  }

  private synchronized void execute(String... queries) {
    for (String query : queries) {
      try (Statement statement = connection.createStatement()) {
        statement.execute(query);
      } catch (SQLException e) {
        throw new IllegalStateException("Error executing queries " + String.join(",", queries), e);
      }
    }
  }

  @Override
  public synchronized void put(String key, byte[] data, String layerId) throws IOException {
    try (PreparedStatement stmt = connection.prepareStatement("""
      INSERT INTO tiles (key, layer_id, data, timestamp) VALUES (?, ?, ?, ?)
      ON CONFLICT(key) DO UPDATE SET layer_id=excluded.layer_id, data=excluded.data, timestamp=excluded.timestamp
      """)) {
      stmt.setString(1, key);
      stmt.setString(2, layerId);
      stmt.setBytes(3, data);
      stmt.setLong(4, System.currentTimeMillis());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw new IOException("Could not store tile " + key, e);
    }
  }

  @Override
  public synchronized byte[] get(String key) throws IOException {
    try (PreparedStatement stmt = connection.prepareStatement("SELECT data FROM tiles WHERE key=?")) {
      stmt.setString(1, key);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? rs.getBytes(1) : null;
      }
    } catch (SQLException e) {
      throw new IOException("Could not get tile " + key, e);
    }
  }

  @Override
  public synchronized long count(String layerId) throws IOException {
    try (PreparedStatement stmt = connection.prepareStatement("SELECT COUNT(*) FROM tiles WHERE layer_id=?")) {
      stmt.setString(1, layerId);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0;
      }
    } catch (SQLException e) {
      throw new IOException("Could not count tiles for " + layerId, e);
    }
  }

  @Override
  public synchronized void setLayerMeta(LayerMeta meta) throws IOException {
    try (PreparedStatement stmt = connection.prepareStatement("""
      INSERT OR REPLACE INTO layer_meta (layer_id, total_tiles, downloaded_tiles, last_updated, status)
      VALUES (?, ?, ?, ?, ?)
      """)) {
      stmt.setString(1, meta.layerId());
      stmt.setLong(2, meta.totalTiles());
      stmt.setLong(3, meta.downloadedTiles());
      stmt.setLong(4, meta.lastUpdated());
      stmt.setString(5, meta.status().id());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw new IOException("Could not store layer metadata for " + meta.layerId(), e);
    }
  }

  @Override
  public synchronized Optional<LayerMeta> getLayerMeta(String layerId) throws IOException {
    try (PreparedStatement stmt = connection.prepareStatement("""
      SELECT total_tiles, downloaded_tiles, last_updated, status FROM layer_meta WHERE layer_id=?
      """)) {
      stmt.setString(1, layerId);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new LayerMeta(layerId, rs.getLong(1), rs.getLong(2), rs.getLong(3),
          LayerStatus.from(rs.getString(4))));
      }
    } catch (SQLException e) {
      throw new IOException("Could not get layer metadata for " + layerId, e);
    }
  }

  @Override
  public synchronized void clearLayer(String layerId) throws IOException {
    try (
      PreparedStatement tiles = connection.prepareStatement("DELETE FROM tiles WHERE layer_id=?");
      PreparedStatement meta = connection.prepareStatement("DELETE FROM layer_meta WHERE layer_id=?")
    ) {
      tiles.setString(1, layerId);
      meta.setString(1, layerId);
      int deleted = tiles.executeUpdate();
      meta.executeUpdate();
      LOGGER.info("Removed {} cached tiles for {}", deleted, layerId);
    } catch (SQLException e) {
      throw new IOException("Could not clear layer " + layerId, e);
    }
  }

  @Override
  public synchronized List<String> cachedLayerIds() throws IOException {
    List<String> result = new ArrayList<>();
    try (
      Statement stmt = connection.createStatement();
      ResultSet rs = stmt.executeQuery("SELECT layer_id FROM layer_meta ORDER BY layer_id")
    ) {
      while (rs.next()) {
        result.add(rs.getString(1));
      }
      return result;
    } catch (SQLException e) {
      throw new IOException("Could not list cached layers", e);
    }
  }

  @Override
  public synchronized CacheStats stats() throws IOException {
    try (
      Statement stmt = connection.createStatement();
      ResultSet rs = stmt.executeQuery("SELECT COUNT(*), COALESCE(SUM(LENGTH(data)), 0) FROM tiles")
    ) {
      return rs.next() ? new CacheStats(rs.getLong(1), rs.getLong(2)) : new CacheStats(0, 0);
    } catch (SQLException e) {
      throw new IOException("Could not read cache stats", e);
    }
  }

  @Override
  public synchronized void clearAll() throws IOException {
    try (Statement stmt = connection.createStatement()) {
      int deleted = stmt.executeUpdate("DELETE FROM tiles");
      stmt.executeUpdate("DELETE FROM layer_meta");
      LOGGER.info("Removed {} cached tiles", deleted);
    } catch (SQLException e) {
      throw new IOException("Could not clear tile cache", e);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    try {
      connection.close();
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }
}
