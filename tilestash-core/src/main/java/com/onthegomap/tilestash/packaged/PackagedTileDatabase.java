package com.onthegomap.tilestash.packaged;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import net.jcip.annotations.ThreadSafe;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * A read-only connection to an <a href="https://github.com/mapbox/mbtiles-spec">MBTiles</a> package.
 * <p>
 * Callers address tiles with row 0 in the north. Packages in this pipeline store rows with 0 in the south, so every
 * read flips the row regardless of the {@code scheme} the metadata declares.
 */
@ThreadSafe
public class PackagedTileDatabase implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PackagedTileDatabase.class);

  // load the sqlite driver
  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found");
    }
  }

  /**
   * Summary extracted when the package is opened.
   *
   * @param declaredBounds bounds from the metadata table, or null if missing or malformed
   * @param declaredScheme {@code scheme} from the metadata table, {@code unknown} if missing
   */
  public record Info(String fileName, Envelope declaredBounds, int minZoom, int maxZoom, long tileCount,
    String declaredScheme) {}

  private final String fileId;
  private final Connection connection;
  private final Info info;
  private PreparedStatement getTileStatement = null;

  private PackagedTileDatabase(String fileId, Connection connection) throws SQLException {
    this.fileId = fileId;
    this.connection = connection;
    this.info = extractInfo();
  }

  /**
   * Opens the package at {@code path} and reads its summary.
   *
   * @throws PackageOpenException if the file is not a readable MBTiles database
   */
  public static PackagedTileDatabase open(String fileId, Path path) {
    Objects.requireNonNull(path);
    SQLiteConfig config = new SQLiteConfig();
    config.setReadOnly(true);
    config.setCacheSize(10_000);
    Connection connection = null;
    try {
      connection = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath(), config.toProperties());
      PackagedTileDatabase result = new PackagedTileDatabase(fileId, connection);
      result.logInfo();
      return result;
    } catch (SQLException e) {
      closeQuietly(connection);
      throw new PackageOpenException("Unable to open package " + fileId + " at " + path, e);
    }
  }

  private static void closeQuietly(Connection connection) {
    if (connection != null) {
      try {
        connection.close();
      } catch (SQLException e) {
        LOGGER.debug("Error closing connection: {}", e.toString());
      }
    }
  }

  private Info extractInfo() throws SQLException {
    Map<String, String> metadata = readMetadata();
    int minZoom = 0;
    int maxZoom = 0;
    long count;
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery("SELECT MIN(zoom_level), MAX(zoom_level), COUNT(*) FROM tiles")
    ) {
      rs.next();
      minZoom = rs.getInt(1);
      maxZoom = rs.getInt(2);
      count = rs.getLong(3);
    }
    return new Info(
      metadata.getOrDefault("name", fileId),
      parseBounds(metadata.get("bounds")),
      minZoom,
      maxZoom,
      count,
      metadata.getOrDefault("scheme", "unknown")
    );
  }

  private Map<String, String> readMetadata() {
    Map<String, String> result = new LinkedHashMap<>();
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery("SELECT name, value FROM metadata")
    ) {
      while (rs.next()) {
        result.put(rs.getString(1), rs.getString(2));
      }
    } catch (SQLException e) {
      LOGGER.warn("Could not read metadata table of {}: {}", fileId, e.toString());
    }
    return result;
  }

  static Envelope parseBounds(String bounds) {
    if (bounds == null) {
      return null;
    }
    try {
      double[] values = Stream.of(bounds.split(",")).map(String::trim).mapToDouble(Double::parseDouble).toArray();
      return values.length == 4 ? new Envelope(values[0], values[2], values[1], values[3]) : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private void logInfo() {
    LOGGER.info("Opened package {}: name={} zooms={}-{} tiles={} bounds={} scheme={} (reading rows flipped)",
      fileId, info.fileName(), info.minZoom(), info.maxZoom(), info.tileCount(),
      info.declaredBounds() == null ? "not set" : info.declaredBounds(), info.declaredScheme());
  }

  public Info info() {
    return info;
  }

  /** Returns the tile at slippy-map coordinate {@code z/x/y}, or null if the package does not contain it. */
  public synchronized byte[] getTile(int z, int x, int y) throws IOException {
    try {
      if (getTileStatement == null) {
        getTileStatement = connection.prepareStatement("""
          SELECT tile_data FROM tiles
          WHERE zoom_level=? AND tile_column=? AND tile_row=?
          """);
      }
      getTileStatement.setInt(1, z);
      getTileStatement.setInt(2, x);
      getTileStatement.setInt(3, (1 << z) - 1 - y);
      try (ResultSet rs = getTileStatement.executeQuery()) {
        return rs.next() ? rs.getBytes(1) : null;
      }
    } catch (SQLException e) {
      throw new IOException("Could not read tile " + z + "/" + x + "/" + y + " from " + fileId, e);
    }
  }

  public synchronized Map<String, String> metadata() {
    return readMetadata();
  }

  public synchronized long tileCount(int zoom) throws IOException {
    try (PreparedStatement stmt = connection.prepareStatement("SELECT COUNT(*) FROM tiles WHERE zoom_level=?")) {
      stmt.setInt(1, zoom);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0;
      }
    } catch (SQLException e) {
      throw new IOException("Could not count tiles in " + fileId, e);
    }
  }

  public synchronized List<Integer> availableZooms() throws IOException {
    List<Integer> result = new ArrayList<>();
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery("SELECT DISTINCT zoom_level FROM tiles ORDER BY zoom_level")
    ) {
      while (rs.next()) {
        result.add(rs.getInt(1));
      }
      return result;
    } catch (SQLException e) {
      throw new IOException("Could not list zoom levels of " + fileId, e);
    }
  }

  @Override
  public synchronized void close() {
    LOGGER.debug("Closing package {}", fileId);
    closeQuietly(connection);
  }
}
