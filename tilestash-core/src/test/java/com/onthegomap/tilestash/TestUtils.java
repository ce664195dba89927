package com.onthegomap.tilestash;

import com.onthegomap.tilestash.geo.TileCoord;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.locationtech.jts.geom.Envelope;

public class TestUtils {

  private TestUtils() {}

  public static Path pathToResource(String resource) {
    Path cwd = Path.of("").toAbsolutePath();
    Path pathFromRoot = Path.of("tilestash-core", "src", "test", "resources", resource);
    return cwd.resolveSibling(pathFromRoot);
  }

  /** Returns a lat/lon box whose tile grid at {@code z} is exactly columns minX..maxX and rows minY..maxY. */
  public static Envelope regionCovering(int z, int minX, int minY, int maxX, int maxY) {
    Envelope northWest = TileCoord.ofXYZ(minX, minY, z).bounds();
    Envelope southEast = TileCoord.ofXYZ(maxX, maxY, z).bounds();
    double eps = 1e-6;
    return new Envelope(
      northWest.getMinX() + eps,
      southEast.getMaxX() - eps,
      southEast.getMinY() + eps,
      northWest.getMaxY() - eps
    );
  }

  /** Returns {@code size} bytes starting with the PNG signature. */
  public static byte[] png(int size) {
    byte[] result = new byte[size];
    Arrays.fill(result, (byte) 7);
    byte[] signature = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    System.arraycopy(signature, 0, result, 0, Math.min(size, signature.length));
    return result;
  }

  /** A tile row as stored in an MBTiles file, with {@code tileRow} counted from the south. */
  public record StoredTile(int z, int x, int tileRow, byte[] data) {}

  /** Writes an MBTiles file with the given metadata rows and tiles. */
  public static void writeMbtiles(Path path, Map<String, String> metadata, List<StoredTile> tiles)
    throws SQLException {
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath())) {
      try (Statement statement = connection.createStatement()) {
        statement.execute("CREATE TABLE metadata (name TEXT, value TEXT)");
        statement.execute(
          "CREATE TABLE tiles (zoom_level INTEGER, tile_column INTEGER, tile_row INTEGER, tile_data BLOB)");
      }
      try (PreparedStatement insert = connection.prepareStatement("INSERT INTO metadata VALUES (?, ?)")) {
        for (var entry : metadata.entrySet()) {
          insert.setString(1, entry.getKey());
          insert.setString(2, entry.getValue());
          insert.executeUpdate();
        }
      }
      try (PreparedStatement insert = connection.prepareStatement("INSERT INTO tiles VALUES (?, ?, ?, ?)")) {
        for (StoredTile tile : tiles) {
          insert.setInt(1, tile.z());
          insert.setInt(2, tile.x());
          insert.setInt(3, tile.tileRow());
          insert.setBytes(4, tile.data());
          insert.executeUpdate();
        }
      }
    }
  }

  /** A clock that only moves when told to. */
  public static class ManualClock extends Clock {

    private final AtomicLong millis;

    public ManualClock(Instant start) {
      this.millis = new AtomicLong(start.toEpochMilli());
    }

    public ManualClock() {
      this(Instant.parse("2024-05-01T12:00:00Z"));
    }

    public void advance(Duration duration) {
      millis.addAndGet(duration.toMillis());
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public long millis() {
      return millis.get();
    }
  }
}
