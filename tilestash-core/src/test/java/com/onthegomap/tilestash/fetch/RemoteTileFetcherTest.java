package com.onthegomap.tilestash.fetch;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilestash.TestUtils;
import com.onthegomap.tilestash.cache.InMemoryTileCache;
import com.onthegomap.tilestash.config.Arguments;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.geo.TileCoord;
import com.onthegomap.tilestash.layers.TileRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class RemoteTileFetcherTest {

  private static final String TILE_URL = "https://example.com/wms?bbox=1,2,3,4";
  private static final String R0 = "https://r0.example/?u=";
  private static final String R1 = "https://r1.example/?u=";
  private static final String R2 = "https://r2.example/?u=";

  private final TilestashConfig config = TilestashConfig.from(Arguments.of(
    "relays", String.join(",", R0, R1, R2),
    "direct_timeout", "2s",
    "relay_timeout", "2s",
    "race_timeout", "2s",
    "basemap_retry_wait", "0ms"
  ));
  private final InMemoryTileCache cache = new InMemoryTileCache();
  private final List<String> requested = new CopyOnWriteArrayList<>();
  private final List<Duration> timeouts = new CopyOnWriteArrayList<>();
  private final TileRequest request = TileRequest.of("LOW", TileCoord.ofXYZ(1, 2, 5), TILE_URL);

  private RemoteTileFetcher fetcher(Function<String, CompletableFuture<TileResponse>> server) {
    return new RemoteTileFetcher(config, cache) {
      @Override
      CompletableFuture<TileResponse> get(String url, Duration timeout) {
        requested.add(url);
        timeouts.add(timeout);
        return server.apply(url);
      }
    };
  }

  private static CompletableFuture<TileResponse> image(int size) {
    return CompletableFuture.completedFuture(TileResponse.ok("image/png", TestUtils.png(size)));
  }

  private static CompletableFuture<TileResponse> xmlError() {
    return CompletableFuture.completedFuture(TileResponse.ok("application/vnd.ogc.se_xml", TestUtils.png(800)));
  }

  @Test
  void testRelayUrlEncodesTarget() {
    assertEquals(R0 + "https%3A%2F%2Fexample.com%2Fwms%3Fbbox%3D1%2C2%2C3%2C4", RemoteTileFetcher.relayUrl(R0, TILE_URL));
  }

  @Test
  void testDirectSuccess() {
    var fetcher = fetcher(url -> image(1000));
    assertTrue(fetcher.fetch(request, 0).join());
    assertEquals(List.of(TILE_URL), requested);
    assertEquals(1000, cache.get(request.cacheKey()).length);
  }

  @Test
  void testRejectsXmlAndFallsBackToPreferredRelay() {
    var fetcher = fetcher(url -> url.equals(TILE_URL) ? xmlError() : image(1000));
    assertTrue(fetcher.fetch(request, 1).join());
    assertEquals(List.of(TILE_URL, RemoteTileFetcher.relayUrl(R1, TILE_URL)), requested);
    assertNotNull(cache.get(request.cacheKey()));
  }

  @Test
  void testPreferredRelayWrapsAround() {
    var fetcher = fetcher(url -> url.equals(TILE_URL) ? CompletableFuture.failedFuture(new RuntimeException("down")) :
      image(1000));
    assertTrue(fetcher.fetch(request, 4).join());
    assertEquals(RemoteTileFetcher.relayUrl(R1, TILE_URL), requested.get(1));
  }

  @Test
  void testRacesRemainingRelays() {
    Map<String, CompletableFuture<TileResponse>> pending = new ConcurrentHashMap<>();
    var fetcher = fetcher(url -> {
      if (url.startsWith(R2)) {
        return image(700);
      } else if (url.startsWith(R1)) {
        return pending.computeIfAbsent(url, u -> new CompletableFuture<>());
      }
      return CompletableFuture.completedFuture(TileResponse.ok("text/html", TestUtils.png(900)));
    });
    assertTrue(fetcher.fetch(request, 0).join());
    assertEquals(4, requested.size());
    assertEquals(700, cache.get(request.cacheKey()).length);
  }

  @Test
  void testRaceCancelsLosingRequests() {
    Map<String, CompletableFuture<TileResponse>> pending = new ConcurrentHashMap<>();
    var fetcher = fetcher(url -> {
      if (url.startsWith(R2)) {
        return image(700);
      } else if (url.startsWith(R1)) {
        return pending.computeIfAbsent(url, u -> new CompletableFuture<>());
      }
      return CompletableFuture.failedFuture(new RuntimeException("down"));
    });
    assertTrue(fetcher.fetch(request, 0).join());
    CompletableFuture<TileResponse> loser = pending.get(RemoteTileFetcher.relayUrl(R1, TILE_URL));
    assertNotNull(loser);
    assertTrue(loser.isCancelled());
  }

  @Test
  void testTooSmallEverywhereFails() {
    var fetcher = fetcher(url -> image(100));
    assertFalse(fetcher.fetch(request, 0).join());
    assertEquals(4, requested.size());
    assertNull(cache.get(request.cacheKey()));
  }

  @Test
  void testThrowingTransportNeverEscapes() {
    var fetcher = fetcher(url -> {
      throw new IllegalStateException("boom");
    });
    assertFalse(fetcher.fetch(request, 0).join());
    assertEquals(0, cache.size());
  }

  @Test
  void testFetchDirectRetries() {
    TileRequest basemap = TileRequest.of("BASEMAP_OSM", TileCoord.ofXYZ(1, 2, 5),
      "https://b.tile.openstreetmap.org/5/1/2.png");
    int[] calls = {0};
    var fetcher = fetcher(url -> ++calls[0] < 3 ? CompletableFuture.completedFuture(new TileResponse(503, null, null)) :
      CompletableFuture.completedFuture(new TileResponse(200, "image/png", new byte[]{1})));
    assertTrue(fetcher.fetchDirect(basemap, 2).join());
    assertEquals(3, requested.size());
    assertTrue(requested.stream().allMatch(basemap.remoteUrl()::equals));
    assertArrayEquals(new byte[]{1}, cache.get("https://a.tile.openstreetmap.org/5/1/2.png"));
  }

  @Test
  void testFetchDirectUsesBasemapTimeout() {
    TileRequest basemap = TileRequest.of("BASEMAP_OSM", TileCoord.ofXYZ(1, 2, 5),
      "https://a.tile.openstreetmap.org/5/1/2.png");
    var fetcher = fetcher(url -> image(10));
    assertTrue(fetcher.fetchDirect(basemap, 2).join());
    assertEquals(List.of(Duration.ofSeconds(10)), timeouts);
  }

  @Test
  void testFetchDirectGivesUpAfterRetries() {
    TileRequest basemap = TileRequest.of("BASEMAP_OSM", TileCoord.ofXYZ(1, 2, 5),
      "https://a.tile.openstreetmap.org/5/1/2.png");
    var fetcher = fetcher(url -> CompletableFuture.failedFuture(new RuntimeException("reset")));
    assertFalse(fetcher.fetchDirect(basemap, 2).join());
    assertEquals(3, requested.size());
  }

  @Test
  void testFetchDirectEmptyImageNotRetried() {
    TileRequest basemap = TileRequest.of("BASEMAP_OSM", TileCoord.ofXYZ(1, 2, 5),
      "https://a.tile.openstreetmap.org/5/1/2.png");
    var fetcher = fetcher(url -> CompletableFuture.completedFuture(new TileResponse(200, "image/png", new byte[0])));
    assertFalse(fetcher.fetchDirect(basemap, 2).join());
    assertEquals(1, requested.size());
  }

  @Test
  void testFetchDirectRejectsHtmlPage() {
    TileRequest basemap = TileRequest.of("BASEMAP_OSM", TileCoord.ofXYZ(1, 2, 5),
      "https://a.tile.openstreetmap.org/5/1/2.png");
    var fetcher = fetcher(url -> CompletableFuture.completedFuture(
      TileResponse.ok("text/html", "<html>sign in to the network</html>".getBytes(StandardCharsets.UTF_8))));
    assertFalse(fetcher.fetchDirect(basemap, 2).join());
    assertEquals(1, requested.size());
    assertNull(cache.get(basemap.cacheKey()));
    assertEquals(0, cache.size());
  }
}
