package com.onthegomap.tilestash.fetch;

import static com.google.common.net.HttpHeaders.CONTENT_TYPE;
import static com.google.common.net.HttpHeaders.USER_AGENT;

import com.onthegomap.tilestash.cache.TileCache;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.layers.TileRequest;
import com.onthegomap.tilestash.util.Exceptions;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches one tile and stores it in the {@link TileCache} if the response is a usable image.
 * <p>
 * Chart tiles are tried directly first, then through the caller's preferred relay, then through every other relay at
 * once where the first valid response wins. Every failure is absorbed: the returned futures complete with
 * {@code false} and never exceptionally.
 */
public class RemoteTileFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteTileFetcher.class);

  private final TilestashConfig config;
  private final TileCache cache;
  private final HttpClient client;

  public RemoteTileFetcher(TilestashConfig config, TileCache cache) {
    this(config, cache, HttpClient.newBuilder()
      .connectTimeout(config.directTimeout())
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build());
  }

  RemoteTileFetcher(TilestashConfig config, TileCache cache, HttpClient client) {
    this.config = config;
    this.cache = cache;
    this.client = client;
  }

  /** Returns the URL that fetches {@code targetUrl} through the relay with prefix {@code relay}. */
  public static String relayUrl(String relay, String targetUrl) {
    return relay + URLEncoder.encode(targetUrl, StandardCharsets.UTF_8);
  }

  public int relayCount() {
    return config.relays().size();
  }

  /**
   * Fetches a chart tile directly, then through relay {@code preferredRelay} (modulo the number of relays), then
   * through the remaining relays raced against each other.
   *
   * @return a future that completes with true iff a validated tile was stored
   */
  public CompletableFuture<Boolean> fetch(TileRequest request, int preferredRelay) {
    String url = request.remoteUrl();
    List<String> relays = config.relays();
    return attempt("direct", url, config.directTimeout(), config.minTileBytes(), true)
      .thenCompose(direct -> {
        if (direct.isSuccess()) {
          return CompletableFuture.completedFuture(store(request, direct));
        }
        LOGGER.trace("{} {}", request.cacheKey(), direct);
        if (relays.isEmpty()) {
          return CompletableFuture.completedFuture(false);
        }
        int preferred = Math.floorMod(preferredRelay, relays.size());
        return attempt("relay " + preferred, relayUrl(relays.get(preferred), url), config.relayTimeout(),
          config.minTileBytes(), true)
          .thenCompose(relayed -> {
            if (relayed.isSuccess()) {
              return CompletableFuture.completedFuture(store(request, relayed));
            }
            LOGGER.trace("{} {}", request.cacheKey(), relayed);
            return race(request, preferred);
          });
      })
      .exceptionally(e -> {
        LOGGER.debug("Unexpected error fetching {}: {}", url, Exceptions.describe(e));
        return false;
      });
  }

  private CompletableFuture<Boolean> race(TileRequest request, int skip) {
    List<String> relays = config.relays();
    List<CompletableFuture<Attempt>> attempts = new ArrayList<>();
    for (int i = 0; i < relays.size(); i++) {
      if (i != skip) {
        attempts.add(attempt("relay " + i, relayUrl(relays.get(i), request.remoteUrl()), config.raceTimeout(),
          config.minTileBytes(), true));
      }
    }
    return FirstSuccess.of(attempts, Attempt::isSuccess).thenApply(result -> {
      if (LOGGER.isDebugEnabled() && result.winner().isEmpty()) {
        LOGGER.debug("All sources failed for {}: {}", request.cacheKey(), result.outcomes().stream()
          .map(outcome -> outcome.isSuccess() ? outcome.get().toString() : Exceptions.describe(outcome.exception()))
          .toList());
      }
      return result.winner().map(winner -> store(request, winner)).orElse(false);
    });
  }

  /**
   * Fetches a base map tile from its own URL only. Transport failures and error statuses are tried again up to
   * {@code retries} times after a pause; a response that is not a non-empty image fails right away.
   *
   * @return a future that completes with true iff a non-empty image tile was stored
   */
  public CompletableFuture<Boolean> fetchDirect(TileRequest request, int retries) {
    return attempt("direct", request.remoteUrl(), config.basemapTimeout(), 1, true)
      .thenCompose(result -> {
        if (result.isSuccess()) {
          return CompletableFuture.completedFuture(store(request, result));
        }
        LOGGER.trace("{} {}", request.cacheKey(), result);
        if (retries <= 0 || !result.isRetryable()) {
          return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.runAsync(() -> {
        }, CompletableFuture.delayedExecutor(config.basemapRetryWait().toMillis(), TimeUnit.MILLISECONDS))
          .thenCompose(v -> fetchDirect(request, retries - 1));
      })
      .exceptionally(e -> {
        LOGGER.debug("Unexpected error fetching {}: {}", request.remoteUrl(), Exceptions.describe(e));
        return false;
      });
  }

  private boolean store(TileRequest request, Attempt attempt) {
    try {
      cache.put(request.cacheKey(), attempt.response().body(), request.layerId());
      return true;
    } catch (IOException e) {
      LOGGER.warn("Could not store tile {}: {}", request.cacheKey(), e.toString());
      return false;
    }
  }

  /**
   * Runs one fetch bounded by {@code timeout} and validates the response; never completes exceptionally.
   * <p>
   * Cancelling the returned future also cancels the underlying request.
   */
  private CompletableFuture<Attempt> attempt(String source, String url, Duration timeout, int minBytes,
    boolean requireImage) {
    long start = System.nanoTime();
    CompletableFuture<TileResponse> transport;
    try {
      transport = get(url, timeout).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RuntimeException e) {
      transport = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<Attempt> result = transport.handle((response, error) -> {
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      if (error != null) {
        Throwable cause = Exceptions.unwrap(error);
        String detail = cause instanceof TimeoutException ? "timed out after " + timeout.toMillis() + "ms" :
          cause instanceof CancellationException ? "cancelled" : Exceptions.describe(cause);
        return Attempt.transportFailure(source, url, detail, elapsed);
      }
      String rejection = response.rejectionReason(minBytes, requireImage);
      return rejection == null ? Attempt.success(source, url, elapsed, response) :
        Attempt.validationFailure(source, url, rejection, elapsed, response);
    });
    // dependent futures do not propagate cancellation upstream
    CompletableFuture<TileResponse> request = transport;
    result.whenComplete((attempt, error) -> {
      if (result.isCancelled()) {
        request.cancel(true);
      }
    });
    return result;
  }

  /** Issues a GET request for {@code url}. Overridden in tests to avoid the network. */
  CompletableFuture<TileResponse> get(String url, Duration timeout) {
    HttpRequest request = HttpRequest.newBuilder(URI.create(url))
      .timeout(timeout)
      .header(USER_AGENT, config.httpUserAgent())
      .GET()
      .build();
    return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
      .thenApply(response -> new TileResponse(
        response.statusCode(),
        response.headers().firstValue(CONTENT_TYPE).orElse(null),
        response.body()
      ));
  }
}
