package com.onthegomap.tilestash.fetch;

import java.time.Duration;

/**
 * Outcome of fetching a tile through one path (direct or a relay).
 *
 * @param source   {@code direct} or {@code relay N}
 * @param detail   short reason for a failure, empty on success
 * @param response what the server answered, {@code null} after a transport failure
 */
public record Attempt(String source, String url, Outcome outcome, String detail, Duration elapsed,
  TileResponse response) {

  public enum Outcome {
    SUCCESS,
    /** Network error, timeout or cancellation. */
    TRANSPORT_FAILURE,
    /** The server answered with something that is not a usable tile. */
    VALIDATION_FAILURE
  }

  static Attempt success(String source, String url, Duration elapsed, TileResponse response) {
    return new Attempt(source, url, Outcome.SUCCESS, "", elapsed, response);
  }

  static Attempt transportFailure(String source, String url, String detail, Duration elapsed) {
    return new Attempt(source, url, Outcome.TRANSPORT_FAILURE, detail, elapsed, null);
  }

  static Attempt validationFailure(String source, String url, String detail, Duration elapsed,
    TileResponse response) {
    return new Attempt(source, url, Outcome.VALIDATION_FAILURE, detail, elapsed, response);
  }

  public boolean isSuccess() {
    return outcome == Outcome.SUCCESS;
  }

  /** Returns true if asking the same source again may help: the request failed or the server returned an error. */
  public boolean isRetryable() {
    return outcome == Outcome.TRANSPORT_FAILURE || (response != null && !response.isSuccessful());
  }

  @Override
  public String toString() {
    return source + " " + outcome + (detail.isEmpty() ? "" : (" (" + detail + ")")) + " in " +
      elapsed.toMillis() + "ms";
  }
}
