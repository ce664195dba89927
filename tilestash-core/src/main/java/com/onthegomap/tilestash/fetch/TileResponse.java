package com.onthegomap.tilestash.fetch;

import java.util.Locale;

/**
 * Status, content type and body of an HTTP response for a tile.
 *
 * @param contentType value of the {@code Content-Type} header or {@code null} if missing
 */
public record TileResponse(int statusCode, String contentType, byte[] body) {

  public static TileResponse ok(String contentType, byte[] body) {
    return new TileResponse(200, contentType, body);
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * Returns why this response is not a usable tile, or {@code null} if it is.
   *
   * @param minBytes      smallest body accepted
   * @param requireImage  whether the content type must be an image type that is not an XML or HTML error page
   */
  public String rejectionReason(int minBytes, boolean requireImage) {
    if (!isSuccessful()) {
      return "status " + statusCode;
    }
    if (requireImage) {
      String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
      if (!type.startsWith("image/") || type.contains("xml") || type.contains("text/html")) {
        return "content type " + contentType;
      }
    }
    int length = body == null ? 0 : body.length;
    if (length < Math.max(1, minBytes)) {
      return "only " + length + " bytes";
    }
    return null;
  }
}
