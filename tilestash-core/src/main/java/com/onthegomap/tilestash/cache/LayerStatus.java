package com.onthegomap.tilestash.cache;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Download state of a layer as recorded in the tile cache. */
public enum LayerStatus {
  DOWNLOADING,
  COMPLETE,
  ERROR;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static LayerStatus from(String id) {
    return valueOf(id.toUpperCase(Locale.ROOT));
  }
}
