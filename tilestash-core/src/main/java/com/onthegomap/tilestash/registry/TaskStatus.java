package com.onthegomap.tilestash.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of a download task: pending, then downloading, then complete or error. */
public enum TaskStatus {
  PENDING,
  DOWNLOADING,
  COMPLETE,
  ERROR;

  /** Returns true for states a download can still be running in. */
  public boolean isActive() {
    return this == PENDING || this == DOWNLOADING;
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TaskStatus from(String id) {
    return valueOf(id.toUpperCase(Locale.ROOT));
  }
}
