package com.onthegomap.tilestash.layers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Whether a layer is an aeronautical chart rendered by WMS or a base map served as XYZ tiles. */
public enum LayerKind {
  CHART(""),
  BASEMAP("BASEMAP_");

  private final String idPrefix;

  LayerKind(String idPrefix) {
    this.idPrefix = idPrefix;
  }

  /** Returns the catalogue id for a layer name, for example {@code BASEMAP_OSM} for base map {@code OSM}. */
  public String layerId(String name) {
    return name.startsWith(idPrefix) ? name : (idPrefix + name);
  }

  /** Returns the layer name without the catalogue prefix. */
  public String layerName(String id) {
    return id.startsWith(idPrefix) ? id.substring(idPrefix.length()) : id;
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static LayerKind from(String id) {
    for (LayerKind kind : values()) {
      if (kind.id().equalsIgnoreCase(id)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown layer kind: " + id);
  }
}
