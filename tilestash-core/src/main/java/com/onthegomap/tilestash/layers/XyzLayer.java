package com.onthegomap.tilestash.layers;

import com.onthegomap.tilestash.geo.TileCoord;
import java.util.List;
import org.locationtech.jts.geom.Envelope;

/**
 * A base map served as pre-rendered tiles from a {@code {s}/{z}/{x}/{y}} URL template.
 * <p>
 * The first subdomain is always used so the same tile is never fetched from two hosts, and the retina placeholder
 * {@code {r}} is dropped.
 */
public record XyzLayer(
  String id,
  String label,
  String urlTemplate,
  List<String> subdomains,
  List<Integer> zoomLevels,
  Envelope region
) implements LayerDefinition {

  public XyzLayer {
    zoomLevels = List.copyOf(zoomLevels);
    subdomains = List.copyOf(subdomains);
  }

  @Override
  public LayerKind kind() {
    return LayerKind.BASEMAP;
  }

  @Override
  public String tileUrl(TileCoord coord) {
    return urlTemplate
      .replace("{s}", subdomains.isEmpty() ? "" : subdomains.get(0))
      .replace("{z}", Integer.toString(coord.z()))
      .replace("{x}", Integer.toString(coord.x()))
      .replace("{y}", Integer.toString(coord.y()))
      .replace("{r}", "");
  }
}
