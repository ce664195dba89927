package com.onthegomap.tilestash.layers;

import com.onthegomap.tilestash.geo.TileCoord;
import com.onthegomap.tilestash.geo.TileGrid;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.locationtech.jts.geom.Envelope;

/**
 * A chart layer rendered on demand by a WMS 1.1.1 server as transparent 256x256 PNG tiles in EPSG:4326.
 *
 * @param layers comma-separated WMS layer names to render together
 */
public record WmsLayer(
  String id,
  String serviceUrl,
  String layers,
  List<Integer> zoomLevels,
  Envelope region
) implements LayerDefinition {

  public static final int TILE_SIZE = 256;

  public WmsLayer {
    zoomLevels = List.copyOf(zoomLevels);
  }

  @Override
  public LayerKind kind() {
    return LayerKind.CHART;
  }

  @Override
  public String tileUrl(TileCoord coord) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("service", "WMS");
    params.put("request", "GetMap");
    params.put("layers", layers);
    params.put("styles", "");
    params.put("format", "image/png");
    params.put("transparent", "true");
    params.put("version", "1.1.1");
    params.put("width", Integer.toString(TILE_SIZE));
    params.put("height", Integer.toString(TILE_SIZE));
    params.put("srs", "EPSG:4326");
    params.put("bbox", TileGrid.bboxParam(coord));
    return serviceUrl + "?" + params.entrySet().stream()
      .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
      .collect(Collectors.joining("&"));
  }
}
