package com.onthegomap.tilestash.layers;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilestash.TestUtils;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.geo.TileCoord;
import com.onthegomap.tilestash.geo.TileGrid;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class LayerCatalogTest {

  private final LayerCatalog catalog = LayerCatalog.defaults(TilestashConfig.BRAZIL_BOUNDS);

  private static Map<String, String> queryParams(String url) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String pair : URI.create(url).getRawQuery().split("&")) {
      String[] kv = pair.split("=", 2);
      result.put(kv[0], URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
    }
    return result;
  }

  @Test
  void testDefaultLayers() {
    assertEquals(List.of("HIGH", "LOW", "WAC", "REA", "REUL", "REH", "BASEMAP_OSM", "BASEMAP_DARK", "BASEMAP_TOPO"),
      catalog.all().stream().map(LayerDefinition::id).toList());
    assertEquals(LayerKind.CHART, catalog.get("LOW").orElseThrow().kind());
    assertEquals(LayerKind.BASEMAP, catalog.get("BASEMAP_OSM").orElseThrow().kind());
    assertTrue(catalog.get("OSM").isEmpty());
    assertTrue(catalog.get("nope").isEmpty());
  }

  @Test
  void testZoomLevels() {
    assertEquals(List.of(5, 6, 7, 8), catalog.get("HIGH").orElseThrow().zoomLevels());
    assertEquals(List.of(6, 7, 8, 9, 10), catalog.get("REA").orElseThrow().zoomLevels());
    assertEquals(List.of(7, 8, 9, 10), catalog.get("REH").orElseThrow().zoomLevels());
    assertEquals(List.of(4, 5, 6, 7), catalog.get("BASEMAP_TOPO").orElseThrow().zoomLevels());
  }

  @Test
  void testWmsUrl() {
    LayerDefinition layer = catalog.get("REUL").orElseThrow();
    TileCoord coord = TileCoord.ofXYZ(100, 200, 10);
    String url = layer.tileUrl(coord);
    assertTrue(url.startsWith(LayerCatalog.DECEA_WMS + "?service=WMS&request=GetMap&layers="), url);
    Map<String, String> params = queryParams(url);
    assertEquals(List.of("service", "request", "layers", "styles", "format", "transparent", "version", "width",
      "height", "srs", "bbox"), List.copyOf(params.keySet()));
    assertEquals("ICA:CCV_REUL_WJ3_RIO_DE_JANEIRO", params.get("layers"));
    assertEquals("", params.get("styles"));
    assertEquals("image/png", params.get("format"));
    assertEquals("true", params.get("transparent"));
    assertEquals("1.1.1", params.get("version"));
    assertEquals("256", params.get("width"));
    assertEquals("256", params.get("height"));
    assertEquals("EPSG:4326", params.get("srs"));
    assertEquals(TileGrid.bboxParam(coord), params.get("bbox"));
  }

  @Test
  void testXyzUrl() {
    TileCoord coord = TileCoord.ofXYZ(11, 17, 5);
    assertEquals("https://a.tile.openstreetmap.org/5/11/17.png",
      catalog.get("BASEMAP_OSM").orElseThrow().tileUrl(coord));
    assertEquals("https://a.basemaps.cartocdn.com/dark_all/5/11/17.png",
      catalog.get("BASEMAP_DARK").orElseThrow().tileUrl(coord));
    assertEquals("https://a.tile.opentopomap.org/5/11/17.png",
      catalog.get("BASEMAP_TOPO").orElseThrow().tileUrl(coord));
  }

  @Test
  void testTargetTiles() {
    Envelope region = TestUtils.regionCovering(10, 100, 200, 109, 209);
    LayerDefinition layer = new XyzLayer("BASEMAP_TEST", "test", "https://{s}.tile.openstreetmap.org/{z}/{x}/{y}.png",
      List.of("b", "c"), List.of(10), region);
    List<TileRequest> tiles = layer.targetTiles();
    assertEquals(100, tiles.size());
    assertEquals(100, layer.targetTileCount());
    TileRequest first = tiles.get(0);
    assertEquals("BASEMAP_TEST", first.layerId());
    assertEquals(TileCoord.ofXYZ(100, 200, 10), first.coord());
    assertEquals("https://b.tile.openstreetmap.org/10/100/200.png", first.remoteUrl());
    assertEquals("https://a.tile.openstreetmap.org/10/100/200.png", first.cacheKey());
    assertEquals(100, tiles.stream().map(TileRequest::cacheKey).distinct().count());
  }

  @Test
  void testDuplicateIdsRejected() {
    Envelope region = TestUtils.regionCovering(10, 100, 200, 101, 201);
    WmsLayer layer = new WmsLayer("X", "https://example.com/wms", "a", List.of(10), region);
    assertThrows(IllegalArgumentException.class, () -> LayerCatalog.of(layer, layer));
  }

  @Test
  void testLayerKindIds() {
    assertEquals("BASEMAP_OSM", LayerKind.BASEMAP.layerId("OSM"));
    assertEquals("BASEMAP_OSM", LayerKind.BASEMAP.layerId("BASEMAP_OSM"));
    assertEquals("OSM", LayerKind.BASEMAP.layerName("BASEMAP_OSM"));
    assertEquals("LOW", LayerKind.CHART.layerId("LOW"));
    assertEquals(LayerKind.BASEMAP, LayerKind.from("basemap"));
    assertThrows(IllegalArgumentException.class, () -> LayerKind.from("other"));
  }
}
