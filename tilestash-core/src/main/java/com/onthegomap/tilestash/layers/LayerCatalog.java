package com.onthegomap.tilestash.layers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;

/**
 * The layers that can be downloaded, by id.
 */
public class LayerCatalog {

  public static final String DECEA_WMS = "https://geoaisweb.decea.mil.br/geoserver/wms";

  private final Map<String, LayerDefinition> layers = new LinkedHashMap<>();

  private LayerCatalog(Collection<? extends LayerDefinition> layers) {
    for (LayerDefinition layer : layers) {
      if (this.layers.put(layer.id(), layer) != null) {
        throw new IllegalArgumentException("Duplicate layer id: " + layer.id());
      }
    }
  }

  public static LayerCatalog of(LayerDefinition... layers) {
    return new LayerCatalog(List.of(layers));
  }

  /** Returns the aeronautical charts and base maps that cover {@code region}. */
  public static LayerCatalog defaults(Envelope region) {
    List<LayerDefinition> layers = new ArrayList<>();
    layers.add(new WmsLayer("HIGH", DECEA_WMS, enrouteCharts("H"), List.of(5, 6, 7, 8), region));
    layers.add(new WmsLayer("LOW", DECEA_WMS, enrouteCharts("L"), List.of(5, 6, 7, 8), region));
    layers.add(new WmsLayer("WAC", DECEA_WMS, String.join(",",
      "ICA:WAC_2825_CABO_ORANGE", "ICA:WAC_2826_MONTE_RORAIMA", "ICA:WAC_2827_SERRA_PACARAIMA",
      "ICA:WAC_2892_PICO_DA_NEBLINA", "ICA:WAC_2893_BOA_VISTA", "ICA:WAC_2894_TUMUCUMAQUE", "ICA:WAC_2895_MACAPA",
      "ICA:WAC_2944_FORTALEZA", "ICA:WAC_2945_SAO_LUIS", "ICA:WAC_2946_BELEM", "ICA:WAC_2947_SANTAREM",
      "ICA:WAC_2948_MANAUS", "ICA:WAC_2949_SAO_GABRIEL_DA_CACHOEIRA", "ICA:WAC_3012_CRUZEIRO_DO_SUL",
      "ICA:WAC_3013_TABATINGA", "ICA:WAC_3014_HUMAITA", "ICA:WAC_3015_ITAITUBA", "ICA:WAC_3016_IMPERATRIZ",
      "ICA:WAC_3017_TERESINA", "ICA:WAC_3018_NATAL", "ICA:WAC_3019_FERNANDO_DE_NORONHA", "ICA:WAC_3066_RECIFE",
      "ICA:WAC_3067_PETROLINA", "ICA:WAC_3068_PORTO_NACIONAL", "ICA:WAC_3069_CACHIMBO", "ICA:WAC_3070_JI_PARANA",
      "ICA:WAC_3071_PORTO_VELHO", "ICA:WAC_3072_TARAUACA", "ICA:WAC_3137_PRINCIPE_DA_BEIRA", "ICA:WAC_3138_CUIABA",
      "ICA:WAC_3139_ARAGARCAS", "ICA:WAC_3140_BRASILIA", "ICA:WAC_3141_SALVADOR", "ICA:WAC_3189_BELO_HORIZONTE",
      "ICA:WAC_3190_GOIANIA", "ICA:WAC_3191_RONDONOPOLIS", "ICA:WAC_3192_CORUMBA", "ICA:WAC_3260_BELA_VISTA",
      "ICA:WAC_3261_CAMPO_GRANDE", "ICA:WAC_3262_SAO_PAULO", "ICA:WAC_3263_RIO_DE_JANEIRO", "ICA:WAC_3313_CURITIBA",
      "ICA:WAC_3314_FOZ_DO_IGUACU", "ICA:WAC_3383_URUGUAIANA", "ICA:WAC_3384_PORTO_ALEGRE",
      "ICA:WAC_3434_RIO_DA_PRATA"
    ), List.of(5, 6, 7, 8), region));
    layers.add(new WmsLayer("REA", DECEA_WMS, String.join(",",
      "ICA:CCV_REA_WF_RECIFE", "ICA:CCV_REA_CY_CUIABA", "ICA:CCV_REA_WA_TABATINGA", "ICA:CCV_REA_WB_BELEM",
      "ICA:CCV_REA_WG_CAMPO_GRANDE", "ICA:CCV_REA_WH_BELO_HORIZONTE", "ICA:CCV_REA_WJ1_RIO_DE_JANEIRO",
      "ICA:CCV_REA_WK_PORTO_SEGURO", "ICA:CCV_REA_WN2_MANAUS", "ICA:CCV_REA_WP_PORTO_ALEGRE",
      "ICA:CCV_REA_WR_BRASILIA", "ICA:CCV_REA_WS_SAO_LUIS", "ICA:CCV_REA_WX_SANTAREM", "ICA:CCV_REA_WZ_FORTALEZA",
      "ICA:CCV_REA_XF_FLORIANOPOLIS", "ICA:CCV_REA_XK_MACAPA", "ICA:CCV_REA_XN-ANAPOLIS",
      "ICA:CCV_REA_XP1_SAO_PAULO", "ICA:CCV_REA_XP2_SAO_PAULO", "ICA:CCV_REA_XR_VITORIA",
      "ICA:CCV_REA_XS_SALVADOR", "ICA:CCV_REA_XT_NATAL"
    ), List.of(6, 7, 8, 9, 10), region));
    layers.add(new WmsLayer("REUL", DECEA_WMS, "ICA:CCV_REUL_WJ3_RIO_DE_JANEIRO", List.of(7, 8, 9, 10), region));
    layers.add(new WmsLayer("REH", DECEA_WMS, String.join(",",
      "ICA:CCV_REH_WH_BELO_HORIZONTE", "ICA:CCV_REH_WJ1_CABO_FRIO", "ICA:CCV_REH_WJ2_RIO_DE_JANEIRO",
      "ICA:CCV_REH_WJ3_RIO_DE_JANEIRO", "ICA:CCV_REH_XP1_SAO_JOSE_DOS_CAMPOS", "ICA:CCV_REH_XP1_SOROCABA",
      "ICA:CCV_REH_XP2_CAMPINAS", "ICA:CCV_REH_XP2_SAO_PAULO_1", "ICA:CCV_REH_XP2_SAO_PAULO_2",
      "ICA:REH_BACIA_DE_SANTOS", "ICA:REH_CURITIBA", "ICA:REH_VITORIA"
    ), List.of(7, 8, 9, 10), region));
    layers.add(new XyzLayer(LayerKind.BASEMAP.layerId("OSM"), "OpenStreetMap",
      "https://{s}.tile.openstreetmap.org/{z}/{x}/{y}.png", List.of("a", "b", "c"), List.of(4, 5, 6, 7, 8), region));
    layers.add(new XyzLayer(LayerKind.BASEMAP.layerId("DARK"), "Modo Noturno",
      "https://{s}.basemaps.cartocdn.com/dark_all/{z}/{x}/{y}{r}.png", List.of("a", "b", "c", "d"),
      List.of(4, 5, 6, 7, 8), region));
    layers.add(new XyzLayer(LayerKind.BASEMAP.layerId("TOPO"), "Terreno",
      "https://{s}.tile.opentopomap.org/{z}/{x}/{y}.png", List.of("a", "b", "c"), List.of(4, 5, 6, 7), region));
    return new LayerCatalog(layers);
  }

  private static String enrouteCharts(String level) {
    List<String> names = new ArrayList<>();
    for (int i = 1; i <= 9; i++) {
      names.add("ICA:ENRC_" + level + i);
    }
    return String.join(",", names);
  }

  public Optional<LayerDefinition> get(String id) {
    return Optional.ofNullable(layers.get(id));
  }

  public Collection<LayerDefinition> all() {
    return layers.values();
  }
}
