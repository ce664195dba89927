package com.onthegomap.tilestash.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class LogUtilTest {

  @AfterEach
  void reset() {
    LogUtil.clearStage();
  }

  @Test
  void testStageRoundTrip() {
    assertNull(LogUtil.getStage());
    LogUtil.setStage("LOW");
    assertEquals("LOW", LogUtil.getStage());
    assertEquals("[LOW] ", MDC.get("stage"));
  }

  @Test
  void testReplaceAndClearStage() {
    LogUtil.setStage("LOW");
    LogUtil.setStage("BASEMAP_OSM");
    assertEquals("BASEMAP_OSM", LogUtil.getStage());
    LogUtil.clearStage();
    assertNull(LogUtil.getStage());
  }
}
