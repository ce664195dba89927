package com.onthegomap.tilestash.fetch;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilestash.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TileResponseTest {

  @Test
  void testAcceptsImage() {
    assertNull(TileResponse.ok("image/png", TestUtils.png(500)).rejectionReason(500, true));
    assertNull(TileResponse.ok("image/jpeg; charset=binary", TestUtils.png(600)).rejectionReason(500, true));
  }

  @ParameterizedTest
  @ValueSource(strings = {"text/xml", "application/vnd.ogc.se_xml", "text/html", "image/svg+xml", "application/json"})
  void testRejectsNonImageTypes(String contentType) {
    assertNotNull(TileResponse.ok(contentType, TestUtils.png(1000)).rejectionReason(500, true));
  }

  @Test
  void testRejectsMissingContentTypeForCharts() {
    assertNotNull(new TileResponse(200, null, TestUtils.png(1000)).rejectionReason(500, true));
    assertNull(new TileResponse(200, null, TestUtils.png(1)).rejectionReason(1, false));
  }

  @Test
  void testRejectsSmallBodies() {
    assertEquals("only 499 bytes", TileResponse.ok("image/png", TestUtils.png(499)).rejectionReason(500, true));
    assertEquals("only 0 bytes", TileResponse.ok("image/png", new byte[0]).rejectionReason(0, false));
  }

  @Test
  void testRejectsErrorStatus() {
    assertEquals("status 404", new TileResponse(404, "image/png", TestUtils.png(1000)).rejectionReason(1, false));
  }
}
