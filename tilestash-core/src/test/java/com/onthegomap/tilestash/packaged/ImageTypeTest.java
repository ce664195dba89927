package com.onthegomap.tilestash.packaged;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilestash.TestUtils;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ImageTypeTest {

  @Test
  void testDetect() {
    assertEquals(ImageType.PNG, ImageType.detect(TestUtils.png(100)));
    assertEquals(ImageType.JPEG, ImageType.detect(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00}));
    assertEquals(ImageType.WEBP, ImageType.detect("RIFF\0\0\0\0WEBPVP8 ".getBytes(StandardCharsets.ISO_8859_1)));
  }

  @Test
  void testDefaultsToPng() {
    assertEquals(ImageType.PNG, ImageType.detect(null));
    assertEquals(ImageType.PNG, ImageType.detect(new byte[0]));
    assertEquals(ImageType.PNG, ImageType.detect("GIF89a".getBytes(StandardCharsets.ISO_8859_1)));
  }

  @Test
  void testMimeType() {
    assertEquals("image/jpeg", PackagedTile.of(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}).mimeType());
    assertEquals("image/png", PackagedTile.of(TestUtils.png(10)).mimeType());
  }
}
