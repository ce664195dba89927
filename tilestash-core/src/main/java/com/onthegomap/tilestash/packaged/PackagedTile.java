package com.onthegomap.tilestash.packaged;

/** Bytes of a tile read from a package, with the format detected from them. */
public record PackagedTile(byte[] data, ImageType type) {

  public static PackagedTile of(byte[] data) {
    return new PackagedTile(data, ImageType.detect(data));
  }

  public String mimeType() {
    return type.mimeType();
  }
}
