package com.onthegomap.tilestash.packaged;

/** Raster formats recognized from the leading bytes of a tile. */
public enum ImageType {
  PNG("image/png"),
  JPEG("image/jpeg"),
  WEBP("image/webp");

  private final String mimeType;

  ImageType(String mimeType) {
    this.mimeType = mimeType;
  }

  public String mimeType() {
    return mimeType;
  }

  /** Returns the format whose signature {@code data} starts with, or {@link #PNG} when none matches. */
  public static ImageType detect(byte[] data) {
    if (data != null) {
      if (data.length >= 4 && (data[0] & 0xFF) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G') {
        return PNG;
      }
      if (data.length >= 3 && (data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xD8 && (data[2] & 0xFF) == 0xFF) {
        return JPEG;
      }
      if (data.length >= 12 && data[0] == 'R' && data[1] == 'I' && data[2] == 'F' && data[3] == 'F' &&
        data[8] == 'W' && data[9] == 'E' && data[10] == 'B' && data[11] == 'P') {
        return WEBP;
      }
    }
    return PNG;
  }
}
