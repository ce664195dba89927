package com.onthegomap.tilestash.packaged;

import com.onthegomap.tilestash.util.FileUtils;

/**
 * Registry entry for a package file.
 *
 * @param id        file id used to open the package
 * @param chartId   chart the package belongs to, one chart may have several packages
 * @param status    {@code complete} once the file is fully on disk
 * @param totalSize size of the file in bytes
 */
public record PackageRecord(
  String id,
  String chartId,
  String status,
  long totalSize,
  String fileName
) {

  public static final String COMPLETE = "complete";

  /** Returns true if this package is complete, non-empty and an {@code .mbtiles} file. */
  public boolean isUsable() {
    return COMPLETE.equals(status) && totalSize > 0 && fileName != null &&
      FileUtils.hasExtension(fileName, "mbtiles");
  }
}
