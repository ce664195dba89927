package com.onthegomap.tilestash.packaged;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Knows which package files exist locally and where they are.
 */
public interface PackageRegistry {

  /** Returns the location of the package file with {@code fileId} if it is present. */
  Optional<Path> getFile(String fileId) throws IOException;

  Optional<PackageRecord> getMeta(String fileId) throws IOException;

  List<PackageRecord> listAllMeta() throws IOException;
}
