package com.onthegomap.tilestash.packaged;

import com.onthegomap.tilestash.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link PackageRegistry} backed by a directory of {@code .mbtiles} files and a {@code packages.json} index:
 *
 * <pre>{@code
 * {"packages": [{"id": "enrc-low-1", "chartId": "LOW", "status": "complete", "totalSize": 1234,
 *   "fileName": "enrc-low-1.mbtiles"}]}
 * }</pre>
 * <p>
 * The index is read on every call so packages added while the process runs are picked up.
 */
public class DirectoryPackageRegistry implements PackageRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryPackageRegistry.class);
  public static final String INDEX_FILE = "packages.json";

  record Index(List<PackageRecord> packages) {

    Index {
      packages = packages == null ? List.of() : List.copyOf(packages);
    }
  }

  private final Path directory;

  public DirectoryPackageRegistry(Path directory) {
    this.directory = directory;
  }

  @Override
  public Optional<Path> getFile(String fileId) throws IOException {
    Optional<PackageRecord> meta = getMeta(fileId);
    if (meta.isEmpty() || meta.get().fileName() == null) {
      return Optional.empty();
    }
    Path path = directory.resolve(meta.get().fileName()).normalize();
    if (!path.startsWith(directory.normalize())) {
      LOGGER.warn("Ignoring package {} outside of {}", path, directory);
      return Optional.empty();
    }
    return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
  }

  @Override
  public Optional<PackageRecord> getMeta(String fileId) throws IOException {
    return listAllMeta().stream().filter(record -> record.id().equals(fileId)).findFirst();
  }

  @Override
  public List<PackageRecord> listAllMeta() throws IOException {
    Path index = directory.resolve(INDEX_FILE);
    if (!Files.exists(index)) {
      return List.of();
    }
    return JsonUtils.mapper().readValue(index.toFile(), Index.class).packages();
  }
}
