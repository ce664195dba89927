package com.onthegomap.tilestash.store;

import com.onthegomap.tilestash.util.FileUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A {@link KeyValueStore} that writes each value to {@code <key>.json} in a directory.
 * <p>
 * Values are written to a temporary file first and moved into place so a crash mid-write never leaves a truncated
 * document behind.
 */
public class FileKeyValueStore implements KeyValueStore {

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");

  private final Path directory;

  public FileKeyValueStore(Path directory) {
    this.directory = directory;
    FileUtils.createDirectory(directory);
  }

  private Path pathFor(String key) {
    return directory.resolve(UNSAFE_CHARS.matcher(key).replaceAll("_") + ".json");
  }

  @Override
  public Optional<String> get(String key) throws IOException {
    try {
      return Optional.of(Files.readString(pathFor(key), StandardCharsets.UTF_8));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, String json) throws IOException {
    Path path = pathFor(key);
    Path tmp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
    try {
      Files.writeString(tmp, json, StandardCharsets.UTF_8);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  @Override
  public void remove(String key) throws IOException {
    Files.deleteIfExists(pathFor(key));
  }
}
