package com.onthegomap.tilestash;

import static java.util.Map.entry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry-point for the executable jar, which delegates to the command-line tasks in {@link Tasks}.
 */
public class Main {

  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("download", Tasks::download),
    entry("status", Tasks::status),
    entry("layers", Tasks::layers),
    entry("cache-info", Tasks::cacheInfo),
    entry("clear-cache", Tasks::clearCache),
    entry("package-info", Tasks::packageInfo),
    entry("package-tile", Tasks::packageTile)
  );

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      System.err.println("Usage: tilestash <task> [--key=value ...]");
      System.err.println("possibilities: " + ENTRY_POINTS.keySet());
      System.exit(1);
    }
    String maybeTask = args[0].trim().toLowerCase(Locale.ROOT);
    EntryPoint task = ENTRY_POINTS.get(maybeTask);
    if (task == null) {
      System.err.println("Unrecognized task: " + maybeTask);
      System.err.println("possibilities: " + ENTRY_POINTS.keySet());
      System.exit(1);
    }
    int status = task.main(Arrays.copyOfRange(args, 1, args.length));
    System.exit(status);
  }

  @FunctionalInterface
  private interface EntryPoint {

    int main(String[] args) throws Exception;
  }
}
