package com.onthegomap.tilestash.net;

import java.util.function.Consumer;

/**
 * Whether the host currently has a network connection, and notifications when that changes.
 */
public interface Connectivity {

  boolean isOnline();

  /** Registers {@code listener} to receive the new state after each transition. */
  void addListener(Consumer<Boolean> listener);

  /** Stops notifying {@code listener}; does nothing if it was never registered. */
  void removeListener(Consumer<Boolean> listener);

  /** Returns a connectivity that is always online, for command-line use. */
  static Connectivity alwaysOnline() {
    return new ManualConnectivity(true);
  }
}
