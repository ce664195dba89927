package com.onthegomap.tilestash.net;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Connectivity} whose state is set by the host through {@link #setOnline(boolean)}.
 */
public class ManualConnectivity implements Connectivity {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManualConnectivity.class);

  private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
  private volatile boolean online;

  public ManualConnectivity(boolean online) {
    this.online = online;
  }

  @Override
  public boolean isOnline() {
    return online;
  }

  @Override
  public void addListener(Consumer<Boolean> listener) {
    listeners.add(listener);
  }

  @Override
  public void removeListener(Consumer<Boolean> listener) {
    listeners.remove(listener);
  }

  /** Updates the state and notifies listeners if it changed. */
  public void setOnline(boolean value) {
    boolean changed = online != value;
    online = value;
    if (changed) {
      LOGGER.info("Connectivity changed: {}", value ? "online" : "offline");
      for (var listener : listeners) {
        try {
          listener.accept(value);
        } catch (RuntimeException e) {
          LOGGER.warn("Connectivity listener failed", e);
        }
      }
    }
  }
}
