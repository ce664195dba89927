package com.onthegomap.tilestash.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.onthegomap.tilestash.config.TilestashConfig;
import com.onthegomap.tilestash.download.BulkDownloadEngine;
import com.onthegomap.tilestash.download.DownloadStats;
import com.onthegomap.tilestash.layers.LayerKind;
import com.onthegomap.tilestash.net.Connectivity;
import com.onthegomap.tilestash.store.KeyValueStore;
import com.onthegomap.tilestash.util.JsonUtils;
import com.onthegomap.tilestash.util.NamedThreadFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalogue of bulk downloads: starts them on the {@link BulkDownloadEngine}, tracks their state, publishes every
 * change to subscribers, and persists the running ones so an interrupted process can tell the user on restart.
 * <p>
 * Construct one instance, call {@link #initialize()} before use, and {@link #close()} on shutdown. State is guarded by
 * this instance's monitor; listeners are always called outside of it with a snapshot.
 */
@ThreadSafe
public class DownloadTaskRegistry implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadTaskRegistry.class);
  static final String TASKS_KEY = "download_tasks";
  private static final TypeReference<LinkedHashMap<String, DownloadTask>> TASKS_TYPE = new TypeReference<>() {};

  private final BulkDownloadEngine engine;
  private final KeyValueStore store;
  private final Connectivity connectivity;
  private final Messages messages;
  private final Duration errorDisplay;
  private final Clock clock;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  private final Map<String, DownloadTask> tasks = new LinkedHashMap<>();
  private final Set<String> active = new HashSet<>();
  private final List<DownloadListener> listeners = new ArrayList<>();
  private final Consumer<Boolean> connectivityListener = online -> {
    if (!isClosed()) {
      notifyListeners();
    }
  };
  private boolean initialized = false;
  private boolean closed = false;

  public DownloadTaskRegistry(TilestashConfig config, BulkDownloadEngine engine, KeyValueStore store,
    Connectivity connectivity, Clock clock) {
    this(engine, store, connectivity, Messages.forLocale(config.locale()), config.errorDisplay(), clock,
      Executors.newCachedThreadPool(new NamedThreadFactory("download")), true);
  }

  DownloadTaskRegistry(BulkDownloadEngine engine, KeyValueStore store, Connectivity connectivity, Messages messages,
    Duration errorDisplay, Clock clock, ExecutorService executor, boolean ownsExecutor) {
    this.engine = engine;
    this.store = store;
    this.connectivity = connectivity;
    this.messages = messages;
    this.errorDisplay = errorDisplay;
    this.clock = clock;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
  }

  /**
   * Restores persisted tasks. Tasks that were downloading when the previous process stopped become errors asking the
   * user to retry; their tile checkpoints are kept so a retry skips finished tiles.
   */
  public void initialize() {
    synchronized (this) {
      if (initialized) {
        return;
      }
      initialized = true;
      for (DownloadTask task : loadPersisted().values()) {
        if (task.status() == TaskStatus.DOWNLOADING) {
          LOGGER.info("Download of {} was interrupted", task.id());
          task = task.failed(messages.interrupted());
        }
        tasks.put(task.id(), task);
      }
    }
    connectivity.addListener(connectivityListener);
    notifyListeners();
  }

  private Map<String, DownloadTask> loadPersisted() {
    try {
      Optional<String> json = store.get(TASKS_KEY);
      if (json.isPresent()) {
        return JsonUtils.mapper().readValue(json.get(), TASKS_TYPE);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to restore download tasks: {}", e.toString());
    }
    return Map.of();
  }

  /**
   * Starts downloading layer {@code name} of {@code kind} unless it is already running.
   *
   * @return a future completing with whether the layer is now available offline; false immediately when offline
   */
  public CompletableFuture<Boolean> start(String name, LayerKind kind) {
    String id = kind.layerId(name);
    DownloadTask task;
    synchronized (this) {
      if (closed) {
        throw new IllegalStateException("Registry is closed");
      }
      if (active.contains(id)) {
        LOGGER.debug("Download of {} already running", id);
        return CompletableFuture.completedFuture(true);
      } else if (!connectivity.isOnline()) {
        LOGGER.warn("Cannot start download of {}: offline", id);
        task = DownloadTask.failedToStart(id, kind, messages.noConnection());
        tasks.put(id, task);
      } else {
        task = DownloadTask.started(id, kind, clock.millis());
        tasks.put(id, task);
        active.add(id);
        persist();
      }
    }
    notifyListeners();
    if (task.status() == TaskStatus.ERROR) {
      DownloadTask shown = task;
      CompletableFuture.delayedExecutor(errorDisplay.toMillis(), TimeUnit.MILLISECONDS)
        .execute(() -> removeIfUnchanged(shown));
      return CompletableFuture.completedFuture(false);
    }
    try {
      return CompletableFuture.supplyAsync(() -> run(id), executor);
    } catch (RejectedExecutionException e) {
      fail(id, messages.downloadFailed());
      return CompletableFuture.completedFuture(false);
    }
  }

  private boolean run(String id) {
    LOGGER.info("Starting download of {}", id);
    try {
      boolean success = engine.download(id, (percent, stats) -> updateProgress(id, percent, stats));
      if (success) {
        complete(id);
      } else {
        fail(id, messages.downloadFailed());
      }
      return success;
    } catch (RuntimeException e) {
      LOGGER.error("Download of {} failed", id, e);
      fail(id, e.getMessage() != null ? e.getMessage() : messages.unknownError());
      return false;
    }
  }

  private void removeIfUnchanged(DownloadTask shown) {
    boolean removed;
    synchronized (this) {
      removed = tasks.get(shown.id()) == shown && tasks.remove(shown.id()) != null;
    }
    if (removed) {
      notifyListeners();
    }
  }

  private void updateProgress(String id, int percent, DownloadStats stats) {
    synchronized (this) {
      DownloadTask task = tasks.get(id);
      if (task == null || task.status() != TaskStatus.DOWNLOADING) {
        return;
      }
      tasks.put(id, task.withProgress(percent, stats));
      persist();
    }
    notifyListeners();
  }

  private void complete(String id) {
    synchronized (this) {
      DownloadTask task = tasks.get(id);
      if (task != null) {
        tasks.put(id, task.completed(clock.millis()));
      }
      active.remove(id);
      persist();
    }
    LOGGER.info("Download of {} complete", id);
    notifyListeners();
  }

  private void fail(String id, String message) {
    synchronized (this) {
      DownloadTask task = tasks.get(id);
      if (task != null) {
        tasks.put(id, task.failed(message));
      }
      active.remove(id);
      persist();
    }
    LOGGER.warn("Download of {} failed: {}", id, message);
    notifyListeners();
  }

  /** Removes the task with {@code id}, whatever its state. */
  public void clear(String id) {
    synchronized (this) {
      tasks.remove(id);
      persist();
    }
    notifyListeners();
  }

  /** Returns the progress of {@code id} while it is pending or downloading. */
  public synchronized OptionalInt progress(String id) {
    DownloadTask task = tasks.get(id);
    return task != null && task.status().isActive() ? OptionalInt.of(task.progress()) : OptionalInt.empty();
  }

  /** Returns true while a download of {@code id} is running. */
  public synchronized boolean isActive(String id) {
    return active.contains(id);
  }

  public synchronized Map<String, DownloadTask> tasks() {
    return Map.copyOf(tasks);
  }

  public synchronized Optional<DownloadTask> task(String id) {
    return Optional.ofNullable(tasks.get(id));
  }

  /**
   * Registers {@code listener} and immediately calls it with the current tasks.
   *
   * @return a handle that unsubscribes when closed
   */
  public Subscription subscribe(DownloadListener listener) {
    Map<String, DownloadTask> snapshot;
    synchronized (this) {
      listeners.add(listener);
      snapshot = snapshot();
    }
    call(listener, snapshot);
    return () -> {
      synchronized (this) {
        listeners.remove(listener);
      }
    };
  }

  private Map<String, DownloadTask> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
  }

  private void notifyListeners() {
    List<DownloadListener> toNotify;
    Map<String, DownloadTask> snapshot;
    synchronized (this) {
      toNotify = List.copyOf(listeners);
      snapshot = snapshot();
    }
    for (DownloadListener listener : toNotify) {
      call(listener, snapshot);
    }
  }

  private static void call(DownloadListener listener, Map<String, DownloadTask> snapshot) {
    try {
      listener.onTasksChanged(snapshot);
    } catch (RuntimeException e) {
      LOGGER.warn("Download listener failed", e);
    }
  }

  /** Writes pending and downloading tasks to the store; must hold the monitor. */
  private void persist() {
    Map<String, DownloadTask> running = new LinkedHashMap<>();
    for (DownloadTask task : tasks.values()) {
      if (task.status().isActive()) {
        running.put(task.id(), task);
      }
    }
    try {
      store.put(TASKS_KEY, JsonUtils.mapper().writeValueAsString(running));
    } catch (IOException e) {
      LOGGER.warn("Failed to save download tasks: {}", e.toString());
    }
  }

  private synchronized boolean isClosed() {
    return closed;
  }

  /** Stops accepting downloads. Running downloads are abandoned; their checkpoints let a later run resume. */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      listeners.clear();
    }
    connectivity.removeListener(connectivityListener);
    if (ownsExecutor) {
      executor.shutdownNow();
    }
  }
}
