package com.onthegomap.tilestash.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** A {@link KeyValueStore} that keeps values on the heap and forgets them when the process exits. */
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Map<String, String> values = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void put(String key, String json) {
    values.put(key, json);
  }

  @Override
  public void remove(String key) {
    values.remove(key);
  }

  public Map<String, String> asMap() {
    return Map.copyOf(values);
  }
}
