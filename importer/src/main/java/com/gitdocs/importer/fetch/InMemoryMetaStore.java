package com.gitdocs.importer.fetch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryMetaStore implements MetaStore {

  private final Map<String, String> values = new ConcurrentHashMap<>();

  @Override
  public String get(String key) {
    return values.get(key);
  }

  @Override
  public void set(String key, String value) {
    if (value == null) {
      values.remove(key);
    } else {
      values.put(key, value);
    }
  }

  @Override
  public void delete(String key) {
    values.remove(key);
  }

  public Map<String, String> snapshot() {
    return Map.copyOf(values);
  }
}
