package com.gitdocs.importer.fetch;

/** String key-value side store holding revalidation tags. */
public interface MetaStore {

  String get(String key);

  void set(String key, String value);

  void delete(String key);

  /** Persists pending changes; a no-op for stores that are not backed by a file. */
  default void flush() {}
}
