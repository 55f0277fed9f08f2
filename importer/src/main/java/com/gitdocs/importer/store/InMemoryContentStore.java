package com.gitdocs.importer.store;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryContentStore implements ContentStore {

  private final Map<String, ContentEntry> entries = new ConcurrentHashMap<>();
  private final AtomicLong mutations = new AtomicLong();

  @Override
  public ContentEntry get(String id) {
    return entries.get(id);
  }

  @Override
  public void set(ContentEntry entry) {
    Objects.requireNonNull(entry, "entry");
    entries.put(entry.id(), entry);
    mutations.incrementAndGet();
  }

  @Override
  public void delete(String id) {
    if (entries.remove(id) != null) {
      mutations.incrementAndGet();
    }
  }

  @Override
  public void clear() {
    entries.clear();
    mutations.incrementAndGet();
  }

  public int size() {
    return entries.size();
  }

  /** Number of {@code set}, effective {@code delete} and {@code clear} calls so far. */
  public long mutationCount() {
    return mutations.get();
  }
}
