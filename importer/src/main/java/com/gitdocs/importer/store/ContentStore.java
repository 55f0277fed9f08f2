package com.gitdocs.importer.store;

/** Destination store owned by the host site. */
public interface ContentStore {

  ContentEntry get(String id);

  void set(ContentEntry entry);

  void delete(String id);

  void clear();
}
