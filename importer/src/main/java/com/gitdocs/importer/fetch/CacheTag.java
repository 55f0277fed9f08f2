package com.gitdocs.importer.fetch;

import com.gitdocs.importer.remote.ConditionalRequest;

/**
 * Revalidation token of one document, stored under {@code {id}-etag} and {@code
 * {id}-last-modified}.
 */
public record CacheTag(String etag, String lastModified) {

  static String etagKey(String id) {
    return id + "-etag";
  }

  static String lastModifiedKey(String id) {
    return id + "-last-modified";
  }

  public static CacheTag read(MetaStore store, String id) {
    return new CacheTag(store.get(etagKey(id)), store.get(lastModifiedKey(id)));
  }

  /** Replaces any stored tag; only the etag is kept when both validators are present. */
  public static void replace(MetaStore store, String id, String etag, String lastModified) {
    clear(store, id);
    if (etag != null && !etag.isBlank()) {
      store.set(etagKey(id), etag);
    } else if (lastModified != null && !lastModified.isBlank()) {
      store.set(lastModifiedKey(id), lastModified);
    }
  }

  public static void clear(MetaStore store, String id) {
    store.delete(etagKey(id));
    store.delete(lastModifiedKey(id));
  }

  public boolean isEmpty() {
    return etag == null && lastModified == null;
  }

  public ConditionalRequest toRequest() {
    if (etag != null) {
      return new ConditionalRequest(etag, null);
    }
    return new ConditionalRequest(null, lastModified);
  }
}
