package com.gitdocs.importer.remote;

/** Revalidation headers for a raw fetch. Both values null means an unconditional request. */
public record ConditionalRequest(String etag, String lastModified) {

  private static final ConditionalRequest NONE = new ConditionalRequest(null, null);

  public static ConditionalRequest none() {
    return NONE;
  }

  public boolean isConditional() {
    return etag != null || lastModified != null;
  }
}
