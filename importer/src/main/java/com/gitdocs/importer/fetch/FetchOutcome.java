package com.gitdocs.importer.fetch;

/**
 * Content of one document after revalidation. {@code unchanged} means the remote answered "not
 * modified" and {@code content} is the existing local copy.
 */
public record FetchOutcome(String content, boolean unchanged, boolean refetched) {

  public static FetchOutcome fetched(String content) {
    return new FetchOutcome(content, false, false);
  }

  public static FetchOutcome refetched(String content) {
    return new FetchOutcome(content, false, true);
  }

  public static FetchOutcome unchanged(String localContent) {
    return new FetchOutcome(localContent, true, false);
  }
}
