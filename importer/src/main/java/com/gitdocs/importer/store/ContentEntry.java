package com.gitdocs.importer.store;

import java.util.Map;

/**
 * A document as the destination store holds it.
 *
 * @param data parsed frontmatter
 * @param filePath project-relative path of the written file
 * @param digest SHA-256 hex of the full document text
 * @param rendered pre-rendered output when the host provides one, otherwise {@code null}
 */
public record ContentEntry(
    String id,
    String body,
    Map<String, Object> data,
    String filePath,
    String digest,
    String rendered) {

  public ContentEntry {
    data = data == null ? Map.of() : data;
  }
}
