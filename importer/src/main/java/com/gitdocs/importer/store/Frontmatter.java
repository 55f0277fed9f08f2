package com.gitdocs.importer.store;

import java.util.Map;

/**
 * A document split at its leading YAML block.
 *
 * @param data parsed YAML, empty when there is no block or it does not parse
 * @param body content after the closing delimiter
 * @param frontmatterBlock the raw block including both delimiters, or an empty string
 */
public record Frontmatter(Map<String, Object> data, String body, String frontmatterBlock) {

  public Frontmatter {
    data = data == null ? Map.of() : data;
  }

  public boolean present() {
    return !frontmatterBlock.isEmpty();
  }
}
