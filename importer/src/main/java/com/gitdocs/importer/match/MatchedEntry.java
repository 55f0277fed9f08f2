package com.gitdocs.importer.match;

import com.gitdocs.importer.source.IncludeRule;

/**
 * A remote file accepted by the include rules. {@code rule} is {@code null} and {@code ruleIndex}
 * is {@code -1} when the source has no rules and imports everything.
 */
public record MatchedEntry(String remotePath, int ruleIndex, IncludeRule rule) {

  public static MatchedEntry unruled(String remotePath) {
    return new MatchedEntry(remotePath, -1, null);
  }

  public boolean hasRule() {
    return rule != null;
  }

  public String basePath() {
    return rule == null ? "" : rule.basePath();
  }

  public String pattern() {
    return rule == null ? null : rule.pattern();
  }
}
