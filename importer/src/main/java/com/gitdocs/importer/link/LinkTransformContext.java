package com.gitdocs.importer.link;

import com.gitdocs.importer.match.MatchedEntry;

/**
 * Rule-level facts about the document a link appears in, used by mapping context filters.
 *
 * @param ruleIndex index of the matched include rule, {@code -1} when the source has no rules
 */
public record LinkTransformContext(
    String sourceName, String rulePattern, String basePath, int ruleIndex) {

  public static LinkTransformContext of(String sourceName, MatchedEntry entry) {
    if (entry == null || !entry.hasRule()) {
      return new LinkTransformContext(sourceName, null, "", -1);
    }
    return new LinkTransformContext(
        sourceName, entry.pattern(), entry.basePath(), entry.ruleIndex());
  }
}
