package com.gitdocs.importer.match;

import com.gitdocs.importer.source.IncludeRule;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** First-match-wins selection of the include rule for a remote path. */
public class PatternMatcher {

  private final Map<String, GlobPattern> compiled = new ConcurrentHashMap<>();

  public Optional<MatchedEntry> match(String remotePath, List<IncludeRule> includes) {
    if (includes == null || includes.isEmpty()) {
      return Optional.of(MatchedEntry.unruled(remotePath));
    }
    for (int i = 0; i < includes.size(); i++) {
      IncludeRule rule = includes.get(i);
      if (compiled.computeIfAbsent(rule.pattern(), GlobPattern::compile).matches(remotePath)) {
        return Optional.of(new MatchedEntry(remotePath, i, rule));
      }
    }
    return Optional.empty();
  }
}
