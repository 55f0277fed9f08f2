package com.gitdocs.importer.match;

import static org.assertj.core.api.Assertions.assertThat;

import com.gitdocs.importer.source.IncludeRule;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PatternMatcherTest {

  private final PatternMatcher matcher = new PatternMatcher();

  @Test
  void firstMatchingRuleWins() {
    List<IncludeRule> rules =
        List.of(IncludeRule.of("docs/api/**", "out/api"), IncludeRule.of("docs/**", "out/docs"));

    Optional<MatchedEntry> entry = matcher.match("docs/api/auth.md", rules);

    assertThat(entry).isPresent();
    assertThat(entry.get().ruleIndex()).isZero();
    assertThat(entry.get().basePath()).isEqualTo("out/api");
  }

  @Test
  void noRulesImportsEverythingWithoutRule() {
    Optional<MatchedEntry> entry = matcher.match("anything/at/all.txt", List.of());

    assertThat(entry).isPresent();
    assertThat(entry.get().hasRule()).isFalse();
    assertThat(entry.get().ruleIndex()).isEqualTo(-1);
  }

  @Test
  void pathOutsideEveryRuleIsRejected() {
    assertThat(matcher.match("src/Main.java", List.of(IncludeRule.of("docs/**/*.md", "out"))))
        .isEmpty();
  }
}
