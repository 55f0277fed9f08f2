package com.gitdocs.importer.source;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceValidatorTest {

  @TempDir Path projectRoot;

  private SourceValidator validator;

  @BeforeEach
  void setUp() {
    validator = new SourceValidator(new ProjectPaths(projectRoot));
  }

  @Test
  void acceptsWellFormedSource() {
    SourceDescriptor source =
        SourceDescriptor.builder("octo-org", "docs.site")
            .ref("release/1.x")
            .include(IncludeRule.of("docs/**/*.md", "src/content/docs"))
            .build();

    assertThatCode(() -> validator.validate(source)).doesNotThrowAnyException();
  }

  @Test
  void rejectsForbiddenOwnerCharacters() {
    SourceDescriptor source = SourceDescriptor.builder("bad owner", "repo").build();

    assertThatThrownBy(() -> validator.validate(source))
        .isInstanceOf(SourceConfigurationException.class)
        .hasMessageContaining("owner");
  }

  @Test
  void rejectsRefWithParentTraversal() {
    SourceDescriptor source = SourceDescriptor.builder("org", "repo").ref("a..b").build();

    assertThatThrownBy(() -> validator.validate(source))
        .isInstanceOf(SourceConfigurationException.class);
  }

  @Test
  void rejectsIncludeWithoutBasePath() {
    SourceDescriptor source =
        SourceDescriptor.builder("org", "repo").include(IncludeRule.of("docs/**", " ")).build();

    assertThatThrownBy(() -> validator.validate(source))
        .isInstanceOf(SourceConfigurationException.class)
        .hasMessageContaining("basePath");
  }

  @Test
  void rejectsBasePathEscapingProjectRoot() {
    SourceDescriptor source =
        SourceDescriptor.builder("org", "repo")
            .include(IncludeRule.of("docs/**", "../outside"))
            .build();

    assertThatThrownBy(() -> validator.validate(source))
        .isInstanceOf(SourceConfigurationException.class)
        .hasMessageContaining("outside the project root");
  }

  @Test
  void rejectsAbsoluteAssetsPath() {
    SourceDescriptor source =
        SourceDescriptor.builder("org", "repo")
            .assets(new AssetOptions("/var/assets", "/assets", null))
            .build();

    assertThatThrownBy(() -> validator.validate(source))
        .isInstanceOf(SourceConfigurationException.class)
        .hasMessageContaining("relative");
  }
}
