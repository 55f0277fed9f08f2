package com.gitdocs.importer.source;

import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Checks identity strings and local directories of a source. Everything here runs before the
 * first network call, so a failure never leaves partial output behind.
 */
public class SourceValidator {

  private static final Pattern IDENTITY_PATTERN = Pattern.compile("[A-Za-z0-9_.-]{1,100}");
  private static final Pattern REF_PATTERN = Pattern.compile("[A-Za-z0-9_./-]{1,255}");

  private final ProjectPaths projectPaths;

  public SourceValidator(ProjectPaths projectPaths) {
    this.projectPaths = Objects.requireNonNull(projectPaths, "projectPaths");
  }

  public void validate(SourceDescriptor source) {
    Objects.requireNonNull(source, "source");
    validateIdentity("owner", source.owner());
    validateIdentity("repo", source.repo());
    validateRef(source.ref());

    for (int i = 0; i < source.includes().size(); i++) {
      IncludeRule rule = source.includes().get(i);
      if (!StringUtils.hasText(rule.pattern())) {
        throw new SourceConfigurationException(
            "Include #%d of %s has no pattern".formatted(i, source.displayName()));
      }
      if (!StringUtils.hasText(rule.basePath())) {
        throw new SourceConfigurationException(
            "Include #%d of %s has no basePath".formatted(i, source.displayName()));
      }
      projectPaths.resolve(rule.basePath());
    }
    if (StringUtils.hasText(source.assets().assetsPath())) {
      projectPaths.resolve(source.assets().assetsPath());
    }
  }

  private void validateIdentity(String field, String value) {
    if (!StringUtils.hasText(value)) {
      throw new SourceConfigurationException("Repository " + field + " must be provided");
    }
    if (!IDENTITY_PATTERN.matcher(value).matches() || ".".equals(value) || "..".equals(value)) {
      throw new SourceConfigurationException(
          "Repository %s '%s' contains forbidden characters".formatted(field, value));
    }
  }

  private void validateRef(String ref) {
    if (!REF_PATTERN.matcher(ref).matches()) {
      throw new SourceConfigurationException(
          "Ref '%s' contains forbidden characters".formatted(ref));
    }
    if (ref.contains("..") || ref.contains("//") || ref.startsWith("/") || ref.endsWith("/")) {
      throw new SourceConfigurationException(
          "Ref '%s' must not contain '..', empty components or edge slashes".formatted(ref));
    }
  }
}
