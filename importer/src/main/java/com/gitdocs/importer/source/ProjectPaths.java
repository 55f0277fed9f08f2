package com.gitdocs.importer.source;

import java.nio.file.Path;
import java.util.Objects;
import org.springframework.util.StringUtils;

/** Resolves configured relative locations against the project root and refuses any escape. */
public final class ProjectPaths {

  private final Path root;

  public ProjectPaths(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  public Path resolve(String relative) {
    if (!StringUtils.hasText(relative)) {
      throw new SourceConfigurationException("Path must not be blank");
    }
    String normalized = relative.trim().replace('\\', '/');
    if (normalized.startsWith("/") || Path.of(normalized).isAbsolute()) {
      throw new SourceConfigurationException(
          "Path '%s' must be relative to the project root".formatted(relative));
    }
    Path resolved = root.resolve(normalized).normalize();
    if (!resolved.startsWith(root)) {
      throw new SourceConfigurationException(
          "Path '%s' resolves outside the project root".formatted(relative));
    }
    return resolved;
  }

  public Path requireWithinRoot(Path candidate) {
    Path normalized = candidate.toAbsolutePath().normalize();
    if (!normalized.startsWith(root)) {
      throw new SourceConfigurationException(
          "Path '%s' resolves outside the project root".formatted(candidate));
    }
    return normalized;
  }

  /** Project-relative form of {@code path} with forward slashes. */
  public String relativize(Path path) {
    return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
  }
}
