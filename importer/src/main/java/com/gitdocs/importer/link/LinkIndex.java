package com.gitdocs.importer.link;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Immutable source path to target path map of one batch. */
public final class LinkIndex {

  private static final List<String> INDEX_FILES = List.of("index.md", "index.mdx");

  private final Map<String, String> sourceToTarget;

  private LinkIndex(Map<String, String> sourceToTarget) {
    this.sourceToTarget = Collections.unmodifiableMap(sourceToTarget);
  }

  public static LinkIndex of(List<ImportedFile> files) {
    Map<String, String> map = new LinkedHashMap<>();
    for (ImportedFile file : files) {
      map.put(file.sourcePath(), file.targetPath());
    }
    return new LinkIndex(map);
  }

  /** Exact lookup; a path ending in {@code /} also tries its index documents. */
  public Optional<String> lookup(String sourcePath) {
    String target = sourceToTarget.get(sourcePath);
    if (target != null) {
      return Optional.of(target);
    }
    if (sourcePath.endsWith("/")) {
      for (String indexFile : INDEX_FILES) {
        target = sourceToTarget.get(sourcePath + indexFile);
        if (target != null) {
          return Optional.of(target);
        }
      }
    }
    return Optional.empty();
  }

  public int size() {
    return sourceToTarget.size();
  }
}
