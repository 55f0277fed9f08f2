package com.gitdocs.importer.source;

import com.gitdocs.importer.transform.ContentTransform;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A glob pattern paired with the local directory its matches are imported into.
 *
 * <p>Rename keys ending in {@code /} are folder mappings and rewrite the part of the path beneath
 * that folder; all other keys are exact-file mappings. Insertion order of {@code renames} is kept.
 */
public record IncludeRule(
    String pattern,
    String basePath,
    Map<String, String> renames,
    List<ContentTransform> transforms) {

  public IncludeRule {
    renames =
        renames == null || renames.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(renames));
    transforms = transforms == null ? List.of() : List.copyOf(transforms);
  }

  public static IncludeRule of(String pattern, String basePath) {
    return new IncludeRule(pattern, basePath, Map.of(), List.of());
  }

  public IncludeRule withRenames(Map<String, String> renames) {
    return new IncludeRule(pattern, basePath, renames, transforms);
  }

  public IncludeRule withTransforms(List<ContentTransform> transforms) {
    return new IncludeRule(pattern, basePath, renames, transforms);
  }
}
