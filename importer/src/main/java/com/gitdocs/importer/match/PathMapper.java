package com.gitdocs.importer.match;

import java.util.Map;

/**
 * Computes where a matched remote file lands locally. Pure: the link resolver relies on getting
 * the same answer for the same entry every time.
 */
public final class PathMapper {

  private PathMapper() {}

  public static String targetPath(MatchedEntry entry) {
    if (!entry.hasRule()) {
      return PosixPaths.normalize(entry.remotePath());
    }
    String relative = relativePath(entry.remotePath(), entry.pattern());
    String renamed = applyRenames(entry.remotePath(), relative, entry.rule().renames());
    return PosixPaths.join(entry.basePath(), renamed);
  }

  /** Cross-run key of a remote file: its path without the extension of the last segment. */
  public static String stableId(String remotePath) {
    return PosixPaths.stripExtension(remotePath);
  }

  /** Remote path with the rule's literal directory prefix removed, or its basename. */
  public static String relativePath(String remotePath, String pattern) {
    String prefix = GlobPattern.literalPrefix(pattern);
    String relative = remotePath;
    if (!prefix.isEmpty() && remotePath.startsWith(prefix)) {
      relative = remotePath.substring(prefix.length());
    }
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return relative.isEmpty() ? PosixPaths.basename(remotePath) : relative;
  }

  /**
   * Exact-file keys win; otherwise the longest folder key (ending in {@code /}) that prefixes the
   * remote path swaps that prefix for its target and keeps the remainder.
   */
  public static String applyRenames(
      String remotePath, String relativePath, Map<String, String> renames) {
    if (renames == null || renames.isEmpty()) {
      return relativePath;
    }
    String exact = renames.get(remotePath);
    if (exact != null && !remotePath.endsWith("/")) {
      return stripLeadingSlash(exact);
    }
    String bestFolder = null;
    for (String key : renames.keySet()) {
      if (key.endsWith("/")
          && remotePath.startsWith(key)
          && (bestFolder == null || key.length() > bestFolder.length())) {
        bestFolder = key;
      }
    }
    if (bestFolder == null) {
      return relativePath;
    }
    String remainder = remotePath.substring(bestFolder.length());
    String target = renames.get(bestFolder);
    String joined = target == null || target.isEmpty() ? remainder : target + "/" + remainder;
    return stripLeadingSlash(PosixPaths.normalize(joined));
  }

  private static String stripLeadingSlash(String value) {
    String result = value;
    while (result.startsWith("/")) {
      result = result.substring(1);
    }
    return result;
  }
}
