package com.gitdocs.importer.match;

import java.util.ArrayDeque;
import java.util.Deque;

/** Forward-slash path arithmetic, independent of the host file system. */
public final class PosixPaths {

  private PosixPaths() {}

  public static String join(String first, String second) {
    if (first == null || first.isEmpty()) {
      return normalize(second == null ? "" : second);
    }
    if (second == null || second.isEmpty()) {
      return normalize(first);
    }
    return normalize(first + "/" + second);
  }

  /**
   * Collapses {@code .}, {@code ..} and duplicate separators. A trailing separator survives, a
   * leading one marks the result absolute. Leading {@code ..} of a relative path are kept.
   */
  public static String normalize(String path) {
    if (path == null || path.isEmpty()) {
      return ".";
    }
    String unified = path.replace('\\', '/');
    boolean absolute = unified.startsWith("/");
    boolean trailing = unified.endsWith("/");
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : unified.split("/")) {
      if (segment.isEmpty() || ".".equals(segment)) {
        continue;
      }
      if ("..".equals(segment)) {
        if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
          segments.removeLast();
        } else if (!absolute) {
          segments.addLast(segment);
        }
        continue;
      }
      segments.addLast(segment);
    }
    String joined = String.join("/", segments);
    if (joined.isEmpty()) {
      return absolute ? "/" : (trailing ? "./" : ".");
    }
    StringBuilder result = new StringBuilder();
    if (absolute) {
      result.append('/');
    }
    result.append(joined);
    if (trailing) {
      result.append('/');
    }
    return result.toString();
  }

  public static String dirname(String path) {
    int slash = path.lastIndexOf('/');
    if (slash < 0) {
      return ".";
    }
    if (slash == 0) {
      return "/";
    }
    return path.substring(0, slash);
  }

  public static String basename(String path) {
    String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    int slash = trimmed.lastIndexOf('/');
    return slash < 0 ? trimmed : trimmed.substring(slash + 1);
  }

  /** Extension of the last segment including the dot, or an empty string. */
  public static String extension(String path) {
    String name = basename(path);
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot) : "";
  }

  public static String stripExtension(String path) {
    String ext = extension(path);
    return ext.isEmpty() ? path : path.substring(0, path.length() - ext.length());
  }

  /** Relative path from directory {@code fromDir} to {@code to}; both relative to the same root. */
  public static String relative(String fromDir, String to) {
    String[] from = segments(fromDir);
    String[] target = segments(to);
    int common = 0;
    while (common < from.length && common < target.length && from[common].equals(target[common])) {
      common++;
    }
    StringBuilder result = new StringBuilder();
    for (int i = common; i < from.length; i++) {
      result.append("../");
    }
    for (int i = common; i < target.length; i++) {
      result.append(target[i]);
      if (i < target.length - 1) {
        result.append('/');
      }
    }
    if (result.length() == 0) {
      return ".";
    }
    return result.charAt(0) == '.' ? result.toString() : "./" + result;
  }

  private static String[] segments(String path) {
    String normalized = normalize(path);
    if (".".equals(normalized) || "./".equals(normalized) || "/".equals(normalized)) {
      return new String[0];
    }
    String trimmed = normalized.startsWith("/") ? normalized.substring(1) : normalized;
    if (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed.split("/");
  }
}
