package com.gitdocs.importer.asset;

import com.gitdocs.importer.match.PosixPaths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds relative image references in markdown and HTML markup. */
public final class AssetDetector {

  static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*\\]\\(([^)]+)\\)");
  static final Pattern HTML_IMAGE =
      Pattern.compile(
          "<img[^>]+src\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);

  private AssetDetector() {}

  /** Distinct references in order of first appearance, markdown images before HTML tags. */
  public static List<String> detect(String content, Collection<String> extensions) {
    Set<String> allowed = new LinkedHashSet<>();
    for (String extension : extensions) {
      allowed.add(extension.toLowerCase(Locale.ROOT));
    }
    Set<String> found = new LinkedHashSet<>();
    collect(MARKDOWN_IMAGE.matcher(content), allowed, found);
    collect(HTML_IMAGE.matcher(content), allowed, found);
    return new ArrayList<>(found);
  }

  public static boolean isExternal(String reference) {
    return reference.contains("://")
        || reference.startsWith("//")
        || reference.startsWith("/")
        || reference.regionMatches(true, 0, "data:", 0, 5);
  }

  /** The path part of a markdown image target, without an optional quoted title. */
  static String targetPath(String rawTarget) {
    String trimmed = rawTarget.trim();
    if (trimmed.startsWith("<") && trimmed.contains(">")) {
      return trimmed.substring(1, trimmed.indexOf('>'));
    }
    int space = indexOfWhitespace(trimmed);
    return space < 0 ? trimmed : trimmed.substring(0, space);
  }

  private static void collect(Matcher matcher, Set<String> allowed, Set<String> found) {
    while (matcher.find()) {
      String reference = targetPath(matcher.group(1));
      if (reference.isEmpty() || isExternal(reference)) {
        continue;
      }
      String extension = PosixPaths.extension(reference).toLowerCase(Locale.ROOT);
      if (allowed.contains(extension)) {
        found.add(reference);
      }
    }
  }

  private static int indexOfWhitespace(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
