package com.gitdocs.importer.link;

import java.util.Locale;

/** GitHub-style slugs: lower case, punctuation and symbols dropped, spaces turned into hyphens. */
public final class Slugger {

  private Slugger() {}

  public static String slug(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    String lower = value.toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length());
    lower
        .codePoints()
        .forEach(
            codePoint -> {
              if (codePoint == ' ') {
                result.append('-');
              } else if (isKept(codePoint)) {
                result.appendCodePoint(codePoint);
              }
            });
    return result.toString();
  }

  private static boolean isKept(int codePoint) {
    if (codePoint == '-' || Character.isLetterOrDigit(codePoint)) {
      return true;
    }
    int type = Character.getType(codePoint);
    return type == Character.NON_SPACING_MARK
        || type == Character.COMBINING_SPACING_MARK
        || type == Character.ENCLOSING_MARK
        || type == Character.CONNECTOR_PUNCTUATION;
  }
}
