package com.gitdocs.importer.match;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled include glob. Supports {@code *}, {@code **}, {@code ?}, nested brace alternation and
 * character classes; matching is case-sensitive against the whole path.
 */
public final class GlobPattern {

  private final String glob;
  private final Pattern regex;

  private GlobPattern(String glob, Pattern regex) {
    this.glob = glob;
    this.regex = regex;
  }

  public static GlobPattern compile(String glob) {
    Objects.requireNonNull(glob, "glob");
    try {
      return new GlobPattern(glob, Pattern.compile(globToRegex(glob)));
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Invalid glob pattern '%s'".formatted(glob), ex);
    }
  }

  public String glob() {
    return glob;
  }

  public boolean matches(String path) {
    return path != null && regex.matcher(path).matches();
  }

  /**
   * The literal leading directory of {@code glob}: everything before the first wildcard, cut back
   * to the last separator. {@code docs/api/**}{@code /*.md} gives {@code docs/api/}.
   */
  public static String literalPrefix(String glob) {
    int end = glob.length();
    for (int i = 0; i < glob.length(); i++) {
      char ch = glob.charAt(i);
      if (ch == '*' || ch == '?' || ch == '{' || ch == '[') {
        end = i;
        break;
      }
    }
    String literal = glob.substring(0, end);
    int slash = literal.lastIndexOf('/');
    return slash < 0 ? "" : literal.substring(0, slash + 1);
  }

  static String globToRegex(String glob) {
    StringBuilder regex = new StringBuilder("^");
    int braceDepth = 0;
    for (int i = 0; i < glob.length(); i++) {
      char ch = glob.charAt(i);
      switch (ch) {
        case '*':
          if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
            boolean segmentStart =
                i == 0 || glob.charAt(i - 1) == '/' || isBraceBoundary(glob, i - 1);
            boolean followedBySlash = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
            if (segmentStart && followedBySlash) {
              // "**/" also matches zero directories
              regex.append("(?:[^/]*/)*");
              i += 2;
            } else {
              regex.append(".*");
              i++;
            }
          } else {
            regex.append("[^/]*");
          }
          break;
        case '?':
          regex.append("[^/]");
          break;
        case '[':
          int close = findClassEnd(glob, i);
          if (close < 0) {
            regex.append("\\[");
          } else {
            regex.append(toCharacterClass(glob.substring(i + 1, close)));
            i = close;
          }
          break;
        case '{':
          braceDepth++;
          regex.append("(?:");
          break;
        case '}':
          if (braceDepth > 0) {
            braceDepth--;
            regex.append(')');
          } else {
            regex.append("\\}");
          }
          break;
        case ',':
          regex.append(braceDepth > 0 ? "|" : ",");
          break;
        case '\\':
          if (i + 1 < glob.length()) {
            regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
          }
          break;
        case '/':
          regex.append('/');
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(ch)));
      }
    }
    if (braceDepth != 0) {
      throw new IllegalArgumentException("Unbalanced braces in glob '%s'".formatted(glob));
    }
    regex.append('$');
    return regex.toString();
  }

  private static boolean isBraceBoundary(String glob, int index) {
    char ch = glob.charAt(index);
    return ch == '{' || ch == ',';
  }

  private static int findClassEnd(String glob, int open) {
    int i = open + 1;
    if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) {
      i++;
    }
    if (i < glob.length() && glob.charAt(i) == ']') {
      i++;
    }
    for (; i < glob.length(); i++) {
      if (glob.charAt(i) == ']') {
        return i;
      }
    }
    return -1;
  }

  private static String toCharacterClass(String body) {
    StringBuilder cls = new StringBuilder("[");
    int start = 0;
    if (!body.isEmpty() && (body.charAt(0) == '!' || body.charAt(0) == '^')) {
      cls.append('^');
      start = 1;
    }
    for (int i = start; i < body.length(); i++) {
      char ch = body.charAt(i);
      if (ch == '-' && i > start && i < body.length() - 1) {
        cls.append('-');
      } else if (Character.isLetterOrDigit(ch)) {
        cls.append(ch);
      } else {
        cls.append('\\').append(ch);
      }
    }
    return cls.append(']').toString();
  }

  @Override
  public String toString() {
    return glob;
  }
}
