package com.gitdocs.importer.link;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites link paths that contain a literal or match a regular expression. Global mappings run
 * before the index lookup; the others only for links the lookup did not resolve.
 */
public final class LinkMapping {

  private final String literal;
  private final Pattern pattern;
  private final String replacement;
  private final LinkReplacement function;
  private final boolean global;
  private final Predicate<LinkTransformContext> contextFilter;
  private final String description;

  private LinkMapping(
      String literal,
      Pattern pattern,
      String replacement,
      LinkReplacement function,
      boolean global,
      Predicate<LinkTransformContext> contextFilter,
      String description) {
    this.literal = literal;
    this.pattern = pattern;
    this.replacement = replacement;
    this.function = function;
    this.global = global;
    this.contextFilter = contextFilter;
    this.description = description;
  }

  /** Replaces the first occurrence of {@code text}. */
  public static LinkMapping literal(String text, String replacement) {
    Objects.requireNonNull(text, "text");
    return new LinkMapping(text, null, nullToEmpty(replacement), null, false, null, null);
  }

  /** Replaces the first match; {@code $n} in the replacement refers to capture groups. */
  public static LinkMapping regex(Pattern pattern, String replacement) {
    Objects.requireNonNull(pattern, "pattern");
    return new LinkMapping(null, pattern, nullToEmpty(replacement), null, false, null, null);
  }

  public static LinkMapping regex(Pattern pattern, LinkReplacement replacement) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(replacement, "replacement");
    return new LinkMapping(null, pattern, null, replacement, false, null, null);
  }

  public LinkMapping asGlobal() {
    return new LinkMapping(
        literal, pattern, replacement, function, true, contextFilter, description);
  }

  public LinkMapping withContextFilter(Predicate<LinkTransformContext> filter) {
    return new LinkMapping(literal, pattern, replacement, function, global, filter, description);
  }

  public LinkMapping withDescription(String text) {
    return new LinkMapping(literal, pattern, replacement, function, global, contextFilter, text);
  }

  public boolean global() {
    return global;
  }

  public String description() {
    return description;
  }

  /**
   * Stable text naming what this mapping rewrites and how. Function replacements and context
   * filters are identified by their description, or by class when none is set.
   */
  public String fingerprint() {
    StringBuilder text = new StringBuilder(toString());
    text.append(" -> ");
    text.append(function != null ? function.getClass().getName() : "'" + replacement + "'");
    if (contextFilter != null) {
      text.append(" when ").append(contextFilter.getClass().getName());
    }
    if (description != null) {
      text.append(" (").append(description).append(')');
    }
    return text.toString();
  }

  boolean appliesTo(ImportedFile file) {
    return contextFilter == null
        || file.linkContext() == null
        || contextFilter.test(file.linkContext());
  }

  /** The rewritten path, or empty when this mapping does not match {@code path}. */
  Optional<String> apply(String path, String anchor, LinkContext context) {
    if (literal != null) {
      if (!path.contains(literal)) {
        return Optional.empty();
      }
      if (function != null) {
        return Optional.of(function.replace(path, anchor, context));
      }
      return Optional.of(
          path.replaceFirst(Pattern.quote(literal), Matcher.quoteReplacement(replacement)));
    }
    Matcher matcher = pattern.matcher(path);
    if (!matcher.find()) {
      return Optional.empty();
    }
    if (function != null) {
      return Optional.of(function.replace(path, anchor, context));
    }
    return Optional.of(matcher.replaceFirst(replacement));
  }

  @Override
  public String toString() {
    String source = literal != null ? "'" + literal + "'" : "/" + pattern.pattern() + "/";
    return "LinkMapping[" + source + (global ? ", global" : "") + "]";
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
