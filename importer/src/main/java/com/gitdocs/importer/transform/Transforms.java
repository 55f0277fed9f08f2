package com.gitdocs.importer.transform;

import com.gitdocs.importer.store.Frontmatter;
import com.gitdocs.importer.store.FrontmatterParser;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Ready-made transforms for common documentation clean-ups. */
public final class Transforms {

  private static final Pattern FIRST_H1 = Pattern.compile("(?m)^#\\s+(.+)$");

  private Transforms() {}

  /** Runs {@code transform} only for documents whose remote path satisfies the predicate. */
  public static ContentTransform conditional(
      Predicate<String> pathPredicate, ContentTransform transform) {
    Objects.requireNonNull(pathPredicate, "pathPredicate");
    Objects.requireNonNull(transform, "transform");
    return (content, context) ->
        pathPredicate.test(context.path()) ? transform.apply(content, context) : content;
  }

  public static ContentTransform replace(String from, String to) {
    Objects.requireNonNull(from, "from");
    return (content, context) -> content.replace(from, to == null ? "" : to);
  }

  public static ContentTransform regexReplace(Pattern pattern, String replacement) {
    Objects.requireNonNull(pattern, "pattern");
    return (content, context) -> pattern.matcher(content).replaceAll(replacement);
  }

  public static ContentTransform removeLines(List<String> lines) {
    List<String> toRemove = List.copyOf(lines);
    return (content, context) -> {
      String result = content;
      for (String line : toRemove) {
        result = result.replace(line, "");
      }
      return result;
    };
  }

  /**
   * Drops everything before the first line matching {@code heading}, keeping frontmatter. Content
   * without a matching line is returned as is.
   */
  public static ContentTransform removeContentUpToHeading(Pattern heading) {
    Objects.requireNonNull(heading, "heading");
    return (content, context) -> {
      Frontmatter parsed = FrontmatterParser.parse(content);
      Matcher matcher = heading.matcher(parsed.body());
      while (matcher.find()) {
        int lineStart = parsed.body().lastIndexOf('\n', matcher.start()) + 1;
        if (lineStart == matcher.start()) {
          return parsed.frontmatterBlock() + parsed.body().substring(lineStart);
        }
      }
      return content;
    };
  }

  /** Moves the first level-one heading into a {@code title} frontmatter key unless one exists. */
  public static ContentTransform h1ToTitle() {
    return (content, context) -> {
      Frontmatter parsed = FrontmatterParser.parse(content);
      if (parsed.data().get("title") != null) {
        return content;
      }
      Matcher matcher = FIRST_H1.matcher(parsed.body());
      if (!matcher.find()) {
        return content;
      }
      String title = matcher.group(1).trim();
      String body =
          (parsed.body().substring(0, matcher.start()) + parsed.body().substring(matcher.end()))
              .trim();
      Map<String, Object> data = new LinkedHashMap<>(parsed.data());
      data.put("title", title);
      return FrontmatterParser.render(data, body);
    };
  }
}
