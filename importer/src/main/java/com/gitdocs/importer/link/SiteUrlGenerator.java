package com.gitdocs.importer.link;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Turns a local document path into the site-relative URL it is served under. */
public class SiteUrlGenerator {

  static final Pattern DOCUMENT_EXTENSION =
      Pattern.compile("\\.(md|mdx)$", Pattern.CASE_INSENSITIVE);

  private final List<String> stripPrefixes;

  public SiteUrlGenerator(List<String> stripPrefixes) {
    this.stripPrefixes = stripPrefixes == null ? List.of() : List.copyOf(stripPrefixes);
  }

  /**
   * Strips the first matching prefix and the document extension, maps {@code index} to its folder,
   * slugs every segment and wraps the result in slashes. An empty result is {@code /}.
   */
  public String toSiteUrl(String targetPath) {
    String url = targetPath;
    for (String prefix : stripPrefixes) {
      if (!prefix.isEmpty() && url.startsWith(prefix)) {
        url = url.substring(prefix.length());
        break;
      }
    }
    if (url.startsWith("/")) {
      url = url.substring(1);
    }
    url = DOCUMENT_EXTENSION.matcher(url).replaceFirst("");
    if (url.endsWith("/index")) {
      url = url.substring(0, url.length() - "/index".length());
    } else if (url.equals("index")) {
      url = "";
    }

    List<String> segments = new ArrayList<>();
    for (String segment : url.split("/")) {
      String slug = Slugger.slug(segment);
      if (!slug.isEmpty()) {
        segments.add(slug);
      }
    }
    return segments.isEmpty() ? "/" : "/" + String.join("/", segments) + "/";
  }

  static String stripDocumentExtension(String path) {
    return DOCUMENT_EXTENSION.matcher(path).replaceFirst("");
  }
}
