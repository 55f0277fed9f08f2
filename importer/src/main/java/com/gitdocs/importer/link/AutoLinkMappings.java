package com.gitdocs.importer.link;

import com.gitdocs.importer.match.PosixPaths;
import com.gitdocs.importer.source.IncludeRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Global mappings derived from rename rules, so links written against an upstream path reach the
 * renamed page even when the upstream file is not part of the batch.
 */
public final class AutoLinkMappings {

  private AutoLinkMappings() {}

  public static List<LinkMapping> fromIncludes(
      List<IncludeRule> includes, List<String> stripPrefixes) {
    SiteUrlGenerator urls = new SiteUrlGenerator(stripPrefixes);
    List<LinkMapping> mappings = new ArrayList<>();
    for (IncludeRule rule : includes) {
      for (Map.Entry<String, String> rename : rule.renames().entrySet()) {
        String source = rename.getKey();
        String target = rename.getValue() == null ? "" : rename.getValue();
        String basePath = rule.basePath();
        if (source.endsWith("/")) {
          Pattern prefix = Pattern.compile("^" + Pattern.quote(source));
          mappings.add(
              LinkMapping.regex(
                      Pattern.compile("^" + Pattern.quote(source) + "(.+)$"),
                      (path, anchor, context) -> {
                        String remainder = prefix.matcher(path).replaceFirst("");
                        return urls.toSiteUrl(
                            PosixPaths.join(PosixPaths.join(basePath, target), remainder));
                      })
                  .asGlobal()
                  .withDescription("folder rename " + source + " -> " + target));
        } else {
          mappings.add(
              LinkMapping.regex(
                      Pattern.compile("^" + Pattern.quote(source) + "$"),
                      (path, anchor, context) -> urls.toSiteUrl(PosixPaths.join(basePath, target)))
                  .asGlobal()
                  .withDescription("file rename " + source + " -> " + target));
        }
      }
    }
    return mappings;
  }
}
