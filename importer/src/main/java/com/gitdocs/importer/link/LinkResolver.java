package com.gitdocs.importer.link;

import com.gitdocs.importer.match.PosixPaths;
import com.gitdocs.importer.source.LinkOptions;
import com.gitdocs.importer.source.SourceDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites markdown links between the documents of one batch into site URLs. Runs once all
 * documents of the batch have a target path, since any link may point at any of them.
 *
 * <p>Per link: external and anchor-only links are kept as written. Other paths are resolved against
 * the directory of the document's remote path, passed through the global mappings, and looked up
 * in the batch index. Unresolved links fall back to the non-global mappings, then the handlers,
 * and finally to the path without its document extension. Anchors are carried through every step.
 * Image embeds are left to the asset pipeline.
 */
public class LinkResolver {

  private static final Logger log = LoggerFactory.getLogger(LinkResolver.class);
  /** Link text may wrap one or more images, as in a clickable badge. */
  static final Pattern MARKDOWN_LINK =
      Pattern.compile(
          "(!?)\\[((?:!\\[[^\\[\\]]*\\]\\([^)]*\\)|[^\\[\\]])*)\\]\\(([^)]+)\\)");
  private static final Pattern EXTERNAL_SCHEME =
      Pattern.compile("^(?:mailto|tel|data|ftp):", Pattern.CASE_INSENSITIVE);

  private final SiteUrlGenerator siteUrls;
  private final List<LinkMapping> globalMappings;
  private final List<LinkMapping> localMappings;
  private final List<LinkHandler> handlers;

  public LinkResolver(
      List<String> stripPrefixes, List<LinkMapping> mappings, List<LinkHandler> handlers) {
    this.siteUrls = new SiteUrlGenerator(stripPrefixes);
    List<LinkMapping> global = new ArrayList<>();
    List<LinkMapping> local = new ArrayList<>();
    for (LinkMapping mapping : mappings == null ? List.<LinkMapping>of() : mappings) {
      (mapping.global() ? global : local).add(mapping);
    }
    this.globalMappings = List.copyOf(global);
    this.localMappings = List.copyOf(local);
    this.handlers = handlers == null ? List.of() : List.copyOf(handlers);
  }

  /** Resolver for one source: rename-derived mappings first, then the configured ones. */
  public static LinkResolver forSource(SourceDescriptor source) {
    LinkOptions options = source.links();
    List<LinkMapping> mappings = new ArrayList<>();
    if (options.autoMappings()) {
      mappings.addAll(AutoLinkMappings.fromIncludes(source.includes(), options.stripPrefixes()));
    }
    mappings.addAll(options.mappings());
    return new LinkResolver(options.stripPrefixes(), mappings, options.handlers());
  }

  /**
   * Returns the batch with links rewritten. Documents flagged unchanged already hold resolved
   * content and are only indexed.
   */
  public List<ImportedFile> resolveAll(List<ImportedFile> files) {
    LinkIndex index = LinkIndex.of(files);
    List<ImportedFile> result = new ArrayList<>(files.size());
    for (ImportedFile file : files) {
      result.add(file.unchanged() ? file : file.withContent(rewrite(file, index)));
    }
    log.debug("Resolved links across {} documents", index.size());
    return List.copyOf(result);
  }

  String rewrite(ImportedFile file, LinkIndex index) {
    Matcher matcher = MARKDOWN_LINK.matcher(file.content());
    StringBuilder out = new StringBuilder(file.content().length());
    while (matcher.find()) {
      String replacement;
      if (!matcher.group(1).isEmpty()) {
        replacement = matcher.group();
      } else {
        String url = matcher.group(3);
        replacement = "[" + matcher.group(2) + "](" + resolve(url, file, index) + ")";
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  String resolve(String url, ImportedFile file, LinkIndex index) {
    if (isExternal(url)) {
      return url;
    }
    String leading = url.substring(0, url.length() - url.stripLeading().length());
    String trimmed = url.strip();
    int space = indexOfWhitespace(trimmed);
    String target = space < 0 ? trimmed : trimmed.substring(0, space);
    String title = space < 0 ? "" : trimmed.substring(space);
    if (target.isEmpty() || isExternal(target)) {
      return url;
    }

    int hash = target.indexOf('#');
    String path = hash < 0 ? target : target.substring(0, hash);
    String anchor = hash < 0 ? "" : target.substring(hash);
    if (path.isEmpty()) {
      return url;
    }
    return leading + resolvePath(path, anchor, url, file, index) + title;
  }

  private String resolvePath(
      String path, String anchor, String original, ImportedFile file, LinkIndex index) {
    String normalized =
        path.startsWith("/")
            ? path
            : PosixPaths.normalize(
                PosixPaths.join(PosixPaths.dirname(file.sourcePath()), path));
    LinkContext context = new LinkContext(file, original, anchor);

    Mapped remapped = applyMappings(normalized, anchor, globalMappings, context);
    Optional<String> target = index.lookup(remapped.path());
    if (target.isEmpty() && remapped.matched()) {
      target = index.lookup(normalized);
    }
    if (target.isPresent()) {
      return siteUrls.toSiteUrl(target.get()) + anchor;
    }

    Mapped mapped = applyMappings(remapped.path(), anchor, localMappings, context);
    if (mapped.matched()) {
      return mapped.path() + anchor;
    }

    String current = remapped.path() + anchor;
    for (LinkHandler handler : handlers) {
      if (handler.test(current, context)) {
        return handler.transform(current, context);
      }
    }
    return SiteUrlGenerator.stripDocumentExtension(remapped.path()) + anchor;
  }

  private Mapped applyMappings(
      String path, String anchor, List<LinkMapping> mappings, LinkContext context) {
    String current = path;
    boolean matched = false;
    for (LinkMapping mapping : mappings) {
      if (!mapping.appliesTo(context.currentFile())) {
        continue;
      }
      Optional<String> result = mapping.apply(current, anchor, context);
      if (result.isPresent()) {
        current = result.get();
        matched = true;
      }
    }
    return new Mapped(current, matched);
  }

  static boolean isExternal(String link) {
    String trimmed = link.strip();
    return trimmed.startsWith("#")
        || trimmed.startsWith("//")
        || trimmed.contains("://")
        || EXTERNAL_SCHEME.matcher(trimmed).find();
  }

  private static int indexOfWhitespace(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  private record Mapped(String path, boolean matched) {}
}
