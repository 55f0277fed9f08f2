package com.gitdocs.importer.sync;

import com.gitdocs.importer.discovery.DiscoveredFile;
import com.gitdocs.importer.link.LinkHandler;
import com.gitdocs.importer.link.LinkMapping;
import com.gitdocs.importer.source.IncludeRule;
import com.gitdocs.importer.source.LinkOptions;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.store.Digests;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Digest of everything link resolution depends on besides a document's own text: the listed
 * remote paths with their targets, the include rules and the link options. Stored under
 * {@code {sourceId}-link-signature}.
 */
final class LinkGraphSignature {

  private LinkGraphSignature() {}

  static String key(SourceDescriptor source) {
    return source.sourceId() + "-link-signature";
  }

  static String of(SourceDescriptor source, List<DiscoveredFile> files) {
    StringBuilder text = new StringBuilder();
    Map<String, String> targets = new TreeMap<>();
    for (DiscoveredFile file : files) {
      targets.put(file.remotePath(), file.targetPath());
    }
    targets.forEach((remote, target) -> line(text, "file", remote + " => " + target));

    for (IncludeRule rule : source.includes()) {
      line(text, "include", rule.pattern() + " => " + rule.basePath());
      rule.renames().forEach((from, to) -> line(text, "rename", from + " => " + to));
    }

    LinkOptions links = source.links();
    line(text, "auto", String.valueOf(links.autoMappings()));
    links.stripPrefixes().forEach(prefix -> line(text, "strip", prefix));
    for (LinkMapping mapping : links.mappings()) {
      line(text, "mapping", mapping.fingerprint());
    }
    for (LinkHandler handler : links.handlers()) {
      line(text, "handler", handler.getClass().getName());
    }
    return Digests.sha256Hex(text.toString());
  }

  private static void line(StringBuilder text, String kind, String value) {
    text.append(kind).append(' ').append(value).append('\n');
  }
}
