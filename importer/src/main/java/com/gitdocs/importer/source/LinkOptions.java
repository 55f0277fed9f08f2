package com.gitdocs.importer.source;

import com.gitdocs.importer.link.LinkHandler;
import com.gitdocs.importer.link.LinkMapping;
import java.util.List;

public record LinkOptions(
    List<String> stripPrefixes,
    List<LinkMapping> mappings,
    List<LinkHandler> handlers,
    boolean autoMappings) {

  public LinkOptions {
    stripPrefixes = stripPrefixes == null ? List.of() : List.copyOf(stripPrefixes);
    mappings = mappings == null ? List.of() : List.copyOf(mappings);
    handlers = handlers == null ? List.of() : List.copyOf(handlers);
  }

  public static LinkOptions defaults() {
    return new LinkOptions(List.of(), List.of(), List.of(), true);
  }
}
