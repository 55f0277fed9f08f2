package com.gitdocs.importer.link;

/** Computes the replacement of a link path matched by a {@link LinkMapping}. */
@FunctionalInterface
public interface LinkReplacement {

  String replace(String path, String anchor, LinkContext context);
}
