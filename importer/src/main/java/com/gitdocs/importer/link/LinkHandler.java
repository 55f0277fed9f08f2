package com.gitdocs.importer.link;

/** Last-resort rewrite for links that neither the index nor the mappings resolve. */
public interface LinkHandler {

  boolean test(String link, LinkContext context);

  String transform(String link, LinkContext context);
}
