package com.gitdocs.importer.transform;

/** A string-to-string rewrite of document content. */
@FunctionalInterface
public interface ContentTransform {

  String apply(String content, TransformContext context);
}
