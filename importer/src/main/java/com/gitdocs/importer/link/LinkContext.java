package com.gitdocs.importer.link;

/** The link being resolved and the document it appears in. */
public record LinkContext(ImportedFile currentFile, String originalLink, String anchor) {}
