package com.gitdocs.importer.transform;

import com.gitdocs.importer.match.MatchedEntry;
import com.gitdocs.importer.source.SourceDescriptor;

/**
 * What a transform knows about the document it rewrites.
 *
 * @param id stable id of the document
 * @param path remote path of the document
 * @param matchedEntry rule selection, with a {@code null} rule in import-everything mode
 */
public record TransformContext(
    String id, String path, SourceDescriptor source, MatchedEntry matchedEntry) {}
