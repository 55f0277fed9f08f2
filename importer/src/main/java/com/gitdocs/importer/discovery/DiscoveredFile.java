package com.gitdocs.importer.discovery;

import com.gitdocs.importer.match.MatchedEntry;

/** A matched remote file with the local path and stable id it will be imported under. */
public record DiscoveredFile(String id, String remotePath, String targetPath, MatchedEntry entry) {}
