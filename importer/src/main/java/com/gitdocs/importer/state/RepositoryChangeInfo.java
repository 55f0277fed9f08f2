package com.gitdocs.importer.state;

import com.gitdocs.importer.remote.RemoteCommit;
import com.gitdocs.importer.source.SourceDescriptor;

/**
 * Outcome of comparing a source's latest commit with its recorded state. {@code latestCommit} is
 * {@code null} when {@code error} is set.
 */
public record RepositoryChangeInfo(
    SourceDescriptor source,
    ImportState state,
    boolean needsReimport,
    RemoteCommit latestCommit,
    String error) {

  public boolean failed() {
    return error != null;
  }
}
