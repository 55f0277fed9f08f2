package com.gitdocs.importer.state;

import java.time.Instant;

/** What the last successful import of one source recorded. */
public record ImportState(
    String name, String repoId, String lastCommitSha, Instant lastImported, String ref) {

  public static ImportState never(String name, String repoId, String ref) {
    return new ImportState(name, repoId, null, null, ref);
  }

  public boolean hasImported() {
    return lastCommitSha != null;
  }
}
