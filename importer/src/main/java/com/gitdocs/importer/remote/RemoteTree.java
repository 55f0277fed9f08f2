package com.gitdocs.importer.remote;

import java.util.List;

public record RemoteTree(String commitSha, List<RemoteTreeEntry> entries, boolean truncated) {

  public RemoteTree {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }
}
