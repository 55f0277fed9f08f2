package com.gitdocs.importer.discovery;

import com.gitdocs.importer.remote.RemoteCommit;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public record DiscoveryResult(RemoteCommit commit, List<DiscoveredFile> files, boolean truncated) {

  public DiscoveryResult {
    files = files == null ? List.of() : List.copyOf(files);
  }

  public Set<String> targetPaths() {
    return files.stream().map(DiscoveredFile::targetPath).collect(Collectors.toSet());
  }
}
