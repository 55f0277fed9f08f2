package com.gitdocs.importer.cleanup;

import java.time.Duration;
import java.util.List;

/**
 * @param skippedForSafety orphans left in place because the remote listing failed
 */
public record CleanupResult(
    List<String> deleted, int failed, int skippedForSafety, Duration duration) {

  public CleanupResult {
    deleted = deleted == null ? List.of() : List.copyOf(deleted);
  }

  public static CleanupResult empty() {
    return new CleanupResult(List.of(), 0, 0, Duration.ZERO);
  }

  public int deletedCount() {
    return deleted.size();
  }
}
