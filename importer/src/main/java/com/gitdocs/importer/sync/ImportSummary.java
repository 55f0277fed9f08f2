package com.gitdocs.importer.sync;

import com.gitdocs.importer.cleanup.CleanupResult;
import java.time.Duration;

/**
 * Outcome of importing one source.
 *
 * @param updated documents whose file or store entry changed
 * @param unchanged documents the remote reported as not modified
 * @param error failure message when {@code status} is {@link ImportStatus#ERROR}
 */
public record ImportSummary(
    String sourceId,
    String sourceName,
    ImportStatus status,
    String commitSha,
    int processed,
    int updated,
    int unchanged,
    int failed,
    int assetsDownloaded,
    int assetsCached,
    CleanupResult cleanup,
    Duration duration,
    String error) {

  public ImportSummary {
    cleanup = cleanup == null ? CleanupResult.empty() : cleanup;
  }

  static ImportSummary failure(
      String sourceId, String sourceName, ImportStatus status, Duration duration, String error) {
    return new ImportSummary(
        sourceId, sourceName, status, null, 0, 0, 0, 0, 0, 0, null, duration, error);
  }

  public boolean succeeded() {
    return status == ImportStatus.SUCCESS;
  }
}
