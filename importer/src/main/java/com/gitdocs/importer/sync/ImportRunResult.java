package com.gitdocs.importer.sync;

import com.gitdocs.importer.state.RepositoryChangeInfo;
import java.util.List;

/** Per-source results of one run; {@code changes} is filled in dry-run mode only. */
public record ImportRunResult(
    List<ImportSummary> summaries, List<RepositoryChangeInfo> changes, boolean cancelled) {

  public ImportRunResult {
    summaries = summaries == null ? List.of() : List.copyOf(summaries);
    changes = changes == null ? List.of() : List.copyOf(changes);
  }

  public long errorCount() {
    return summaries.stream().filter(summary -> summary.status() == ImportStatus.ERROR).count()
        + changes.stream().filter(change -> change.failed()).count();
  }
}
