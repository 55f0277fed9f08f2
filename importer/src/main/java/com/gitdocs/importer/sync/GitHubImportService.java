package com.gitdocs.importer.sync;

import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.state.DryRunService;
import com.gitdocs.importer.state.RepositoryChangeInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point of a run: a dry-run report, or a sequential import of every enabled source. */
public class GitHubImportService {

  private static final Logger log = LoggerFactory.getLogger(GitHubImportService.class);

  private final SourceImporter importer;
  private final DryRunService dryRunService;

  public GitHubImportService(SourceImporter importer, DryRunService dryRunService) {
    this.importer = Objects.requireNonNull(importer, "importer");
    this.dryRunService = Objects.requireNonNull(dryRunService, "dryRunService");
  }

  public ImportRunResult run(
      List<SourceDescriptor> sources, ImportOptions options, SyncCancellation cancellation) {
    ImportOptions effective = options == null ? ImportOptions.defaults() : options;
    SyncCancellation signal = cancellation == null ? SyncCancellation.none() : cancellation;
    List<SourceDescriptor> all = sources == null ? List.of() : sources;

    if (effective.dryRun()) {
      try {
        List<RepositoryChangeInfo> changes = dryRunService.run(all, signal);
        return new ImportRunResult(List.of(), changes, false);
      } catch (SyncCancelledException ex) {
        log.warn("Dry run cancelled");
        return new ImportRunResult(List.of(), List.of(), true);
      }
    }

    List<ImportSummary> summaries = new ArrayList<>();
    for (SourceDescriptor source : all) {
      if (!source.enabled()) {
        log.debug("Skipping disabled source {}", source.displayName());
        continue;
      }
      if (signal.isCancelled()) {
        log.warn("Run cancelled before {}", source.displayName());
        return new ImportRunResult(summaries, List.of(), true);
      }
      ImportSummary summary = importer.importSource(source, effective, signal);
      summaries.add(summary);
      if (summary.status() == ImportStatus.CANCELLED) {
        return new ImportRunResult(summaries, List.of(), true);
      }
    }
    long errors = summaries.stream().filter(s -> s.status() == ImportStatus.ERROR).count();
    log.info("Import run finished: {} sources, {} with errors", summaries.size(), errors);
    return new ImportRunResult(summaries, List.of(), false);
  }
}
