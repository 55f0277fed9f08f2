package com.gitdocs.importer.state;

import com.gitdocs.importer.source.SourceConfigurationException;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.source.SourceValidator;
import com.gitdocs.importer.sync.SyncCancellation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports which sources changed upstream without importing anything. */
public class DryRunService {

  private static final Logger log = LoggerFactory.getLogger(DryRunService.class);

  private final SourceValidator validator;
  private final ChangeDetector changeDetector;
  private final ImportStateStore stateStore;
  private final DryRunReportFormatter formatter;

  public DryRunService(
      SourceValidator validator,
      ChangeDetector changeDetector,
      ImportStateStore stateStore,
      DryRunReportFormatter formatter) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector");
    this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  /**
   * Checks every enabled source, logs the report and updates only the last-checked time. A source
   * failing validation is reported as an error without any remote call.
   */
  public List<RepositoryChangeInfo> run(
      List<SourceDescriptor> sources, SyncCancellation cancellation) {
    log.info("Performing dry run, checking {} sources for changes", sources.size());
    StateFile state = stateStore.load();
    List<RepositoryChangeInfo> results = new ArrayList<>();
    for (SourceDescriptor source : sources) {
      if (!source.enabled()) {
        log.debug("Skipping disabled source {}", source.displayName());
        continue;
      }
      cancellation.throwIfCancelled();
      ImportState prior = state.get(source.sourceId());
      if (prior == null) {
        prior = ImportState.never(source.displayName(), source.sourceId(), source.ref());
      }
      try {
        validator.validate(source);
      } catch (SourceConfigurationException ex) {
        log.error("Invalid configuration for {}: {}", source.displayName(), ex.getMessage());
        results.add(new RepositoryChangeInfo(source, prior, false, null, ex.getMessage()));
        continue;
      }
      results.add(changeDetector.check(source, prior, cancellation));
    }
    stateStore.markChecked();
    formatter.format(results).forEach(log::info);
    return List.copyOf(results);
  }
}
