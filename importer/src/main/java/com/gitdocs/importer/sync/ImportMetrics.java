package com.gitdocs.importer.sync;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.lang.Nullable;

/** Meters of the import engine, registered once per registry. */
public class ImportMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer importTimer;
  private final Counter filesFetched;
  private final Counter filesUnchanged;
  private final Counter fileFailures;
  private final Counter assetsDownloaded;
  private final Counter orphansDeleted;

  public ImportMetrics(@Nullable MeterRegistry meterRegistry) {
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.meterRegistry = registry;
    this.importTimer = this.meterRegistry.timer("gitdocs_import_duration");
    this.filesFetched = this.meterRegistry.counter("gitdocs_files_fetched_total");
    this.filesUnchanged = this.meterRegistry.counter("gitdocs_files_unchanged_total");
    this.fileFailures = this.meterRegistry.counter("gitdocs_file_failures_total");
    this.assetsDownloaded = this.meterRegistry.counter("gitdocs_assets_downloaded_total");
    this.orphansDeleted = this.meterRegistry.counter("gitdocs_orphans_deleted_total");
  }

  public MeterRegistry registry() {
    return meterRegistry;
  }

  Timer.Sample startImport() {
    return Timer.start(meterRegistry);
  }

  void stopImport(Timer.Sample sample) {
    sample.stop(importTimer);
  }

  void fileFetched() {
    filesFetched.increment();
  }

  void fileUnchanged() {
    filesUnchanged.increment();
  }

  void fileFailed() {
    fileFailures.increment();
  }

  void assetsDownloaded(int count) {
    if (count > 0) {
      assetsDownloaded.increment(count);
    }
  }

  void orphansDeleted(int count) {
    if (count > 0) {
      orphansDeleted.increment(count);
    }
  }
}
