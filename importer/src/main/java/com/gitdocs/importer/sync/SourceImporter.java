package com.gitdocs.importer.sync;

import com.gitdocs.importer.asset.AssetPipeline;
import com.gitdocs.importer.asset.AssetResult;
import com.gitdocs.importer.cleanup.CleanupResult;
import com.gitdocs.importer.cleanup.OrphanReconciler;
import com.gitdocs.importer.discovery.DiscoveredFile;
import com.gitdocs.importer.discovery.DiscoveryResult;
import com.gitdocs.importer.discovery.TreeDiscovery;
import com.gitdocs.importer.fetch.ConditionalFetcher;
import com.gitdocs.importer.fetch.FetchOutcome;
import com.gitdocs.importer.fetch.MetaStore;
import com.gitdocs.importer.link.ImportedFile;
import com.gitdocs.importer.link.LinkResolver;
import com.gitdocs.importer.link.LinkTransformContext;
import com.gitdocs.importer.source.SourceConfigurationException;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.source.SourceValidator;
import com.gitdocs.importer.state.ImportState;
import com.gitdocs.importer.state.ImportStateStore;
import com.gitdocs.importer.store.DocumentWriter;
import com.gitdocs.importer.store.EntryPersister;
import com.gitdocs.importer.store.PersistResult;
import com.gitdocs.importer.transform.TransformContext;
import com.gitdocs.importer.transform.TransformPipeline;
import io.micrometer.core.instrument.Timer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * Imports one source: discovery, then fetch, assets and transforms per file on a bounded pool,
 * then link resolution over the whole batch, persistence, cleanup and the state record.
 */
public class SourceImporter implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(SourceImporter.class);

  private final SourceValidator validator;
  private final TreeDiscovery discovery;
  private final ConditionalFetcher fetcher;
  private final MetaStore metaStore;
  private final AssetPipeline assetPipeline;
  private final TransformPipeline transformPipeline;
  private final DocumentWriter writer;
  private final EntryPersister persister;
  private final OrphanReconciler reconciler;
  private final ImportStateStore stateStore;
  private final ImportMetrics metrics;
  private final boolean cleanupEnabled;
  private final ExecutorService fileExecutor;

  public SourceImporter(
      SourceValidator validator,
      TreeDiscovery discovery,
      ConditionalFetcher fetcher,
      MetaStore metaStore,
      AssetPipeline assetPipeline,
      TransformPipeline transformPipeline,
      DocumentWriter writer,
      EntryPersister persister,
      OrphanReconciler reconciler,
      ImportStateStore stateStore,
      ImportMetrics metrics,
      boolean cleanupEnabled,
      int concurrency) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.metaStore = Objects.requireNonNull(metaStore, "metaStore");
    this.assetPipeline = Objects.requireNonNull(assetPipeline, "assetPipeline");
    this.transformPipeline = Objects.requireNonNull(transformPipeline, "transformPipeline");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.persister = Objects.requireNonNull(persister, "persister");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.cleanupEnabled = cleanupEnabled;
    AtomicInteger threadIndex = new AtomicInteger();
    this.fileExecutor =
        Executors.newFixedThreadPool(
            Math.max(1, concurrency),
            runnable -> {
              Thread thread =
                  new Thread(runnable, "gitdocs-fetch-" + threadIndex.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  public ImportSummary importSource(
      SourceDescriptor source, ImportOptions options, SyncCancellation cancellation) {
    long started = System.nanoTime();
    Timer.Sample sample = metrics.startImport();
    try {
      return doImport(source, options, cancellation, started);
    } catch (SyncCancelledException ex) {
      log.warn("Import of {} cancelled", source.displayName());
      return ImportSummary.failure(
          source.sourceId(), source.displayName(), ImportStatus.CANCELLED, since(started), null);
    } catch (SourceConfigurationException ex) {
      log.error("Invalid configuration for {}: {}", source.displayName(), ex.getMessage());
      return ImportSummary.failure(
          source.sourceId(),
          source.displayName(),
          ImportStatus.ERROR,
          since(started),
          ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Import of {} failed: {}", source.displayName(), ex.getMessage(), ex);
      return ImportSummary.failure(
          source.sourceId(),
          source.displayName(),
          ImportStatus.ERROR,
          since(started),
          ex.getMessage());
    } finally {
      metrics.stopImport(sample);
    }
  }

  private ImportSummary doImport(
      SourceDescriptor source,
      ImportOptions options,
      SyncCancellation cancellation,
      long started) {
    validator.validate(source);
    log.info("Importing {} ({}@{})", source.displayName(), source.fullName(), source.ref());

    DiscoveryResult discovered = discovery.discover(source, cancellation);
    String commitSha = discovered.commit().sha();
    ImportState prior = stateStore.stateOf(source);
    if (prior.hasImported() && commitSha.equals(prior.lastCommitSha())) {
      log.info("{} has no upstream changes since {}", source.displayName(), commitSha);
    }

    String linkSignature = LinkGraphSignature.of(source, discovered.files());
    String storedSignature = metaStore.get(LinkGraphSignature.key(source));
    boolean relink = !options.force() && !linkSignature.equals(storedSignature);
    if (relink && storedSignature != null) {
      log.info("Link targets of {} changed, re-fetching every document", source.displayName());
    }
    ImportOptions fileOptions = relink ? new ImportOptions(options.dryRun(), true) : options;

    List<Future<FileOutcome>> futures = new ArrayList<>();
    for (DiscoveredFile file : discovered.files()) {
      futures.add(
          fileExecutor.submit(
              () -> processFile(source, commitSha, file, fileOptions, cancellation)));
    }
    List<FileOutcome> outcomes = awaitAll(futures, cancellation);
    metaStore.flush();

    List<ImportedFile> batch = new ArrayList<>();
    int failed = 0;
    int unchanged = 0;
    int assetsDownloaded = 0;
    int assetsCached = 0;
    for (FileOutcome outcome : outcomes) {
      if (outcome.file() == null) {
        failed++;
        continue;
      }
      batch.add(outcome.file());
      if (outcome.file().unchanged()) {
        unchanged++;
      }
      assetsDownloaded += outcome.assetsDownloaded();
      assetsCached += outcome.assetsCached();
    }

    cancellation.throwIfCancelled();
    List<ImportedFile> resolved = LinkResolver.forSource(source).resolveAll(batch);

    int updated = 0;
    for (ImportedFile file : resolved) {
      cancellation.throwIfCancelled();
      try {
        PersistResult result = persister.persist(file, source.clear());
        if (result.changed()) {
          updated++;
        }
      } catch (RuntimeException ex) {
        failed++;
        metrics.fileFailed();
        log.warn("Failed to store {}: {}", file.id(), ex.getMessage());
      }
    }

    if (failed == 0) {
      metaStore.set(LinkGraphSignature.key(source), linkSignature);
      metaStore.flush();
    }

    CleanupResult cleanup = CleanupResult.empty();
    if (cleanupEnabled) {
      cleanup = reconciler.reconcile(source, discovered, cancellation);
      metrics.orphansDeleted(cleanup.deletedCount());
    }
    stateStore.recordImport(source, commitSha);

    ImportSummary summary =
        new ImportSummary(
            source.sourceId(),
            source.displayName(),
            ImportStatus.SUCCESS,
            commitSha,
            discovered.files().size(),
            updated,
            unchanged,
            failed,
            assetsDownloaded,
            assetsCached,
            cleanup,
            since(started),
            null);
    log.info(
        "Imported {}: {} processed, {} updated, {} unchanged, {} failed, assets {} downloaded"
            + " / {} cached, {} orphans deleted in {} ms",
        source.displayName(),
        summary.processed(),
        summary.updated(),
        summary.unchanged(),
        summary.failed(),
        summary.assetsDownloaded(),
        summary.assetsCached(),
        cleanup.deletedCount(),
        summary.duration().toMillis());
    return summary;
  }

  private FileOutcome processFile(
      SourceDescriptor source,
      String commitSha,
      DiscoveredFile file,
      ImportOptions options,
      SyncCancellation cancellation) {
    cancellation.throwIfCancelled();
    try {
      Path localTarget = writer.resolve(file.targetPath());
      FetchOutcome fetched =
          fetcher.fetch(source, commitSha, file, localTarget, options.force(), cancellation);
      LinkTransformContext linkContext =
          LinkTransformContext.of(source.displayName(), file.entry());
      if (fetched.unchanged()) {
        metrics.fileUnchanged();
        return new FileOutcome(
            new ImportedFile(
                file.remotePath(),
                file.targetPath(),
                fetched.content(),
                file.id(),
                linkContext,
                true),
            0,
            0);
      }
      metrics.fileFetched();

      AssetResult assets =
          assetPipeline.process(fetched.content(), source, commitSha, file, cancellation);
      metrics.assetsDownloaded(assets.downloaded());
      String content =
          transformPipeline.apply(
              assets.content(),
              new TransformContext(file.id(), file.remotePath(), source, file.entry()));
      return new FileOutcome(
          new ImportedFile(
              file.remotePath(), file.targetPath(), content, file.id(), linkContext, false),
          assets.downloaded(),
          assets.cached());
    } catch (SyncCancelledException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      metrics.fileFailed();
      log.warn("Failed to import {}: {}", file.remotePath(), ex.getMessage());
      return FileOutcome.FAILED;
    }
  }

  private List<FileOutcome> awaitAll(
      List<Future<FileOutcome>> futures, SyncCancellation cancellation) {
    List<FileOutcome> outcomes = new ArrayList<>(futures.size());
    try {
      for (Future<FileOutcome> future : futures) {
        outcomes.add(future.get());
      }
      return outcomes;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      cancellation.cancel();
      futures.forEach(future -> future.cancel(true));
      throw new SyncCancelledException("Interrupted while importing");
    } catch (ExecutionException ex) {
      futures.forEach(future -> future.cancel(true));
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("File import failed", ex.getCause());
    }
  }

  private static Duration since(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }

  @Override
  public void destroy() {
    fileExecutor.shutdownNow();
  }

  private record FileOutcome(ImportedFile file, int assetsDownloaded, int assetsCached) {

    static final FileOutcome FAILED = new FileOutcome(null, 0, 0);
  }
}
