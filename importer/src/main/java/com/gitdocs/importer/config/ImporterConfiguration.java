package com.gitdocs.importer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gitdocs.importer.asset.AssetPipeline;
import com.gitdocs.importer.cleanup.OrphanReconciler;
import com.gitdocs.importer.discovery.TreeDiscovery;
import com.gitdocs.importer.fetch.ConditionalFetcher;
import com.gitdocs.importer.fetch.JsonFileMetaStore;
import com.gitdocs.importer.fetch.MetaStore;
import com.gitdocs.importer.match.PatternMatcher;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.source.ProjectPaths;
import com.gitdocs.importer.source.SourceValidator;
import com.gitdocs.importer.state.ChangeDetector;
import com.gitdocs.importer.state.DryRunReportFormatter;
import com.gitdocs.importer.state.DryRunService;
import com.gitdocs.importer.state.ImportStateStore;
import com.gitdocs.importer.store.ContentStore;
import com.gitdocs.importer.store.DocumentWriter;
import com.gitdocs.importer.store.EntryPersister;
import com.gitdocs.importer.store.InMemoryContentStore;
import com.gitdocs.importer.sync.GitHubImportService;
import com.gitdocs.importer.sync.ImportMetrics;
import com.gitdocs.importer.sync.SourceImporter;
import com.gitdocs.importer.transform.TransformPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ImporterProperties.class)
public class ImporterConfiguration {

  @Bean
  Clock importerClock() {
    return Clock.systemUTC();
  }

  @Bean
  ProjectPaths projectPaths(ImporterProperties properties) {
    return new ProjectPaths(Path.of(properties.getProjectRoot()));
  }

  @Bean
  MetaStore metaStore(ImporterProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
    return new JsonFileMetaStore(
        workingDirectory(properties), objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  ContentStore contentStore() {
    return new InMemoryContentStore();
  }

  @Bean
  ImportStateStore importStateStore(
      ImporterProperties properties, ObjectProvider<ObjectMapper> objectMapper, Clock clock) {
    return new ImportStateStore(
        workingDirectory(properties), objectMapper.getIfAvailable(ObjectMapper::new), clock);
  }

  @Bean
  DocumentWriter documentWriter(ProjectPaths projectPaths) {
    return new DocumentWriter(projectPaths);
  }

  @Bean
  EntryPersister entryPersister(ContentStore contentStore, DocumentWriter documentWriter) {
    return new EntryPersister(contentStore, documentWriter);
  }

  @Bean
  TreeDiscovery treeDiscovery(RemoteTreeProvider provider) {
    return new TreeDiscovery(provider, new PatternMatcher());
  }

  @Bean
  ConditionalFetcher conditionalFetcher(RemoteTreeProvider provider, MetaStore metaStore) {
    return new ConditionalFetcher(provider, metaStore);
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService assetExecutor(ImporterProperties properties) {
    AtomicInteger threadIndex = new AtomicInteger();
    return Executors.newFixedThreadPool(
        Math.max(1, properties.getAssetConcurrency()),
        runnable -> {
          Thread thread = new Thread(runnable, "gitdocs-asset-" + threadIndex.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  AssetPipeline assetPipeline(
      RemoteTreeProvider provider, DocumentWriter documentWriter, ExecutorService assetExecutor) {
    return new AssetPipeline(provider, documentWriter, assetExecutor);
  }

  @Bean
  OrphanReconciler orphanReconciler(
      TreeDiscovery treeDiscovery, ProjectPaths projectPaths, ImporterProperties properties) {
    ImporterProperties.Cleanup cleanup = properties.getCleanup();
    return new OrphanReconciler(
        treeDiscovery,
        projectPaths,
        cleanup.getDeleteDelay(),
        cleanup.isAllowWideDeletionOnDiscoveryFailure());
  }

  @Bean
  ImportMetrics importMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    return new ImportMetrics(meterRegistry.getIfAvailable());
  }

  @Bean
  SourceImporter sourceImporter(
      ProjectPaths projectPaths,
      TreeDiscovery treeDiscovery,
      ConditionalFetcher conditionalFetcher,
      MetaStore metaStore,
      AssetPipeline assetPipeline,
      DocumentWriter documentWriter,
      EntryPersister entryPersister,
      OrphanReconciler orphanReconciler,
      ImportStateStore importStateStore,
      ImportMetrics importMetrics,
      ImporterProperties properties) {
    return new SourceImporter(
        new SourceValidator(projectPaths),
        treeDiscovery,
        conditionalFetcher,
        metaStore,
        assetPipeline,
        new TransformPipeline(),
        documentWriter,
        entryPersister,
        orphanReconciler,
        importStateStore,
        importMetrics,
        properties.getCleanup().isEnabled(),
        properties.getConcurrency());
  }

  @Bean
  DryRunService dryRunService(
      RemoteTreeProvider provider,
      ImportStateStore importStateStore,
      ProjectPaths projectPaths,
      Clock clock) {
    return new DryRunService(
        new SourceValidator(projectPaths),
        new ChangeDetector(provider),
        importStateStore,
        new DryRunReportFormatter(clock));
  }

  @Bean
  GitHubImportService gitHubImportService(
      SourceImporter sourceImporter, DryRunService dryRunService) {
    return new GitHubImportService(sourceImporter, dryRunService);
  }

  @Bean
  SourceDescriptorFactory sourceDescriptorFactory(ImporterProperties properties) {
    return new SourceDescriptorFactory(properties);
  }

  private static Path workingDirectory(ImporterProperties properties) {
    return Path.of(properties.getWorkingDirectory()).toAbsolutePath().normalize();
  }
}
