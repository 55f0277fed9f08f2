package com.gitdocs.importer;

import com.gitdocs.importer.config.ImporterProperties;
import com.gitdocs.importer.config.SourceDescriptorFactory;
import com.gitdocs.importer.source.SourceConfigurationException;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.GitHubImportService;
import com.gitdocs.importer.sync.ImportOptions;
import com.gitdocs.importer.sync.ImportRunResult;
import com.gitdocs.importer.sync.SyncCancellation;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the configured import once the context is up. {@code --dry-run} and {@code --force} on the
 * command line override the matching properties.
 */
@Component
@ConditionalOnProperty(prefix = "importer", name = "run-on-startup", havingValue = "true")
public class ImportRunner implements ApplicationRunner, DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(ImportRunner.class);

  private final GitHubImportService importService;
  private final SourceDescriptorFactory descriptorFactory;
  private final ImporterProperties properties;
  private final SyncCancellation cancellation = SyncCancellation.create();

  public ImportRunner(
      GitHubImportService importService,
      SourceDescriptorFactory descriptorFactory,
      ImporterProperties properties) {
    this.importService = importService;
    this.descriptorFactory = descriptorFactory;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<SourceDescriptor> sources;
    try {
      sources = descriptorFactory.createAll();
    } catch (SourceConfigurationException ex) {
      log.error("Importer configuration is invalid: {}", ex.getMessage());
      return;
    }
    if (sources.isEmpty()) {
      log.warn("No sources configured under importer.sources");
      return;
    }
    ImportOptions options =
        new ImportOptions(
            properties.isDryRun() || args.containsOption("dry-run"),
            properties.isForce() || args.containsOption("force"));
    ImportRunResult result = importService.run(sources, options, cancellation);
    if (result.cancelled()) {
      log.warn("Import run was cancelled");
    } else if (result.errorCount() > 0) {
      log.error("Import run finished with {} errors", result.errorCount());
    }
  }

  @Override
  public void destroy() {
    cancellation.cancel();
  }
}
