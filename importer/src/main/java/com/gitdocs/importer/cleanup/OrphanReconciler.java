package com.gitdocs.importer.cleanup;

import com.gitdocs.importer.asset.AssetLocation;
import com.gitdocs.importer.discovery.DiscoveryResult;
import com.gitdocs.importer.discovery.TreeDiscovery;
import com.gitdocs.importer.match.PosixPaths;
import com.gitdocs.importer.source.IncludeRule;
import com.gitdocs.importer.source.ProjectPaths;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.source.SourceValidator;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Deletes local files under a source's base paths that the remote tree no longer produces. Dot
 * entries and asset directories are never touched. Deletions run one at a time with a pause in
 * between.
 */
public class OrphanReconciler {

  private static final Logger log = LoggerFactory.getLogger(OrphanReconciler.class);

  private final TreeDiscovery discovery;
  private final ProjectPaths paths;
  private final SourceValidator validator;
  private final Duration deleteDelay;
  private final boolean allowWideDeletionOnDiscoveryFailure;

  public OrphanReconciler(
      TreeDiscovery discovery,
      ProjectPaths paths,
      Duration deleteDelay,
      boolean allowWideDeletionOnDiscoveryFailure) {
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.paths = Objects.requireNonNull(paths, "paths");
    this.validator = new SourceValidator(paths);
    this.deleteDelay = deleteDelay == null ? Duration.ZERO : deleteDelay;
    this.allowWideDeletionOnDiscoveryFailure = allowWideDeletionOnDiscoveryFailure;
  }

  /**
   * Lists the live tree and removes what it no longer accounts for.
   *
   * @throws com.gitdocs.importer.source.SourceConfigurationException if the source is invalid;
   *     nothing is listed or deleted in that case
   */
  public CleanupResult reconcile(SourceDescriptor source, SyncCancellation cancellation) {
    validator.validate(source);
    DiscoveryResult expected;
    try {
      expected = discovery.discover(source, cancellation);
    } catch (SyncCancelledException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.error(
          "Failed to list {} for cleanup: {}", source.displayName(), ex.getMessage(), ex);
      return reconcile(source, Set.of(), true, cancellation);
    }
    return reconcile(source, expected.targetPaths(), false, cancellation);
  }

  /** Removes files that {@code current}, a listing taken earlier in this run, does not produce. */
  public CleanupResult reconcile(
      SourceDescriptor source, DiscoveryResult current, SyncCancellation cancellation) {
    return reconcile(source, current.targetPaths(), false, cancellation);
  }

  private CleanupResult reconcile(
      SourceDescriptor source,
      Set<String> expectedTargets,
      boolean discoveryFailed,
      SyncCancellation cancellation) {
    long started = System.nanoTime();
    if (!source.hasIncludes()) {
      log.debug("Skipping cleanup of {}: no include rules", source.displayName());
      return CleanupResult.empty();
    }
    Set<String> expected = new LinkedHashSet<>();
    for (String target : expectedTargets) {
      expected.add(PosixPaths.normalize(target));
    }

    List<String> orphans = new ArrayList<>();
    for (String existing : existingFiles(source)) {
      if (!expected.contains(existing)) {
        orphans.add(existing);
      }
    }
    if (orphans.isEmpty()) {
      return new CleanupResult(List.of(), 0, 0, Duration.ofNanos(System.nanoTime() - started));
    }
    if (discoveryFailed && !allowWideDeletionOnDiscoveryFailure) {
      log.warn(
          "Remote listing of {} failed; not deleting {} local files that would all look orphaned",
          source.displayName(),
          orphans.size());
      return new CleanupResult(
          List.of(), 0, orphans.size(), Duration.ofNanos(System.nanoTime() - started));
    }

    List<String> deleted = new ArrayList<>();
    int failed = 0;
    for (int i = 0; i < orphans.size(); i++) {
      cancellation.throwIfCancelled();
      if (i > 0) {
        pause();
      }
      String orphan = orphans.get(i);
      try {
        Files.deleteIfExists(paths.resolve(orphan));
        deleted.add(orphan);
        log.info("Deleted orphaned file {}", orphan);
      } catch (IOException | RuntimeException ex) {
        failed++;
        log.warn("Failed to delete {}: {}", orphan, ex.getMessage());
      }
    }
    Duration duration = Duration.ofNanos(System.nanoTime() - started);
    log.info(
        "Cleanup of {} deleted {} files ({} failed) in {} ms",
        source.displayName(),
        deleted.size(),
        failed,
        duration.toMillis());
    return new CleanupResult(deleted, failed, 0, duration);
  }

  /** Project-relative paths of regular files under every rule's base path, sorted. */
  Set<String> existingFiles(SourceDescriptor source) {
    Set<String> excluded = assetDirectories(source);
    Set<String> files = new TreeSet<>();
    Set<String> basePaths = new LinkedHashSet<>();
    for (IncludeRule rule : source.includes()) {
      basePaths.add(PosixPaths.normalize(rule.basePath()));
    }
    for (String basePath : basePaths) {
      Path root = paths.resolve(basePath);
      if (!Files.isDirectory(root)) {
        continue;
      }
      try (Stream<Path> walk = Files.walk(root)) {
        walk.filter(Files::isRegularFile)
            .filter(path -> !hasDotSegment(root.relativize(path)))
            .map(paths::relativize)
            .filter(relative -> !isUnder(relative, excluded))
            .forEach(files::add);
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to list " + root, ex);
      }
    }
    return files;
  }

  private static Set<String> assetDirectories(SourceDescriptor source) {
    Set<String> directories = new LinkedHashSet<>();
    if (StringUtils.hasText(source.assets().assetsPath())) {
      directories.add(PosixPaths.normalize(source.assets().assetsPath().trim()));
    }
    for (IncludeRule rule : source.includes()) {
      directories.add(PosixPaths.join(rule.basePath(), AssetLocation.COLOCATED_DIRECTORY));
    }
    return directories;
  }

  private static boolean hasDotSegment(Path relative) {
    for (Path segment : relative) {
      if (segment.toString().startsWith(".")) {
        return true;
      }
    }
    return false;
  }

  private static boolean isUnder(String relative, Set<String> directories) {
    for (String directory : directories) {
      if (relative.equals(directory) || relative.startsWith(directory + "/")) {
        return true;
      }
    }
    return false;
  }

  private void pause() {
    if (deleteDelay.isZero() || deleteDelay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(deleteDelay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SyncCancelledException("Cleanup interrupted");
    }
  }
}
