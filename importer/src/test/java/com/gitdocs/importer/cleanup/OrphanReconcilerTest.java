package com.gitdocs.importer.cleanup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gitdocs.importer.discovery.DiscoveryResult;
import com.gitdocs.importer.discovery.TreeDiscovery;
import com.gitdocs.importer.match.PatternMatcher;
import com.gitdocs.importer.remote.FakeRemoteTreeProvider;
import com.gitdocs.importer.remote.RemoteFetchException;
import com.gitdocs.importer.source.AssetOptions;
import com.gitdocs.importer.source.IncludeRule;
import com.gitdocs.importer.source.ProjectPaths;
import com.gitdocs.importer.source.SourceConfigurationException;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OrphanReconcilerTest {

  private static final SourceDescriptor SOURCE =
      SourceDescriptor.builder("org", "repo")
          .include(IncludeRule.of("docs/**/*.md", "out"))
          .build();

  @TempDir Path projectRoot;

  private FakeRemoteTreeProvider provider;
  private TreeDiscovery discovery;

  @BeforeEach
  void setUp() throws IOException {
    provider =
        new FakeRemoteTreeProvider().file("docs/a.md", "A").file("docs/guide/b.md", "B");
    discovery = new TreeDiscovery(provider, new PatternMatcher());
    for (String file :
        new String[] {
          "out/a.md",
          "out/guide/b.md",
          "out/stale.md",
          "out/.gitkeep",
          "out/.hidden/x.md",
          "out/assets/logo-0123456789.png",
          "other/unrelated.md"
        }) {
      Path path = projectRoot.resolve(file);
      Files.createDirectories(path.getParent());
      Files.writeString(path, file);
    }
  }

  @Test
  void deletesOnlyFilesTheTreeNoLongerProduces() {
    CleanupResult result = reconciler(false).reconcile(SOURCE, SyncCancellation.none());

    assertThat(result.deleted()).containsExactly("out/stale.md");
    assertThat(projectRoot.resolve("out/stale.md")).doesNotExist();
    assertThat(projectRoot.resolve("out/a.md")).exists();
    assertThat(projectRoot.resolve("out/guide/b.md")).exists();
    assertThat(projectRoot.resolve("out/.gitkeep")).exists();
    assertThat(projectRoot.resolve("out/.hidden/x.md")).exists();
    assertThat(projectRoot.resolve("out/assets/logo-0123456789.png")).exists();
    assertThat(projectRoot.resolve("other/unrelated.md")).exists();
  }

  @Test
  void reusesListingTakenEarlierInTheRun() {
    DiscoveryResult current = discovery.discover(SOURCE, SyncCancellation.none());
    provider.resetCalls();

    CleanupResult result = reconciler(false).reconcile(SOURCE, current, SyncCancellation.none());

    assertThat(result.deletedCount()).isEqualTo(1);
    assertThat(provider.listings()).isZero();
  }

  @Test
  void failedListingDeletesNothingByDefault() {
    provider.failListing(new RemoteFetchException("listing unavailable", 503));

    CleanupResult result = reconciler(false).reconcile(SOURCE, SyncCancellation.none());

    assertThat(result.deleted()).isEmpty();
    assertThat(result.skippedForSafety()).isEqualTo(3);
    assertThat(projectRoot.resolve("out/a.md")).exists();
  }

  @Test
  void failedListingCanBeAllowedToDeleteEverything() {
    provider.failListing(new RemoteFetchException("listing unavailable", 503));

    CleanupResult result = reconciler(true).reconcile(SOURCE, SyncCancellation.none());

    assertThat(result.deleted()).containsExactly("out/a.md", "out/guide/b.md", "out/stale.md");
  }

  @Test
  void explicitAssetDirectoryIsNeverCleaned() throws IOException {
    SourceDescriptor source =
        SourceDescriptor.builder("org", "repo")
            .include(IncludeRule.of("docs/**/*.md", "out"))
            .assets(new AssetOptions("out/img", "/img", null))
            .build();
    Path image = projectRoot.resolve("out/img/pic.png");
    Files.createDirectories(image.getParent());
    Files.writeString(image, "png");

    reconciler(false).reconcile(source, SyncCancellation.none());

    assertThat(image).exists();
  }

  @Test
  void sourceWithoutRulesIsNotCleaned() {
    CleanupResult result =
        reconciler(false)
            .reconcile(SourceDescriptor.builder("org", "repo").build(), SyncCancellation.none());

    assertThat(result.deleted()).isEmpty();
    assertThat(projectRoot.resolve("out/stale.md")).exists();
  }

  @Test
  void invalidSourceIsRejectedBeforeListing() {
    provider.resetCalls();
    SourceDescriptor escaping =
        SourceDescriptor.builder("org", "repo")
            .include(IncludeRule.of("docs/**/*.md", "../outside"))
            .build();

    assertThatThrownBy(() -> reconciler(true).reconcile(escaping, SyncCancellation.none()))
        .isInstanceOf(SourceConfigurationException.class);
    assertThat(provider.listings()).isZero();
    assertThat(projectRoot.resolve("out/stale.md")).exists();
  }

  @Test
  void cancellationStopsDeletion() {
    DiscoveryResult current = discovery.discover(SOURCE, SyncCancellation.none());
    SyncCancellation cancellation = SyncCancellation.create();
    cancellation.cancel();

    assertThatThrownBy(() -> reconciler(false).reconcile(SOURCE, current, cancellation))
        .isInstanceOf(SyncCancelledException.class);
    assertThat(projectRoot.resolve("out/stale.md")).exists();
  }

  private OrphanReconciler reconciler(boolean allowWide) {
    return new OrphanReconciler(
        discovery, new ProjectPaths(projectRoot), Duration.ofMillis(1), allowWide);
  }
}
