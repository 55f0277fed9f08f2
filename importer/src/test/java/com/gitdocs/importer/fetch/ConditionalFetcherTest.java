package com.gitdocs.importer.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gitdocs.importer.discovery.DiscoveredFile;
import com.gitdocs.importer.match.MatchedEntry;
import com.gitdocs.importer.remote.FakeRemoteTreeProvider;
import com.gitdocs.importer.remote.RemoteFetchException;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConditionalFetcherTest {

  private static final SourceDescriptor SOURCE = SourceDescriptor.builder("org", "repo").build();
  private static final DiscoveredFile FILE =
      new DiscoveredFile(
          "docs/intro", "docs/intro.md", "docs/intro.md", MatchedEntry.unruled("docs/intro.md"));

  @TempDir Path tempDir;

  private FakeRemoteTreeProvider provider;
  private InMemoryMetaStore metaStore;
  private ConditionalFetcher fetcher;
  private Path localTarget;

  @BeforeEach
  void setUp() {
    provider = new FakeRemoteTreeProvider().file("docs/intro.md", "# Intro\n");
    metaStore = new InMemoryMetaStore();
    fetcher = new ConditionalFetcher(provider, metaStore);
    localTarget = tempDir.resolve("docs/intro.md");
  }

  @Test
  void firstFetchIsUnconditionalAndStoresEtag() {
    FetchOutcome outcome = fetch(false);

    assertThat(outcome.unchanged()).isFalse();
    assertThat(outcome.content()).isEqualTo("# Intro\n");
    assertThat(provider.rawCalls()).singleElement()
        .satisfies(call -> assertThat(call.conditions().isConditional()).isFalse());
    assertThat(metaStore.get(CacheTag.etagKey("docs/intro"))).startsWith("\"");
  }

  @Test
  void notModifiedReadsExistingLocalCopy() throws IOException {
    fetch(false);
    Files.createDirectories(localTarget.getParent());
    Files.writeString(localTarget, "local copy");
    provider.resetCalls();

    FetchOutcome outcome = fetch(false);

    assertThat(outcome.unchanged()).isTrue();
    assertThat(outcome.content()).isEqualTo("local copy");
    assertThat(provider.rawCalls()).singleElement()
        .satisfies(call -> assertThat(call.conditions().isConditional()).isTrue());
  }

  @Test
  void notModifiedWithMissingLocalFileRefetchesExactlyOnce() {
    fetch(false);
    provider.resetCalls();

    FetchOutcome outcome = fetch(false);

    assertThat(outcome.unchanged()).isFalse();
    assertThat(outcome.refetched()).isTrue();
    assertThat(outcome.content()).isEqualTo("# Intro\n");
    assertThat(provider.rawCalls()).hasSize(2);
    assertThat(provider.rawCalls().get(1).conditions().isConditional()).isFalse();
    assertThat(metaStore.get(CacheTag.etagKey("docs/intro"))).isNotNull();
  }

  @Test
  void forceSkipsRevalidation() throws IOException {
    fetch(false);
    Files.createDirectories(localTarget.getParent());
    Files.writeString(localTarget, "local copy");
    provider.resetCalls();

    FetchOutcome outcome = fetch(true);

    assertThat(outcome.unchanged()).isFalse();
    assertThat(outcome.content()).isEqualTo("# Intro\n");
    assertThat(provider.rawCalls().get(0).conditions().isConditional()).isFalse();
  }

  @Test
  void changedRemoteReplacesStoredTag() {
    fetch(false);
    String firstTag = metaStore.get(CacheTag.etagKey("docs/intro"));
    provider.file("docs/intro.md", "# Intro v2\n");

    FetchOutcome outcome = fetch(false);

    assertThat(outcome.content()).isEqualTo("# Intro v2\n");
    assertThat(metaStore.get(CacheTag.etagKey("docs/intro"))).isNotEqualTo(firstTag);
  }

  @Test
  void missingRemoteFileIsReportedWithStatus() {
    provider.remove("docs/intro.md");

    assertThatThrownBy(() -> fetch(false))
        .isInstanceOf(RemoteFetchException.class)
        .satisfies(ex -> assertThat(((RemoteFetchException) ex).isNotFound()).isTrue());
  }

  private FetchOutcome fetch(boolean force) {
    return fetcher.fetch(SOURCE, "c0ffee", FILE, localTarget, force, SyncCancellation.none());
  }
}
