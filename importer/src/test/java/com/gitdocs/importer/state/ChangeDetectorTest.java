package com.gitdocs.importer.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gitdocs.importer.remote.FakeRemoteTreeProvider;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ChangeDetectorTest {

  private static final SourceDescriptor SOURCE = SourceDescriptor.builder("org", "repo").build();
  private static final Instant IMPORTED = Instant.parse("2026-10-10T08:00:00Z");

  private final ChangeDetector detector =
      new ChangeDetector(
          new FakeRemoteTreeProvider()
              .commit("abc", "Fix typo", Instant.parse("2026-10-18T09:00:00Z")));

  @Test
  void sameCommitIsUpToDate() {
    RepositoryChangeInfo info =
        detector.check(SOURCE, imported("abc"), SyncCancellation.none());

    assertThat(info.needsReimport()).isFalse();
    assertThat(info.latestCommit().sha()).isEqualTo("abc");
  }

  @Test
  void differentOrMissingCommitNeedsReimport() {
    assertThat(detector.check(SOURCE, imported("old"), SyncCancellation.none()).needsReimport())
        .isTrue();
    ImportState never = ImportState.never("repo", "org/repo@main", "main");
    assertThat(detector.check(SOURCE, never, SyncCancellation.none()).needsReimport()).isTrue();
  }

  @Test
  void cancellationPropagates() {
    SyncCancellation cancellation = SyncCancellation.create();
    cancellation.cancel();

    assertThatThrownBy(() -> detector.check(SOURCE, imported("abc"), cancellation))
        .isInstanceOf(SyncCancelledException.class);
  }

  private static ImportState imported(String sha) {
    return new ImportState("repo", "org/repo@main", sha, IMPORTED, "main");
  }
}
