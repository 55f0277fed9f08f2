package com.gitdocs.importer.state;

import com.gitdocs.importer.remote.RemoteCommit;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ChangeDetector {

  private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

  private final RemoteTreeProvider provider;

  public ChangeDetector(RemoteTreeProvider provider) {
    this.provider = Objects.requireNonNull(provider, "provider");
  }

  /** Changes are pending when nothing was imported yet or the recorded commit differs. */
  public RepositoryChangeInfo check(
      SourceDescriptor source, ImportState state, SyncCancellation cancellation) {
    try {
      RemoteCommit latest = provider.resolveCommit(source, cancellation);
      boolean needsReimport =
          state == null || !state.hasImported() || !state.lastCommitSha().equals(latest.sha());
      return new RepositoryChangeInfo(source, state, needsReimport, latest, null);
    } catch (SyncCancelledException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.debug("Change check of {} failed", source.displayName(), ex);
      return new RepositoryChangeInfo(source, state, false, null, ex.getMessage());
    }
  }
}
