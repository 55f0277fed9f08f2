package com.gitdocs.importer.discovery;

import com.gitdocs.importer.match.MatchedEntry;
import com.gitdocs.importer.match.PathMapper;
import com.gitdocs.importer.match.PatternMatcher;
import com.gitdocs.importer.remote.RemoteCommit;
import com.gitdocs.importer.remote.RemoteTree;
import com.gitdocs.importer.remote.RemoteTreeEntry;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the files of a source that its include rules select. Costs two remote calls per source:
 * one to resolve the ref and one recursive tree listing.
 */
public class TreeDiscovery {

  private static final Logger log = LoggerFactory.getLogger(TreeDiscovery.class);

  private final RemoteTreeProvider provider;
  private final PatternMatcher matcher;

  public TreeDiscovery(RemoteTreeProvider provider, PatternMatcher matcher) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
  }

  public DiscoveryResult discover(SourceDescriptor source, SyncCancellation cancellation) {
    cancellation.throwIfCancelled();
    RemoteCommit commit = provider.resolveCommit(source, cancellation);
    cancellation.throwIfCancelled();
    RemoteTree tree = provider.listTree(source, commit.sha(), cancellation);
    if (tree.truncated()) {
      log.warn(
          "Tree listing of {}@{} was truncated; files beyond the listing limit are not imported",
          source.fullName(),
          commit.sha());
    }

    List<DiscoveredFile> files = new ArrayList<>();
    for (RemoteTreeEntry entry : tree.entries()) {
      if (!entry.isFile()) {
        continue;
      }
      Optional<MatchedEntry> matched = matcher.match(entry.path(), source.includes());
      matched.ifPresent(
          match ->
              files.add(
                  new DiscoveredFile(
                      PathMapper.stableId(entry.path()),
                      entry.path(),
                      PathMapper.targetPath(match),
                      match)));
    }
    log.debug(
        "Discovered {} of {} tree entries for {} at {}",
        files.size(),
        tree.entries().size(),
        source.displayName(),
        commit.sha());
    return new DiscoveryResult(commit, files, tree.truncated());
  }
}
