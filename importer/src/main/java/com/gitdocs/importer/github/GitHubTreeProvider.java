package com.gitdocs.importer.github;

import com.gitdocs.importer.remote.ConditionalRequest;
import com.gitdocs.importer.remote.RawResponse;
import com.gitdocs.importer.remote.RemoteCommit;
import com.gitdocs.importer.remote.RemoteFileMetadata;
import com.gitdocs.importer.remote.RemoteTree;
import com.gitdocs.importer.remote.RemoteTreeEntry;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.kohsuke.github.GHCommit;
import org.kohsuke.github.GHContent;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHTree;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

/** {@link RemoteTreeProvider} backed by the GitHub REST API and the raw content host. */
public class GitHubTreeProvider implements RemoteTreeProvider {

  private static final Logger log = LoggerFactory.getLogger(GitHubTreeProvider.class);

  private final GitHubClientExecutor executor;
  private final RawContentClient rawClient;
  private final RetryTemplate retryTemplate;
  private final String rawBaseUrl;
  private final Map<String, GHRepository> repositories = new ConcurrentHashMap<>();

  GitHubTreeProvider(
      GitHubClientExecutor executor,
      RawContentClient rawClient,
      RetryTemplate retryTemplate,
      String rawBaseUrl) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.rawClient = Objects.requireNonNull(rawClient, "rawClient");
    this.retryTemplate = Objects.requireNonNull(retryTemplate, "retryTemplate");
    this.rawBaseUrl = Objects.requireNonNull(rawBaseUrl, "rawBaseUrl");
  }

  @Override
  public RemoteCommit resolveCommit(SourceDescriptor source, SyncCancellation cancellation) {
    String ref = source.ref();
    return withRetry(
        cancellation,
        () ->
            executor.execute(
                "Failed to resolve ref %s of %s".formatted(ref, source.fullName()),
                github -> {
                  GHCommit commit = repository(github, source).getCommit(commitish(ref));
                  GHCommit.ShortInfo info = commit.getCommitShortInfo();
                  return new RemoteCommit(
                      commit.getSHA1(), info.getMessage(), toInstant(info.getCommitDate()));
                }));
  }

  @Override
  public RemoteTree listTree(
      SourceDescriptor source, String commitSha, SyncCancellation cancellation) {
    return withRetry(
        cancellation,
        () ->
            executor.execute(
                "Failed to fetch repository tree for %s".formatted(source.fullName()),
                github -> {
                  GHTree tree = repository(github, source).getTreeRecursive(commitSha, 1);
                  List<RemoteTreeEntry> entries =
                      tree.getTree().stream()
                          .map(
                              entry ->
                                  new RemoteTreeEntry(
                                      entry.getPath(),
                                      entry.getType(),
                                      entry.getSha(),
                                      entry.getSize()))
                          .toList();
                  return new RemoteTree(commitSha, entries, tree.isTruncated());
                }));
  }

  @Override
  public RawResponse fetchRaw(
      SourceDescriptor source,
      String ref,
      String path,
      ConditionalRequest conditions,
      SyncCancellation cancellation) {
    URI uri = rawUri(source, ref, path);
    log.debug(
        "Fetching {} (conditional: {})", uri, conditions != null && conditions.isConditional());
    return rawClient.get(uri, conditions, cancellation);
  }

  @Override
  public RemoteFileMetadata fetchMetadata(
      SourceDescriptor source, String ref, String path, SyncCancellation cancellation) {
    return withRetry(
        cancellation,
        () ->
            executor.execute(
                "Failed to fetch metadata of %s from %s".formatted(path, source.fullName()),
                github -> {
                  GHContent content = repository(github, source).getFileContent(path, ref);
                  if (content == null) {
                    throw new GitHubClientException(
                        "GitHub returned null content for %s/%s"
                            .formatted(source.fullName(), path));
                  }
                  return new RemoteFileMetadata(
                      content.getPath(),
                      content.getType(),
                      content.getSha(),
                      content.getSize(),
                      content.getDownloadUrl());
                }));
  }

  @Override
  public byte[] download(String downloadUrl, SyncCancellation cancellation) {
    if (!StringUtils.hasText(downloadUrl)) {
      throw new IllegalArgumentException("downloadUrl must not be blank");
    }
    return rawClient.download(URI.create(downloadUrl), cancellation);
  }

  URI rawUri(SourceDescriptor source, String ref, String path) {
    return UriComponentsBuilder.fromUriString(rawBaseUrl)
        .pathSegment(source.owner(), source.repo())
        .pathSegment(ref.split("/"))
        .pathSegment(path.split("/"))
        .encode()
        .build()
        .toUri();
  }

  private <T> T withRetry(SyncCancellation cancellation, Supplier<T> call) {
    return retryTemplate.execute(
        context -> {
          cancellation.throwIfCancelled();
          return call.get();
        });
  }

  private GHRepository repository(GitHub github, SourceDescriptor source) throws IOException {
    String fullName = source.fullName();
    GHRepository cached = repositories.get(fullName);
    if (cached != null) {
      return cached;
    }
    GHRepository repository = github.getRepository(fullName);
    repositories.put(fullName, repository);
    return repository;
  }

  /** Commits endpoint form of a ref; fully qualified refs lose their {@code refs/...} prefix. */
  static String commitish(String ref) {
    String trimmed = ref.trim();
    if (trimmed.startsWith("refs/heads/")) {
      return trimmed.substring("refs/heads/".length());
    }
    if (trimmed.startsWith("refs/tags/")) {
      return trimmed.substring("refs/tags/".length());
    }
    if (trimmed.startsWith("refs/")) {
      return trimmed.substring("refs/".length());
    }
    return trimmed;
  }

  private static Instant toInstant(Date date) {
    return date != null ? date.toInstant() : null;
  }
}
