package com.gitdocs.importer.fetch;

import com.gitdocs.importer.discovery.DiscoveredFile;
import com.gitdocs.importer.remote.ConditionalRequest;
import com.gitdocs.importer.remote.RawResponse;
import com.gitdocs.importer.remote.RemoteFetchException;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fetches document content with revalidation against the stored {@link CacheTag}. */
public class ConditionalFetcher {

  private static final Logger log = LoggerFactory.getLogger(ConditionalFetcher.class);

  private final RemoteTreeProvider provider;
  private final MetaStore metaStore;

  public ConditionalFetcher(RemoteTreeProvider provider, MetaStore metaStore) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.metaStore = Objects.requireNonNull(metaStore, "metaStore");
  }

  /**
   * @param ref commit the tree was listed at
   * @param localTarget absolute path of the imported copy, used when the remote reports no change
   * @param force skip revalidation and always download
   */
  public FetchOutcome fetch(
      SourceDescriptor source,
      String ref,
      DiscoveredFile file,
      Path localTarget,
      boolean force,
      SyncCancellation cancellation) {
    String id = file.id();
    ConditionalRequest conditions =
        force ? ConditionalRequest.none() : CacheTag.read(metaStore, id).toRequest();
    RawResponse response =
        provider.fetchRaw(source, ref, file.remotePath(), conditions, cancellation);

    if (response.isNotModified()) {
      if (Files.isRegularFile(localTarget)) {
        log.debug("Skipping {} as it has not changed", id);
        return FetchOutcome.unchanged(readLocal(localTarget));
      }
      log.info("File {} missing locally, re-fetching despite 304", id);
      CacheTag.clear(metaStore, id);
      RawResponse fresh =
          provider.fetchRaw(
              source, ref, file.remotePath(), ConditionalRequest.none(), cancellation);
      if (!fresh.isSuccess()) {
        throw new RemoteFetchException(
            "Unconditional fetch of %s returned %d".formatted(file.remotePath(), fresh.status()),
            fresh.status());
      }
      CacheTag.replace(metaStore, id, fresh.etag(), fresh.lastModified());
      return FetchOutcome.refetched(fresh.bodyAsString());
    }

    if (!response.isSuccess()) {
      throw new RemoteFetchException(
          "Fetch of %s returned %d".formatted(file.remotePath(), response.status()),
          response.status());
    }
    CacheTag.replace(metaStore, id, response.etag(), response.lastModified());
    return FetchOutcome.fetched(response.bodyAsString());
  }

  private static String readLocal(Path localTarget) {
    try {
      return Files.readString(localTarget, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read " + localTarget, ex);
    }
  }
}
