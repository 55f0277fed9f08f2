package com.gitdocs.importer.remote;

import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;

/**
 * The remote operations the engine needs. Implementations must honour the cancellation token on
 * every call and throw {@link com.gitdocs.importer.sync.SyncCancelledException} once it fires.
 */
public interface RemoteTreeProvider {

  /** Resolves the source's ref (branch, tag or sha) to the commit it currently points at. */
  RemoteCommit resolveCommit(SourceDescriptor source, SyncCancellation cancellation);

  /** Lists every entry of the commit's tree in a single recursive call. */
  RemoteTree listTree(SourceDescriptor source, String commitSha, SyncCancellation cancellation);

  /** Fetches raw file bytes at {@code ref}, honouring the revalidation headers. */
  RawResponse fetchRaw(
      SourceDescriptor source,
      String ref,
      String path,
      ConditionalRequest conditions,
      SyncCancellation cancellation);

  /** Metadata of a single file at {@code ref}, used to obtain its byte download URL. */
  RemoteFileMetadata fetchMetadata(
      SourceDescriptor source, String ref, String path, SyncCancellation cancellation);

  /** Downloads the bytes behind a URL returned by {@link #fetchMetadata}. */
  byte[] download(String downloadUrl, SyncCancellation cancellation);
}
