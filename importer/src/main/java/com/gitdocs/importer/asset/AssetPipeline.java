package com.gitdocs.importer.asset;

import com.gitdocs.importer.discovery.DiscoveredFile;
import com.gitdocs.importer.match.PosixPaths;
import com.gitdocs.importer.remote.RemoteFetchException;
import com.gitdocs.importer.remote.RemoteFileMetadata;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.store.Digests;
import com.gitdocs.importer.store.DocumentWriter;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies images a document embeds into the local asset directory and points the document at the
 * copies. A file that already exists under the generated name is not fetched again.
 */
public class AssetPipeline {

  private static final Logger log = LoggerFactory.getLogger(AssetPipeline.class);
  private static final int SUFFIX_LENGTH = 10;

  private final RemoteTreeProvider provider;
  private final DocumentWriter writer;
  private final Executor executor;

  public AssetPipeline(RemoteTreeProvider provider, DocumentWriter writer, Executor executor) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public AssetResult process(
      String content,
      SourceDescriptor source,
      String ref,
      DiscoveredFile file,
      SyncCancellation cancellation) {
    List<String> detected = AssetDetector.detect(content, source.assets().extensions());
    if (detected.isEmpty()) {
      return AssetResult.untouched(content);
    }
    Optional<AssetLocation> location =
        AssetLocation.resolve(source.assets(), file.entry(), file.targetPath());
    if (location.isEmpty()) {
      log.debug("No asset location for {}; leaving {} references", file.id(), detected.size());
      return AssetResult.untouched(content);
    }
    Path directory = writer.resolve(location.get().directory());
    log.debug("Processing {} assets for {}", detected.size(), file.remotePath());

    AssetLocation target = location.get();
    List<CompletableFuture<Optional<Outcome>>> futures = new ArrayList<>();
    for (String reference : detected) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> processOne(reference, source, ref, file, target, directory, cancellation),
              executor));
    }

    List<AssetReference> rewritten = new ArrayList<>();
    int downloaded = 0;
    int cached = 0;
    for (CompletableFuture<Optional<Outcome>> future : futures) {
      Optional<Outcome> outcome = join(future);
      if (outcome.isEmpty()) {
        continue;
      }
      rewritten.add(outcome.get().reference());
      if (outcome.get().downloaded()) {
        downloaded++;
      } else {
        cached++;
      }
    }
    log.debug(
        "Processed {} assets for {}: {} downloaded, {} cached",
        rewritten.size(),
        file.id(),
        downloaded,
        cached);
    return new AssetResult(rewrite(content, rewritten), downloaded, cached, rewritten);
  }

  private Optional<Outcome> processOne(
      String reference,
      SourceDescriptor source,
      String ref,
      DiscoveredFile file,
      AssetLocation location,
      Path directory,
      SyncCancellation cancellation) {
    String remotePath = PosixPaths.join(PosixPaths.dirname(file.remotePath()), reference);
    String fileName = localFileName(remotePath, file.id());
    Path localFile = writer.paths().requireWithinRoot(directory.resolve(fileName));
    AssetReference assetReference =
        new AssetReference(reference, remotePath, localFile, location.urlFor(fileName));
    try {
      if (Files.exists(localFile)) {
        log.debug("Asset {} cached at {}", reference, fileName);
        return Optional.of(new Outcome(assetReference, false));
      }
      cancellation.throwIfCancelled();
      RemoteFileMetadata metadata = provider.fetchMetadata(source, ref, remotePath, cancellation);
      if (!metadata.isDownloadableFile()) {
        throw new RemoteFetchException(
            "Asset %s is not a downloadable file (type: %s)"
                .formatted(remotePath, metadata.type()),
            404);
      }
      byte[] bytes = provider.download(metadata.downloadUrl(), cancellation);
      writer.writeBytes(localFile, bytes);
      log.debug("Downloaded asset {} from {}@{}:{}", reference, source.fullName(), ref, remotePath);
      return Optional.of(new Outcome(assetReference, true));
    } catch (SyncCancelledException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.warn("Failed to process asset {} in {}: {}", reference, file.id(), ex.getMessage());
      return Optional.empty();
    }
  }

  /** {@code {stem}-{hash}{ext}}; the hash covers the resolved remote path and the document id. */
  static String localFileName(String remotePath, String documentId) {
    String name = PosixPaths.basename(remotePath);
    String extension = PosixPaths.extension(name);
    String stem = name.substring(0, name.length() - extension.length());
    String hash = Digests.sha256Hex(remotePath + "\n" + documentId).substring(0, SUFFIX_LENGTH);
    return stem + "-" + hash + extension;
  }

  static String rewrite(String content, List<AssetReference> references) {
    String result = content;
    for (AssetReference reference : references) {
      String quoted = Pattern.quote(reference.original());
      String replacement = Matcher.quoteReplacement(reference.localUrl());
      result =
          Pattern.compile("(!\\[[^\\]]*\\]\\(\\s*<?)" + quoted + "(>?(?:\\s+[^)]*)?\\s*\\))")
              .matcher(result)
              .replaceAll("$1" + replacement + "$2");
      result =
          Pattern.compile(
                  "(<img[^>]+src\\s*=\\s*[\"'])" + quoted + "([\"'][^>]*>)",
                  Pattern.CASE_INSENSITIVE)
              .matcher(result)
              .replaceAll("$1" + replacement + "$2");
    }
    return result;
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw ex;
    }
  }

  private record Outcome(AssetReference reference, boolean downloaded) {}
}
