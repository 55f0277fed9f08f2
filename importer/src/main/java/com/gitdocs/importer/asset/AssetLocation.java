package com.gitdocs.importer.asset;

import com.gitdocs.importer.match.MatchedEntry;
import com.gitdocs.importer.match.PosixPaths;
import com.gitdocs.importer.source.AssetOptions;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Where a document's assets are stored and how they are referenced.
 *
 * @param directory project-relative directory receiving the files
 * @param baseUrl prefix of rewritten references
 */
public record AssetLocation(String directory, String baseUrl) {

  public static final String COLOCATED_DIRECTORY = "assets";

  private static final Logger log = LoggerFactory.getLogger(AssetLocation.class);

  /**
   * Explicit settings win. With neither set, assets go to an {@code assets} folder under the rule's
   * base path and are referenced relative to the document. Exactly one explicit setting is a
   * misconfiguration and disables asset handling.
   */
  public static Optional<AssetLocation> resolve(
      AssetOptions options, MatchedEntry entry, String targetPath) {
    boolean hasPath = StringUtils.hasText(options.assetsPath());
    boolean hasUrl = StringUtils.hasText(options.assetsBaseUrl());
    if (hasPath && hasUrl) {
      return Optional.of(
          new AssetLocation(options.assetsPath().trim(), options.assetsBaseUrl().trim()));
    }
    if (hasPath || hasUrl) {
      log.warn(
          "Asset handling skipped for {}: assetsPath and assetsBaseUrl must be set together",
          targetPath);
      return Optional.empty();
    }
    if (entry == null || !entry.hasRule() || !StringUtils.hasText(entry.basePath())) {
      return Optional.empty();
    }
    String directory = PosixPaths.join(entry.basePath(), COLOCATED_DIRECTORY);
    String documentDir = PosixPaths.dirname(targetPath);
    return Optional.of(new AssetLocation(directory, PosixPaths.relative(documentDir, directory)));
  }

  /** {@code baseUrl/fileName} with repeated slashes collapsed, a scheme's {@code //} excepted. */
  public String urlFor(String fileName) {
    return (baseUrl + "/" + fileName).replaceAll("(?<!:)/{2,}", "/");
  }
}
