package com.gitdocs.importer.asset;

import java.util.List;

public record AssetResult(
    String content, int downloaded, int cached, List<AssetReference> references) {

  public AssetResult {
    references = references == null ? List.of() : List.copyOf(references);
  }

  public static AssetResult untouched(String content) {
    return new AssetResult(content, 0, 0, List.of());
  }
}
