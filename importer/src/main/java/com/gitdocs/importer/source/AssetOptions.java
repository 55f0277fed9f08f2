package com.gitdocs.importer.source;

import java.util.List;
import java.util.Locale;

public record AssetOptions(String assetsPath, String assetsBaseUrl, List<String> extensions) {

  public static final List<String> DEFAULT_EXTENSIONS =
      List.of(".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp", ".ico", ".bmp");

  public AssetOptions {
    extensions =
        extensions == null || extensions.isEmpty()
            ? DEFAULT_EXTENSIONS
            : extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
  }

  public static AssetOptions defaults() {
    return new AssetOptions(null, null, List.of());
  }
}
