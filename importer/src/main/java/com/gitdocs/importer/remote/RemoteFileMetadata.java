package com.gitdocs.importer.remote;

public record RemoteFileMetadata(
    String path, String type, String sha, long size, String downloadUrl) {

  public boolean isDownloadableFile() {
    return "file".equalsIgnoreCase(type) && downloadUrl != null && !downloadUrl.isBlank();
  }
}
