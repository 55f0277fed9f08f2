package com.gitdocs.importer.remote;

public record RemoteTreeEntry(String path, String type, String sha, long size) {

  public boolean isFile() {
    return "blob".equalsIgnoreCase(type);
  }
}
