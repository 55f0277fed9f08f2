package com.gitdocs.importer.sync;

public class SyncCancelledException extends RuntimeException {

  public SyncCancelledException(String message) {
    super(message);
  }
}
