package com.gitdocs.importer.store;

public record PersistResult(boolean fileWritten, boolean stored) {

  public static final PersistResult SKIPPED = new PersistResult(false, false);

  public boolean changed() {
    return fileWritten || stored;
  }
}
