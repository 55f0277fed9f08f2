package com.gitdocs.importer.sync;

public enum ImportStatus {
  SUCCESS,
  ERROR,
  CANCELLED
}
