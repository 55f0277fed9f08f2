package com.gitdocs.importer.sync;

/**
 * @param dryRun only report which sources changed upstream
 * @param force download every file without revalidation
 */
public record ImportOptions(boolean dryRun, boolean force) {

  public static ImportOptions defaults() {
    return new ImportOptions(false, false);
  }
}
