package com.gitdocs.importer.link;

/**
 * A document of the current batch with its final location.
 *
 * @param sourcePath remote path
 * @param targetPath project-relative local path
 * @param unchanged the remote reported no change and {@code content} is the existing local copy
 */
public record ImportedFile(
    String sourcePath,
    String targetPath,
    String content,
    String id,
    LinkTransformContext linkContext,
    boolean unchanged) {

  public ImportedFile withContent(String newContent) {
    return new ImportedFile(sourcePath, targetPath, newContent, id, linkContext, unchanged);
  }
}
