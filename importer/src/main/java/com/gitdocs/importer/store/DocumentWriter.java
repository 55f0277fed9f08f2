package com.gitdocs.importer.store;

import com.gitdocs.importer.source.ProjectPaths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes documents and assets below the project root, creating directories on demand. */
public class DocumentWriter {

  private static final Logger log = LoggerFactory.getLogger(DocumentWriter.class);

  private final ProjectPaths paths;
  private final AtomicLong writes = new AtomicLong();

  public DocumentWriter(ProjectPaths paths) {
    this.paths = Objects.requireNonNull(paths, "paths");
  }

  public ProjectPaths paths() {
    return paths;
  }

  /** Resolves a project-relative path, rejecting anything outside the project root. */
  public Path resolve(String relativePath) {
    return paths.resolve(relativePath);
  }

  /** Writes {@code content} unless the file already holds exactly that text. */
  public boolean writeText(Path target, String content) {
    Path safe = paths.requireWithinRoot(target);
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    try {
      if (Files.isRegularFile(safe) && Arrays.equals(Files.readAllBytes(safe), bytes)) {
        return false;
      }
      write(safe, bytes);
      return true;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write " + safe, ex);
    }
  }

  public void writeBytes(Path target, byte[] bytes) {
    Path safe = paths.requireWithinRoot(target);
    try {
      write(safe, bytes);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write " + safe, ex);
    }
  }

  /** Number of files written since this writer was created. */
  public long writeCount() {
    return writes.get();
  }

  private void write(Path target, byte[] bytes) throws IOException {
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(target, bytes);
    writes.incrementAndGet();
    log.debug("Wrote {} ({} bytes)", paths.relativize(target), bytes.length);
  }
}
