package com.gitdocs.importer.store;

import com.gitdocs.importer.link.ImportedFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes a resolved document to disk and records it in the destination store. */
public class EntryPersister {

  private static final Logger log = LoggerFactory.getLogger(EntryPersister.class);

  private final ContentStore store;
  private final DocumentWriter writer;

  public EntryPersister(ContentStore store, DocumentWriter writer) {
    this.store = Objects.requireNonNull(store, "store");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  /**
   * Does nothing when the store already holds the same digest and the file exists. Otherwise the
   * file is written if missing or different and the entry is set; with {@code clear} an existing
   * entry is deleted first.
   */
  public PersistResult persist(ImportedFile file, boolean clear) {
    String digest = Digests.sha256Hex(file.content());
    Path target = writer.resolve(file.targetPath());
    ContentEntry existing = store.get(file.id());
    if (existing != null
        && digest.equals(existing.digest())
        && existing.filePath() != null
        && Files.isRegularFile(target)) {
      log.debug("Entry {} is up to date", file.id());
      return PersistResult.SKIPPED;
    }

    boolean written = writer.writeText(target, file.content());
    if (written) {
      log.info("Wrote {} to {}", file.id(), file.targetPath());
    }
    Frontmatter frontmatter = FrontmatterParser.parse(file.content());
    ContentEntry entry =
        new ContentEntry(
            file.id(), frontmatter.body(), frontmatter.data(), file.targetPath(), digest, null);
    if (clear && existing != null) {
      store.delete(file.id());
    }
    store.set(entry);
    return new PersistResult(written, true);
  }
}
