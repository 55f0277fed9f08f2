package com.gitdocs.importer.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gitdocs.importer.link.ImportedFile;
import com.gitdocs.importer.link.LinkTransformContext;
import com.gitdocs.importer.source.ProjectPaths;
import com.gitdocs.importer.source.SourceConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntryPersisterTest {

  @TempDir Path projectRoot;

  private InMemoryContentStore store;
  private DocumentWriter writer;
  private EntryPersister persister;

  @BeforeEach
  void setUp() {
    store = new InMemoryContentStore();
    writer = new DocumentWriter(new ProjectPaths(projectRoot));
    persister = new EntryPersister(store, writer);
  }

  @Test
  void writesFileAndStoresParsedEntry() throws IOException {
    PersistResult result =
        persister.persist(file("out/intro.md", "---\ntitle: Intro\n---\nHello\n"), false);

    assertThat(result.fileWritten()).isTrue();
    assertThat(result.changed()).isTrue();
    assertThat(Files.readString(projectRoot.resolve("out/intro.md")))
        .isEqualTo("---\ntitle: Intro\n---\nHello\n");
    ContentEntry entry = store.get("docs/intro");
    assertThat(entry.body()).isEqualTo("Hello\n");
    assertThat(entry.data()).containsEntry("title", "Intro");
    assertThat(entry.filePath()).isEqualTo("out/intro.md");
    assertThat(entry.digest()).isEqualTo(Digests.sha256Hex("---\ntitle: Intro\n---\nHello\n"));
  }

  @Test
  void identicalContentIsANoOp() {
    persister.persist(file("out/intro.md", "Hello"), false);
    long writes = writer.writeCount();
    long mutations = store.mutationCount();

    PersistResult result = persister.persist(file("out/intro.md", "Hello"), false);

    assertThat(result).isEqualTo(PersistResult.SKIPPED);
    assertThat(writer.writeCount()).isEqualTo(writes);
    assertThat(store.mutationCount()).isEqualTo(mutations);
  }

  @Test
  void deletedFileIsRewrittenEvenWithSameDigest() throws IOException {
    persister.persist(file("out/intro.md", "Hello"), false);
    Files.delete(projectRoot.resolve("out/intro.md"));

    PersistResult result = persister.persist(file("out/intro.md", "Hello"), false);

    assertThat(result.fileWritten()).isTrue();
    assertThat(projectRoot.resolve("out/intro.md")).exists();
  }

  @Test
  void clearDeletesExistingEntryBeforeSetting() {
    persister.persist(file("out/intro.md", "Hello"), true);
    long mutations = store.mutationCount();

    persister.persist(file("out/intro.md", "Hello again"), true);

    assertThat(store.mutationCount()).isEqualTo(mutations + 2);
    assertThat(store.get("docs/intro").body()).isEqualTo("Hello again");
  }

  @Test
  void refusesTargetsOutsideProjectRoot() {
    assertThatThrownBy(() -> persister.persist(file("../escape.md", "x"), false))
        .isInstanceOf(SourceConfigurationException.class);
  }

  private static ImportedFile file(String targetPath, String content) {
    return new ImportedFile(
        "docs/intro.md",
        targetPath,
        content,
        "docs/intro",
        new LinkTransformContext("Docs", "docs/**", "out", 0),
        false);
  }
}
