package com.gitdocs.importer.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gitdocs.importer.source.SourceDescriptor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The per-working-directory record of which commit each source was last imported at. Purely
 * advisory: an unreadable file is treated as empty and a failed write is logged.
 */
public class ImportStateStore {

  public static final String FILE_NAME = ".github-import-state.json";

  private static final Logger log = LoggerFactory.getLogger(ImportStateStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  public ImportStateStore(Path workingDirectory, ObjectMapper objectMapper, Clock clock) {
    this.file = Objects.requireNonNull(workingDirectory, "workingDirectory").resolve(FILE_NAME);
    this.objectMapper =
        Objects.requireNonNull(objectMapper, "objectMapper")
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Path file() {
    return file;
  }

  public StateFile load() {
    lock.lock();
    try {
      return read();
    } finally {
      lock.unlock();
    }
  }

  /** Prior state of {@code source}, or a never-imported placeholder. */
  public ImportState stateOf(SourceDescriptor source) {
    ImportState state = load().get(source.sourceId());
    return state != null
        ? state
        : ImportState.never(source.displayName(), source.sourceId(), source.ref());
  }

  public void recordImport(SourceDescriptor source, String commitSha) {
    ImportState state =
        new ImportState(
            source.displayName(), source.sourceId(), commitSha, clock.instant(), source.ref());
    update(current -> current.withImport(source.sourceId(), state));
  }

  public void markChecked() {
    Instant now = clock.instant();
    update(current -> current.withLastChecked(now));
  }

  private void update(UnaryOperator<StateFile> change) {
    lock.lock();
    try {
      write(change.apply(read()));
    } finally {
      lock.unlock();
    }
  }

  private StateFile read() {
    if (!Files.isRegularFile(file)) {
      return StateFile.empty(clock.instant());
    }
    try {
      StateFile state = objectMapper.readValue(file.toFile(), StateFile.class);
      return state != null ? state : StateFile.empty(clock.instant());
    } catch (IOException ex) {
      log.warn("Failed to load import state from {}, starting fresh: {}", file, ex.getMessage());
      return StateFile.empty(clock.instant());
    }
  }

  private void write(StateFile state) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = file.resolveSibling(FILE_NAME + ".tmp");
      objectMapper.writeValue(temp.toFile(), state);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      log.warn("Failed to save import state to {}: {}", file, ex.getMessage());
    }
  }
}
