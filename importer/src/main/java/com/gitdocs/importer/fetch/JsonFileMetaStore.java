package com.gitdocs.importer.fetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link MetaStore} kept in memory and written to a JSON file on {@link #flush()}. */
public class JsonFileMetaStore implements MetaStore {

  public static final String FILE_NAME = ".github-import-meta.json";

  private static final Logger log = LoggerFactory.getLogger(JsonFileMetaStore.class);
  private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Map<String, String> values = new ConcurrentHashMap<>();
  private final AtomicBoolean dirty = new AtomicBoolean();
  private final ReentrantLock writeLock = new ReentrantLock();

  public JsonFileMetaStore(Path workingDirectory, ObjectMapper objectMapper) {
    this.file = Objects.requireNonNull(workingDirectory, "workingDirectory").resolve(FILE_NAME);
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    load();
  }

  @Override
  public String get(String key) {
    return values.get(key);
  }

  @Override
  public void set(String key, String value) {
    String previous = value == null ? values.remove(key) : values.put(key, value);
    if (!Objects.equals(previous, value)) {
      dirty.set(true);
    }
  }

  @Override
  public void delete(String key) {
    if (values.remove(key) != null) {
      dirty.set(true);
    }
  }

  @Override
  public void flush() {
    if (!dirty.get()) {
      return;
    }
    writeLock.lock();
    try {
      if (!dirty.getAndSet(false)) {
        return;
      }
      Files.createDirectories(file.toAbsolutePath().getParent());
      Path temp = file.resolveSibling(FILE_NAME + ".tmp");
      objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(temp.toFile(), new TreeMap<>(values));
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Wrote {} cache tags to {}", values.size(), file);
    } catch (IOException ex) {
      dirty.set(true);
      throw new UncheckedIOException("Failed to write cache tags to " + file, ex);
    } finally {
      writeLock.unlock();
    }
  }

  Path file() {
    return file;
  }

  private void load() {
    if (!Files.isRegularFile(file)) {
      return;
    }
    try {
      Map<String, String> stored = objectMapper.readValue(file.toFile(), MAP_TYPE);
      if (stored != null) {
        stored.forEach(
            (key, value) -> {
              if (key != null && value != null) {
                values.put(key, value);
              }
            });
      }
    } catch (IOException ex) {
      log.warn("Ignoring unreadable cache tag file {}: {}", file, ex.getMessage());
    }
  }
}
