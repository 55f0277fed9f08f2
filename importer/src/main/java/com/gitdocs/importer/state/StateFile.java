package com.gitdocs.importer.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StateFile(Map<String, ImportState> imports, Instant lastChecked) {

  public StateFile {
    imports =
        imports == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(imports));
  }

  public static StateFile empty(Instant now) {
    return new StateFile(Map.of(), now);
  }

  public ImportState get(String sourceId) {
    return imports.get(sourceId);
  }

  public StateFile withImport(String sourceId, ImportState state) {
    Map<String, ImportState> updated = new LinkedHashMap<>(imports);
    updated.put(sourceId, state);
    return new StateFile(updated, lastChecked);
  }

  public StateFile withLastChecked(Instant checked) {
    return new StateFile(imports, checked);
  }
}
