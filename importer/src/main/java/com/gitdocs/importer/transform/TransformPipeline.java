package com.gitdocs.importer.transform;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies source-wide transforms, then the matched rule's transforms, in declaration order. */
public class TransformPipeline {

  private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

  public String apply(String content, TransformContext context) {
    List<ContentTransform> transforms = transformsFor(context);
    String current = content;
    for (int i = 0; i < transforms.size(); i++) {
      try {
        String result = transforms.get(i).apply(current, context);
        if (result == null) {
          log.warn("Transform #{} returned null for {}; keeping previous content", i, context.id());
          continue;
        }
        current = result;
      } catch (RuntimeException ex) {
        log.warn("Transform #{} failed for {}: {}", i, context.id(), ex.getMessage(), ex);
      }
    }
    return current;
  }

  static List<ContentTransform> transformsFor(TransformContext context) {
    List<ContentTransform> transforms = new ArrayList<>(context.source().transforms());
    if (context.matchedEntry() != null && context.matchedEntry().hasRule()) {
      transforms.addAll(context.matchedEntry().rule().transforms());
    }
    return transforms;
  }
}
