package com.gitdocs.importer.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import com.gitdocs.importer.remote.ConditionalRequest;
import org.junit.jupiter.api.Test;

class CacheTagTest {

  private final InMemoryMetaStore store = new InMemoryMetaStore();

  @Test
  void etagTakesPrecedenceOverLastModified() {
    CacheTag.replace(store, "docs/a", "\"abc\"", "Tue, 01 Oct 2026 10:00:00 GMT");

    assertThat(store.snapshot()).containsOnlyKeys("docs/a-etag");
    assertThat(CacheTag.read(store, "docs/a").toRequest())
        .isEqualTo(new ConditionalRequest("\"abc\"", null));
  }

  @Test
  void lastModifiedIsUsedWhenNoEtag() {
    CacheTag.replace(store, "docs/a", null, "Tue, 01 Oct 2026 10:00:00 GMT");

    assertThat(store.snapshot()).containsOnlyKeys("docs/a-last-modified");
    assertThat(CacheTag.read(store, "docs/a").toRequest().lastModified())
        .isEqualTo("Tue, 01 Oct 2026 10:00:00 GMT");
  }

  @Test
  void replaceDropsStaleValidator() {
    CacheTag.replace(store, "docs/a", null, "Tue, 01 Oct 2026 10:00:00 GMT");
    CacheTag.replace(store, "docs/a", "\"new\"", null);

    assertThat(store.snapshot()).containsOnlyKeys("docs/a-etag");
  }

  @Test
  void emptyTagProducesUnconditionalRequest() {
    CacheTag tag = CacheTag.read(store, "docs/missing");

    assertThat(tag.isEmpty()).isTrue();
    assertThat(tag.toRequest().isConditional()).isFalse();
  }
}
