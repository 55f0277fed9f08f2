package com.gitdocs.importer.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gitdocs.importer.discovery.DiscoveredFile;
import com.gitdocs.importer.match.MatchedEntry;
import com.gitdocs.importer.remote.FakeRemoteTreeProvider;
import com.gitdocs.importer.source.AssetOptions;
import com.gitdocs.importer.source.IncludeRule;
import com.gitdocs.importer.source.ProjectPaths;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.store.DocumentWriter;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssetPipelineTest {

  private static final byte[] LOGO = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};
  private static final IncludeRule RULE = IncludeRule.of("docs/**/*.md", "out/docs");
  private static final DiscoveredFile FILE =
      new DiscoveredFile(
          "docs/guide/intro",
          "docs/guide/intro.md",
          "out/docs/guide/intro.md",
          new MatchedEntry("docs/guide/intro.md", 0, RULE));

  @TempDir Path projectRoot;

  private FakeRemoteTreeProvider provider;
  private AssetPipeline pipeline;

  @BeforeEach
  void setUp() {
    provider = new FakeRemoteTreeProvider().binary("docs/images/logo.png", LOGO);
    pipeline =
        new AssetPipeline(
            provider, new DocumentWriter(new ProjectPaths(projectRoot)), Runnable::run);
  }

  @Test
  void downloadsColocatedAssetAndRewritesReference() throws IOException {
    SourceDescriptor source = SourceDescriptor.builder("org", "repo").include(RULE).build();

    AssetResult result =
        pipeline.process(
            "Intro ![logo](../images/logo.png)", source, "c0ffee", FILE, SyncCancellation.none());

    assertThat(result.downloaded()).isEqualTo(1);
    assertThat(result.content())
        .matches("Intro !\\[logo\\]\\(\\.\\./assets/logo-[0-9a-f]{10}\\.png\\)");
    AssetReference reference = result.references().get(0);
    assertThat(reference.remotePath()).isEqualTo("docs/images/logo.png");
    assertThat(reference.localFile().getParent())
        .isEqualTo(projectRoot.resolve("out/docs/assets"));
    assertThat(Files.readAllBytes(reference.localFile())).isEqualTo(LOGO);
  }

  @Test
  void existingLocalCopyIsNotDownloadedAgain() {
    SourceDescriptor source = SourceDescriptor.builder("org", "repo").include(RULE).build();
    String content = "![logo](../images/logo.png)";
    AssetResult first =
        pipeline.process(content, source, "c0ffee", FILE, SyncCancellation.none());

    AssetResult second =
        pipeline.process(content, source, "c0ffee", FILE, SyncCancellation.none());

    assertThat(second.cached()).isEqualTo(1);
    assertThat(second.downloaded()).isZero();
    assertThat(second.content()).isEqualTo(first.content());
    assertThat(provider.downloads()).isEqualTo(1);
  }

  @Test
  void explicitLocationUsesConfiguredUrl() {
    SourceDescriptor source =
        SourceDescriptor.builder("org", "repo")
            .include(RULE)
            .assets(new AssetOptions("public/assets", "/assets", List.of("png")))
            .build();

    AssetResult result =
        pipeline.process(
            "<img src=\"../images/logo.png\" alt=\"logo\">",
            source,
            "c0ffee",
            FILE,
            SyncCancellation.none());

    assertThat(result.content())
        .matches("<img src=\"/assets/logo-[0-9a-f]{10}\\.png\" alt=\"logo\">");
    assertThat(projectRoot.resolve("public/assets")).isDirectory();
  }

  @Test
  void failedAssetLeavesReferenceUntouched() {
    SourceDescriptor source = SourceDescriptor.builder("org", "repo").include(RULE).build();
    String content = "![gone](./missing.png) ![logo](../images/logo.png)";

    AssetResult result =
        pipeline.process(content, source, "c0ffee", FILE, SyncCancellation.none());

    assertThat(result.downloaded()).isEqualTo(1);
    assertThat(result.content()).startsWith("![gone](./missing.png) ![logo](../assets/logo-");
  }

  @Test
  void cancellationPropagates() {
    SourceDescriptor source = SourceDescriptor.builder("org", "repo").include(RULE).build();
    SyncCancellation cancellation = SyncCancellation.create();
    cancellation.cancel();

    assertThatThrownBy(
            () ->
                pipeline.process(
                    "![logo](../images/logo.png)", source, "c0ffee", FILE, cancellation))
        .isInstanceOf(SyncCancelledException.class);
  }

  @Test
  void fileNameHashDependsOnDocument() {
    String first = AssetPipeline.localFileName("docs/images/logo.png", "docs/a");
    String second = AssetPipeline.localFileName("docs/images/logo.png", "docs/b");

    assertThat(first).startsWith("logo-").endsWith(".png").isNotEqualTo(second);
    assertThat(AssetPipeline.localFileName("docs/images/logo.png", "docs/a")).isEqualTo(first);
  }

  @Test
  void rewriteKeepsImageTitles() {
    AssetReference reference =
        new AssetReference(
            "./a.png", "docs/a.png", projectRoot.resolve("a.png"), "/assets/a-1.png");

    assertThat(AssetPipeline.rewrite("![a](./a.png \"Title\")", List.of(reference)))
        .isEqualTo("![a](/assets/a-1.png \"Title\")");
  }
}
