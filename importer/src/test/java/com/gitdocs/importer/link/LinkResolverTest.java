package com.gitdocs.importer.link;

import static org.assertj.core.api.Assertions.assertThat;

import com.gitdocs.importer.source.IncludeRule;
import com.gitdocs.importer.source.LinkOptions;
import com.gitdocs.importer.source.SourceDescriptor;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class LinkResolverTest {

  private static final String BASE = "src/content/docs/guide";
  private static final LinkTransformContext RULE_CONTEXT =
      new LinkTransformContext("Docs", "docs/**/*.md", BASE, 0);

  @Test
  void relativeLinkToBatchDocumentBecomesSiteUrl() {
    assertThat(resolveFromA("[b](./b.md)")).isEqualTo("[b](/guide/b/)");
    assertThat(resolveFromA("[b](b.md#setup)")).isEqualTo("[b](/guide/b/#setup)");
  }

  @Test
  void externalAndAnchorLinksAreByteIdentical() {
    String content =
        "[x](https://example.com/a.md) [y](#local-part) [m](mailto:dev@example.com) "
            + "[p](//cdn.example.com/a.md)";

    assertThat(resolveFromA(content)).isEqualTo(content);
  }

  @Test
  void unresolvedLinkLosesExtensionAndKeepsAnchor() {
    assertThat(resolveFromA("[gone](./missing.md#part)")).isEqualTo("[gone](docs/missing#part)");
  }

  @Test
  void folderRenameReachesRenamedDocument() {
    assertThat(resolveFromA("[auth](./api/auth.md#tokens)"))
        .isEqualTo("[auth](/guide/reference/auth/#tokens)");
  }

  @Test
  void folderRenameAppliesToDocumentsOutsideBatch() {
    assertThat(resolveFromA("[old](./api/removed.md)"))
        .isEqualTo("[old](/guide/reference/removed/)");
  }

  @Test
  void directoryLinkFindsIndexDocument() {
    assertThat(resolveFromA("[api](./api/)")).isEqualTo("[api](/guide/reference/)");
  }

  @Test
  void imageEmbedsAndTitlesArePreserved() {
    assertThat(resolveFromA("![pic](./b.md)")).isEqualTo("![pic](./b.md)");
    assertThat(resolveFromA("[b](./b.md \"Bee\")")).isEqualTo("[b](/guide/b/ \"Bee\")");
  }

  @Test
  void linkWrappingImageIsRewrittenAndImageKept() {
    assertThat(resolveFromA("[![shot](./assets/shot-abc.png)](./b.md)"))
        .isEqualTo("[![shot](./assets/shot-abc.png)](/guide/b/)");
    assertThat(resolveFromA("[![a](x.png) ![b](y.png)](./b.md#top) ![c](z.png)"))
        .isEqualTo("[![a](x.png) ![b](y.png)](/guide/b/#top) ![c](z.png)");
  }

  @Test
  void nonGlobalMappingHandlesUnresolvedLinks() {
    LinkMapping external =
        LinkMapping.regex(Pattern.compile("^docs/external/(.*)\\.md$"), "https://other.test/$1");
    LinkResolver resolver = new LinkResolver(List.of("src/content/docs"), List.of(external), null);

    ImportedFile result = resolver.resolveAll(batch("[e](./external/x.md#y)")).get(0);

    assertThat(result.content()).isEqualTo("[e](https://other.test/x#y)");
  }

  @Test
  void handlerRunsWhenNothingElseMatches() {
    LinkHandler legacy =
        new LinkHandler() {
          @Override
          public boolean test(String link, LinkContext context) {
            return link.startsWith("docs/legacy/");
          }

          @Override
          public String transform(String link, LinkContext context) {
            return "/archive/" + link.substring("docs/legacy/".length());
          }
        };
    LinkResolver resolver = new LinkResolver(List.of(), List.of(), List.of(legacy));

    ImportedFile result = resolver.resolveAll(batch("[l](./legacy/page.md#top)")).get(0);

    assertThat(result.content()).isEqualTo("[l](/archive/page.md#top)");
  }

  @Test
  void contextFilterRestrictsMapping() {
    LinkMapping otherRuleOnly =
        LinkMapping.literal("docs/missing", "/elsewhere")
            .withContextFilter(context -> context.ruleIndex() == 1);
    LinkResolver resolver = new LinkResolver(List.of(), List.of(otherRuleOnly), null);

    ImportedFile result = resolver.resolveAll(batch("[m](./missing.md)")).get(0);

    assertThat(result.content()).isEqualTo("[m](docs/missing)");
  }

  @Test
  void unchangedDocumentsAreIndexedButNotRewritten() {
    ImportedFile unchanged =
        new ImportedFile(
            "docs/a.md", BASE + "/a.md", "[b](./b.md)", "docs/a", RULE_CONTEXT, true);
    ImportedFile changed =
        new ImportedFile(
            "docs/b.md", BASE + "/b.md", "[a](./a.md)", "docs/b", RULE_CONTEXT, false);

    List<ImportedFile> resolved =
        LinkResolver.forSource(source()).resolveAll(List.of(unchanged, changed));

    assertThat(resolved.get(0).content()).isEqualTo("[b](./b.md)");
    assertThat(resolved.get(1).content()).isEqualTo("[a](/guide/a/)");
  }

  private static String resolveFromA(String content) {
    return LinkResolver.forSource(source()).resolveAll(batch(content)).get(0).content();
  }

  private static List<ImportedFile> batch(String contentOfA) {
    return List.of(
        new ImportedFile("docs/a.md", BASE + "/a.md", contentOfA, "docs/a", RULE_CONTEXT, false),
        new ImportedFile("docs/b.md", BASE + "/b.md", "B", "docs/b", RULE_CONTEXT, false),
        new ImportedFile(
            "docs/api/auth.md",
            BASE + "/reference/auth.md",
            "Auth",
            "docs/api/auth",
            RULE_CONTEXT,
            false),
        new ImportedFile(
            "docs/api/index.md",
            BASE + "/reference/index.md",
            "API",
            "docs/api/index",
            RULE_CONTEXT,
            false));
  }

  private static SourceDescriptor source() {
    return SourceDescriptor.builder("org", "repo")
        .include(IncludeRule.of("docs/**/*.md", BASE).withRenames(Map.of("docs/api/", "reference")))
        .links(new LinkOptions(List.of("src/content/docs"), List.of(), List.of(), true))
        .build();
  }
}
