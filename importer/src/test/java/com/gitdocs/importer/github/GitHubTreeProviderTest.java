package com.gitdocs.importer.github;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gitdocs.importer.config.ImporterProperties;
import com.gitdocs.importer.remote.RemoteCommit;
import com.gitdocs.importer.source.SourceDescriptor;
import com.gitdocs.importer.sync.SyncCancellation;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kohsuke.github.GHCommit;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.HttpException;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.WebClient;

@ExtendWith(MockitoExtension.class)
class GitHubTreeProviderTest {

  @Mock private GitHubClientExecutor executor;
  @Mock private GitHub github;
  @Mock private GHRepository repository;

  private GitHubTreeProvider provider;

  @BeforeEach
  void setUp() {
    ImporterProperties.Retry retry = new ImporterProperties.Retry();
    retry.setInitialBackoff(Duration.ofMillis(1));
    retry.setMaxBackoff(Duration.ofMillis(5));
    RetryTemplate retryTemplate = RetryTemplates.create(retry);
    RawContentClient rawClient =
        new RawContentClient(WebClient.create(), retryTemplate, Duration.ofSeconds(1));
    provider =
        new GitHubTreeProvider(
            executor, rawClient, retryTemplate, "https://raw.githubusercontent.com");
  }

  @Test
  void commitishStripsQualifiedRefPrefixes() {
    assertThat(GitHubTreeProvider.commitish("main")).isEqualTo("main");
    assertThat(GitHubTreeProvider.commitish("refs/heads/release/1.x")).isEqualTo("release/1.x");
    assertThat(GitHubTreeProvider.commitish("refs/tags/v1.0")).isEqualTo("v1.0");
  }

  @Test
  void rawUriEncodesEachSegment() {
    SourceDescriptor source = SourceDescriptor.builder("org", "repo").ref("release/1.x").build();

    URI uri = provider.rawUri(source, "release/1.x", "docs/getting started.md");

    assertThat(uri.toString())
        .isEqualTo(
            "https://raw.githubusercontent.com/org/repo/release/1.x/docs/getting%20started.md");
  }

  @Test
  void resolvesCommitWithMessageAndDate() throws Exception {
    GHCommit commit = mock(GHCommit.class);
    GHCommit.ShortInfo info = mock(GHCommit.ShortInfo.class);
    Instant committed = Instant.parse("2026-10-01T10:00:00Z");
    when(github.getRepository("org/repo")).thenReturn(repository);
    when(repository.getCommit("main")).thenReturn(commit);
    when(commit.getSHA1()).thenReturn("abc123");
    when(commit.getCommitShortInfo()).thenReturn(info);
    when(info.getMessage()).thenReturn("Update docs\n\nDetails");
    when(info.getCommitDate()).thenReturn(Date.from(committed));
    runCallsAgainstMockClient();

    RemoteCommit resolved =
        provider.resolveCommit(
            SourceDescriptor.builder("org", "repo").ref("refs/heads/main").build(),
            SyncCancellation.none());

    assertThat(resolved.sha()).isEqualTo("abc123");
    assertThat(resolved.summary()).isEqualTo("Update docs");
    assertThat(resolved.date()).isEqualTo(committed);
  }

  @Test
  void retriesTransientApiFailures() throws Exception {
    GHCommit commit = mock(GHCommit.class);
    GHCommit.ShortInfo info = mock(GHCommit.ShortInfo.class);
    when(github.getRepository("org/repo")).thenReturn(repository);
    when(repository.getCommit("main"))
        .thenThrow(new HttpException("busy", 502, "Bad Gateway", "https://api.github.com"))
        .thenReturn(commit);
    when(commit.getSHA1()).thenReturn("abc123");
    when(commit.getCommitShortInfo()).thenReturn(info);
    runCallsAgainstMockClient();

    RemoteCommit resolved =
        provider.resolveCommit(
            SourceDescriptor.builder("org", "repo").build(), SyncCancellation.none());

    assertThat(resolved.sha()).isEqualTo("abc123");
    verify(repository, times(2)).getCommit("main");
  }

  @Test
  void missingRefIsNotRetried() throws Exception {
    when(github.getRepository("org/repo")).thenReturn(repository);
    when(repository.getCommit("nope")).thenThrow(new FileNotFoundException("no commit"));
    runCallsAgainstMockClient();

    assertThatThrownBy(
            () ->
                provider.resolveCommit(
                    SourceDescriptor.builder("org", "repo").ref("nope").build(),
                    SyncCancellation.none()))
        .isInstanceOf(GitHubClientException.class)
        .satisfies(ex -> assertThat(((GitHubClientException) ex).status()).isEqualTo(404));
    verify(repository, times(1)).getCommit("nope");
  }

  private void runCallsAgainstMockClient() {
    when(executor.execute(anyString(), any()))
        .thenAnswer(
            invocation -> {
              GitHubClientExecutor.GitHubCall<Object> call = invocation.getArgument(1);
              try {
                return call.apply(github);
              } catch (IOException ex) {
                throw GitHubClientExecutor.wrap(invocation.getArgument(0), ex);
              }
            });
  }
}
