package com.gitdocs.importer.github;

import com.gitdocs.importer.config.ImporterProperties;
import com.gitdocs.importer.remote.RemoteTreeProvider;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class GitHubClientConfiguration {

  private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

  @Bean
  public RemoteTreeProvider gitHubTreeProvider(ImporterProperties properties) {
    ImporterProperties.GitHub github = properties.getGithub();
    RetryTemplate retryTemplate = RetryTemplates.create(properties.getRetry());
    GitHubClientExecutor executor = new GitHubClientExecutor(new GitHubClientFactory(github));
    Duration blockTimeout =
        github.getConnectTimeout().plus(github.getReadTimeout()).multipliedBy(2);
    RawContentClient rawClient =
        new RawContentClient(rawWebClient(github), retryTemplate, blockTimeout);
    return new GitHubTreeProvider(executor, rawClient, retryTemplate, github.getRawBaseUrl());
  }

  static WebClient rawWebClient(ImporterProperties.GitHub github) {
    WebClient.Builder builder =
        WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, github.getUserAgent())
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .clientConnector(new ReactorClientHttpConnector(rawHttpClient(github)));
    if (StringUtils.hasText(github.getPersonalAccessToken())) {
      builder.defaultHeader(
          HttpHeaders.AUTHORIZATION, "token " + github.getPersonalAccessToken().trim());
    }
    return builder.build();
  }

  /** Client for raw downloads: follows redirects and asks for uncompressed bodies. */
  static HttpClient rawHttpClient(ImporterProperties.GitHub github) {
    return HttpClient.create()
        .responseTimeout(github.getReadTimeout())
        .proxyWithSystemProperties()
        .followRedirect(true)
        .compress(false)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) github.getConnectTimeout().toMillis());
  }
}
