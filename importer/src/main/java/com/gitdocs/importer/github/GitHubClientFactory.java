package com.gitdocs.importer.github;

import com.gitdocs.importer.config.ImporterProperties;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.util.StringUtils;

class GitHubClientFactory {

  private final ImporterProperties.GitHub properties;

  GitHubClientFactory(ImporterProperties.GitHub properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  GitHub createClient() throws IOException {
    GitHubBuilder builder = configure(new GitHubBuilder());
    String token = properties.getPersonalAccessToken();
    if (StringUtils.hasText(token)) {
      builder.withOAuthToken(token.trim());
    }
    return builder.build();
  }

  private GitHubBuilder configure(GitHubBuilder builder) {
    builder.withRateLimitHandler(RateLimitHandler.WAIT);
    builder.withAbuseLimitHandler(AbuseLimitHandler.WAIT);
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder;
  }
}
