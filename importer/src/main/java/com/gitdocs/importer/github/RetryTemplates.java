package com.gitdocs.importer.github;

import com.gitdocs.importer.config.ImporterProperties;
import com.gitdocs.importer.remote.RemoteFetchException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

final class RetryTemplates {

  private RetryTemplates() {}

  static RetryTemplate create(ImporterProperties.Retry properties) {
    int attempts = Math.max(1, properties.getMaxAttempts());
    long initialInterval = Math.max(1L, properties.getInitialBackoff().toMillis());
    double multiplier = Math.max(1.1d, properties.getMultiplier());
    long maxInterval = Math.max(initialInterval + 1, properties.getMaxBackoff().toMillis());

    RetryTemplateBuilder builder =
        RetryTemplate.builder()
            .maxAttempts(attempts)
            .exponentialBackoff(initialInterval, multiplier, maxInterval);
    builder = builder.retryOn(RetryTemplates::isTransient);
    return builder.build();
  }

  static boolean isTransient(Throwable throwable) {
    if (throwable instanceof RemoteFetchException fetchException) {
      return fetchException.isTransient();
    }
    if (throwable instanceof GitHubClientException clientException) {
      return clientException.isTransient();
    }
    return false;
  }
}
