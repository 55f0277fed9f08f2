package com.gitdocs.importer.github;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/** Runs API calls on a lazily created client and turns {@link IOException}s into runtime errors. */
class GitHubClientExecutor {

  private static final Logger log = LoggerFactory.getLogger(GitHubClientExecutor.class);
  private static final int MAX_ERROR_DETAIL = 300;

  private final GitHubClientFactory clientFactory;
  private volatile GitHub client;

  GitHubClientExecutor(GitHubClientFactory clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  <T> T execute(String description, GitHubCall<T> operation) {
    Objects.requireNonNull(operation, "operation");
    try {
      return operation.apply(client());
    } catch (IOException ex) {
      throw wrap(description, ex);
    }
  }

  private GitHub client() throws IOException {
    GitHub current = client;
    if (current == null) {
      synchronized (this) {
        current = client;
        if (current == null) {
          current = clientFactory.createClient();
          client = current;
          log.debug("Created GitHub API client");
        }
      }
    }
    return current;
  }

  static GitHubClientException wrap(String message, IOException cause) {
    HttpException httpException = findHttpException(cause);
    int status = httpException != null ? Math.max(httpException.getResponseCode(), 0) : 0;
    if (status == 0 && cause instanceof FileNotFoundException) {
      status = 404;
    }
    String detail = describe(httpException);
    if (StringUtils.hasText(detail)) {
      message = message + " (" + detail + ")";
    }
    return new GitHubClientException(message, status, cause);
  }

  private static String describe(HttpException httpException) {
    if (httpException == null) {
      return null;
    }
    StringBuilder detail = new StringBuilder();
    if (httpException.getResponseCode() > 0) {
      detail.append("status ").append(httpException.getResponseCode());
      if (StringUtils.hasText(httpException.getResponseMessage())) {
        detail.append(" ").append(httpException.getResponseMessage());
      }
    }
    String result = detail.toString();
    if (result.length() > MAX_ERROR_DETAIL) {
      return result.substring(0, MAX_ERROR_DETAIL) + "...";
    }
    return result;
  }

  private static HttpException findHttpException(Throwable throwable) {
    Throwable current = throwable;
    while (current != null) {
      if (current instanceof HttpException httpException) {
        return httpException;
      }
      current = current.getCause();
    }
    return null;
  }

  @FunctionalInterface
  interface GitHubCall<T> {
    T apply(GitHub github) throws IOException;
  }
}
