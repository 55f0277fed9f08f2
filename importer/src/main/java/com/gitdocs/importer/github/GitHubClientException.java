package com.gitdocs.importer.github;

public class GitHubClientException extends RuntimeException {

  private final int status;

  public GitHubClientException(String message) {
    super(message);
    this.status = 0;
  }

  public GitHubClientException(String message, int status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  /** HTTP status reported by the API, or 0 when the call failed before a response. */
  public int status() {
    return status;
  }

  public boolean isTransient() {
    return status == 0 || status == 429 || status >= 500;
  }
}
