package com.gitdocs.importer.remote;

/** A raw download that did not produce content. {@code status} is 0 for transport failures. */
public class RemoteFetchException extends RuntimeException {

  private final int status;

  public RemoteFetchException(String message, int status) {
    super(message);
    this.status = status;
  }

  public RemoteFetchException(String message, Throwable cause) {
    super(message, cause);
    this.status = 0;
  }

  public int status() {
    return status;
  }

  public boolean isNotFound() {
    return status == 404;
  }

  public boolean isTransient() {
    return status == 0 || status == 408 || status == 429 || status >= 500;
  }
}
