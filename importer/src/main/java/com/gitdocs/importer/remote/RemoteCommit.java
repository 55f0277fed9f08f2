package com.gitdocs.importer.remote;

import java.time.Instant;

public record RemoteCommit(String sha, String message, Instant date) {

  /** First line of the commit message. */
  public String summary() {
    if (message == null) {
      return null;
    }
    int newline = message.indexOf('\n');
    return newline < 0 ? message.trim() : message.substring(0, newline).trim();
  }
}
