package com.gitdocs.importer.remote;

import java.nio.charset.StandardCharsets;

public record RawResponse(int status, byte[] body, String etag, String lastModified) {

  public static final int NOT_MODIFIED = 304;

  public boolean isNotModified() {
    return status == NOT_MODIFIED;
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  public String bodyAsString() {
    return body == null ? "" : new String(body, StandardCharsets.UTF_8);
  }
}
