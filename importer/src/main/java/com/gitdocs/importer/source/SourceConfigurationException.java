package com.gitdocs.importer.source;

/** Raised for invalid source configuration, always before any network call is made. */
public class SourceConfigurationException extends IllegalArgumentException {

  public SourceConfigurationException(String message) {
    super(message);
  }
}
