package com.gitdocs.importer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GitDocsImporterApplication {

  public static void main(String[] args) {
    SpringApplication.run(GitDocsImporterApplication.class, args);
  }
}
