package com.gitdocs.importer;

import static org.assertj.core.api.Assertions.assertThat;

import com.gitdocs.importer.remote.RemoteTreeProvider;
import com.gitdocs.importer.sync.GitHubImportService;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest
class GitDocsImporterApplicationTests {

  @TempDir static Path workspace;

  @Autowired private ApplicationContext context;

  @DynamicPropertySource
  static void importerProps(DynamicPropertyRegistry registry) {
    registry.add("importer.project-root", () -> workspace.toString());
    registry.add("importer.working-directory", () -> workspace.resolve(".gitdocs").toString());
    registry.add("importer.github.personal-access-token", () -> "");
  }

  @Test
  void contextLoadsWithoutRunningImport() {
    assertThat(context.getBean(GitHubImportService.class)).isNotNull();
    assertThat(context.getBean(RemoteTreeProvider.class)).isNotNull();
    assertThat(context.getBeansOfType(ImportRunner.class)).isEmpty();
  }
}
