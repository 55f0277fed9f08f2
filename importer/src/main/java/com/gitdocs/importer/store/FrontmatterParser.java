package com.gitdocs.importer.store;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.YamlMapFactoryBean;
import org.springframework.core.io.ByteArrayResource;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

public final class FrontmatterParser {

  private static final Logger log = LoggerFactory.getLogger(FrontmatterParser.class);
  private static final String DELIMITER = "---";

  private FrontmatterParser() {}

  public static Frontmatter parse(String content) {
    if (content == null || !content.startsWith(DELIMITER)) {
      return new Frontmatter(Map.of(), content == null ? "" : content, "");
    }
    int firstNewline = content.indexOf('\n');
    if (firstNewline < 0 || !content.substring(0, firstNewline).trim().equals(DELIMITER)) {
      return new Frontmatter(Map.of(), content, "");
    }
    int position = firstNewline + 1;
    while (position <= content.length()) {
      int newline = content.indexOf('\n', position);
      int lineEnd = newline < 0 ? content.length() : newline;
      if (content.substring(position, lineEnd).trim().equals(DELIMITER)) {
        String yaml = content.substring(firstNewline + 1, position);
        int blockEnd = newline < 0 ? lineEnd : newline + 1;
        return new Frontmatter(
            load(yaml), content.substring(blockEnd), content.substring(0, blockEnd));
      }
      if (newline < 0) {
        break;
      }
      position = newline + 1;
    }
    return new Frontmatter(Map.of(), content, "");
  }

  public static String render(Map<String, Object> data, String body) {
    if (data == null || data.isEmpty()) {
      return body;
    }
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    String yaml = new Yaml(options).dump(data);
    return DELIMITER + "\n" + yaml + DELIMITER + "\n\n" + body;
  }

  private static Map<String, Object> load(String yaml) {
    if (yaml.isBlank()) {
      return Map.of();
    }
    try {
      YamlMapFactoryBean factory = new YamlMapFactoryBean();
      factory.setResources(new ByteArrayResource(yaml.getBytes(StandardCharsets.UTF_8)));
      Map<String, Object> map = factory.getObject();
      return map == null ? Map.of() : new LinkedHashMap<>(map);
    } catch (RuntimeException ex) {
      log.debug("Ignoring unparsable frontmatter: {}", ex.getMessage());
      return Map.of();
    }
  }
}
