package com.gitdocs.importer.config;

import com.gitdocs.importer.link.LinkMapping;
import com.gitdocs.importer.source.AssetOptions;
import com.gitdocs.importer.source.IncludeRule;
import com.gitdocs.importer.source.LinkOptions;
import com.gitdocs.importer.source.SourceConfigurationException;
import com.gitdocs.importer.source.SourceDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.util.StringUtils;

/**
 * Builds {@link SourceDescriptor}s from {@code importer.sources[*]}. Content transforms and link
 * handlers are code and can only be attached through the Java API.
 */
public class SourceDescriptorFactory {

  private final ImporterProperties properties;

  public SourceDescriptorFactory(ImporterProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public List<SourceDescriptor> createAll() {
    List<SourceDescriptor> descriptors = new ArrayList<>();
    for (ImporterProperties.Source source : properties.getSources()) {
      descriptors.add(create(source));
    }
    return List.copyOf(descriptors);
  }

  public SourceDescriptor create(ImporterProperties.Source source) {
    SourceDescriptor.Builder builder =
        SourceDescriptor.builder(trim(source.getOwner()), trim(source.getRepo()))
            .name(source.getName())
            .ref(source.getRef())
            .stateKey(source.getStateKey())
            .enabled(source.isEnabled())
            .clear(source.isClear())
            .assets(assets(source.getAssets()))
            .links(links(source));
    List<ImporterProperties.Include> includes = source.getIncludes();
    for (int i = 0; i < includes.size(); i++) {
      ImporterProperties.Include include = includes.get(i);
      builder.include(
          IncludeRule.of(include.getPattern(), include.getBasePath())
              .withRenames(renames(source, i, include.getRenames())));
    }
    return builder.build();
  }

  static Map<String, String> renames(
      ImporterProperties.Source source, int index, List<ImporterProperties.Rename> configured) {
    Map<String, String> renames = new LinkedHashMap<>();
    if (configured == null) {
      return renames;
    }
    for (ImporterProperties.Rename rename : configured) {
      if (!StringUtils.hasText(rename.getFrom())) {
        throw new SourceConfigurationException(
            "Include #%d of %s has a rename without 'from'".formatted(index, sourceLabel(source)));
      }
      renames.put(rename.getFrom().trim(), rename.getTo() == null ? "" : rename.getTo().trim());
    }
    return renames;
  }

  private static AssetOptions assets(ImporterProperties.Assets assets) {
    if (assets == null) {
      return AssetOptions.defaults();
    }
    return new AssetOptions(
        StringUtils.hasText(assets.getPath()) ? assets.getPath().trim() : null,
        StringUtils.hasText(assets.getBaseUrl()) ? assets.getBaseUrl().trim() : null,
        assets.getExtensions());
  }

  private static LinkOptions links(ImporterProperties.Source source) {
    ImporterProperties.LinkTransform linkTransform = source.getLinkTransform();
    if (linkTransform == null) {
      return LinkOptions.defaults();
    }
    List<LinkMapping> mappings = new ArrayList<>();
    List<ImporterProperties.LinkMapping> configured = linkTransform.getMappings();
    for (int i = 0; i < configured.size(); i++) {
      mappings.add(mapping(source, i, configured.get(i)));
    }
    return new LinkOptions(
        linkTransform.getStripPrefixes(), mappings, List.of(), linkTransform.isAutoMappings());
  }

  static LinkMapping mapping(
      ImporterProperties.Source source, int index, ImporterProperties.LinkMapping config) {
    if (!StringUtils.hasText(config.getPattern())) {
      throw new SourceConfigurationException(
          "Link mapping #%d of %s has no pattern".formatted(index, sourceLabel(source)));
    }
    LinkMapping mapping;
    if (config.isRegex()) {
      try {
        mapping = LinkMapping.regex(Pattern.compile(config.getPattern()), config.getReplacement());
      } catch (PatternSyntaxException ex) {
        throw new SourceConfigurationException(
            "Link mapping #%d of %s is not a valid regular expression: %s"
                .formatted(index, sourceLabel(source), ex.getDescription()));
      }
    } else {
      mapping = LinkMapping.literal(config.getPattern(), config.getReplacement());
    }
    if (config.isGlobal()) {
      mapping = mapping.asGlobal();
    }
    if (StringUtils.hasText(config.getDescription())) {
      mapping = mapping.withDescription(config.getDescription());
    }
    return mapping;
  }

  private static String sourceLabel(ImporterProperties.Source source) {
    if (StringUtils.hasText(source.getName())) {
      return source.getName();
    }
    return source.getOwner() + "/" + source.getRepo();
  }

  private static String trim(String value) {
    return value == null ? null : value.trim();
  }
}
