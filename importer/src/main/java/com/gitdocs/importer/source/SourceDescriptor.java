package com.gitdocs.importer.source;

import com.gitdocs.importer.transform.ContentTransform;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * One remote tree plus ref to import from, together with everything that shapes how its files
 * land locally.
 */
public record SourceDescriptor(
    String name,
    String owner,
    String repo,
    String ref,
    String stateKey,
    boolean enabled,
    boolean clear,
    List<IncludeRule> includes,
    List<ContentTransform> transforms,
    AssetOptions assets,
    LinkOptions links) {

  public static final String DEFAULT_REF = "main";

  public SourceDescriptor {
    ref = StringUtils.hasText(ref) ? ref.trim() : DEFAULT_REF;
    includes = includes == null ? List.of() : List.copyOf(includes);
    transforms = transforms == null ? List.of() : List.copyOf(transforms);
    assets = assets == null ? AssetOptions.defaults() : assets;
    links = links == null ? LinkOptions.defaults() : links;
  }

  public String fullName() {
    return owner + "/" + repo;
  }

  public String displayName() {
    return StringUtils.hasText(name) ? name : fullName();
  }

  /** Key of this source in the persisted import state. */
  public String sourceId() {
    if (StringUtils.hasText(stateKey)) {
      return stateKey.trim();
    }
    return fullName() + "@" + ref;
  }

  public boolean hasIncludes() {
    return !includes.isEmpty();
  }

  public static Builder builder(String owner, String repo) {
    return new Builder(owner, repo);
  }

  public static final class Builder {

    private final String owner;
    private final String repo;
    private String name;
    private String ref = DEFAULT_REF;
    private String stateKey;
    private boolean enabled = true;
    private boolean clear;
    private final List<IncludeRule> includes = new ArrayList<>();
    private final List<ContentTransform> transforms = new ArrayList<>();
    private AssetOptions assets = AssetOptions.defaults();
    private LinkOptions links = LinkOptions.defaults();

    private Builder(String owner, String repo) {
      this.owner = owner;
      this.repo = repo;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder ref(String ref) {
      this.ref = ref;
      return this;
    }

    public Builder stateKey(String stateKey) {
      this.stateKey = stateKey;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder clear(boolean clear) {
      this.clear = clear;
      return this;
    }

    public Builder include(IncludeRule rule) {
      this.includes.add(rule);
      return this;
    }

    public Builder transform(ContentTransform transform) {
      this.transforms.add(transform);
      return this;
    }

    public Builder assets(AssetOptions assets) {
      this.assets = assets;
      return this;
    }

    public Builder links(LinkOptions links) {
      this.links = links;
      return this;
    }

    public SourceDescriptor build() {
      return new SourceDescriptor(
          name, owner, repo, ref, stateKey, enabled, clear, includes, transforms, assets, links);
    }
  }
}
