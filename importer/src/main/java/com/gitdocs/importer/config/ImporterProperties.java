package com.gitdocs.importer.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {

  private boolean runOnStartup = false;
  private boolean dryRun = false;
  private boolean force = false;
  private String projectRoot = ".";
  private String workingDirectory = ".";
  private int concurrency = 5;
  private int assetConcurrency = 4;
  private GitHub github = new GitHub();
  private Retry retry = new Retry();
  private Cleanup cleanup = new Cleanup();
  private List<Source> sources = new ArrayList<>();

  public boolean isRunOnStartup() {
    return runOnStartup;
  }

  public void setRunOnStartup(boolean runOnStartup) {
    this.runOnStartup = runOnStartup;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }

  public boolean isForce() {
    return force;
  }

  public void setForce(boolean force) {
    this.force = force;
  }

  public String getProjectRoot() {
    return projectRoot;
  }

  public void setProjectRoot(String projectRoot) {
    this.projectRoot = projectRoot;
  }

  public String getWorkingDirectory() {
    return workingDirectory;
  }

  public void setWorkingDirectory(String workingDirectory) {
    this.workingDirectory = workingDirectory;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getAssetConcurrency() {
    return assetConcurrency;
  }

  public void setAssetConcurrency(int assetConcurrency) {
    this.assetConcurrency = assetConcurrency;
  }

  public GitHub getGithub() {
    return github;
  }

  public void setGithub(GitHub github) {
    this.github = github;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Cleanup getCleanup() {
    return cleanup;
  }

  public void setCleanup(Cleanup cleanup) {
    this.cleanup = cleanup;
  }

  public List<Source> getSources() {
    return sources;
  }

  public void setSources(List<Source> sources) {
    this.sources = sources;
  }

  public static class GitHub {

    private String baseUrl = "https://api.github.com";
    private String rawBaseUrl = "https://raw.githubusercontent.com";
    private String personalAccessToken;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
    private String userAgent = "gitdocs-importer/0.1";

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getRawBaseUrl() {
      return rawBaseUrl;
    }

    public void setRawBaseUrl(String rawBaseUrl) {
      this.rawBaseUrl = rawBaseUrl;
    }

    public String getPersonalAccessToken() {
      return personalAccessToken;
    }

    public void setPersonalAccessToken(String personalAccessToken) {
      this.personalAccessToken = personalAccessToken;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(String userAgent) {
      this.userAgent = userAgent;
    }
  }

  public static class Retry {

    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double multiplier = 2.0d;
    private Duration maxBackoff = Duration.ofSeconds(5);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }
  }

  public static class Cleanup {

    private boolean enabled = true;
    private Duration deleteDelay = Duration.ofMillis(10);
    private boolean allowWideDeletionOnDiscoveryFailure = false;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getDeleteDelay() {
      return deleteDelay;
    }

    public void setDeleteDelay(Duration deleteDelay) {
      this.deleteDelay = deleteDelay;
    }

    public boolean isAllowWideDeletionOnDiscoveryFailure() {
      return allowWideDeletionOnDiscoveryFailure;
    }

    public void setAllowWideDeletionOnDiscoveryFailure(
        boolean allowWideDeletionOnDiscoveryFailure) {
      this.allowWideDeletionOnDiscoveryFailure = allowWideDeletionOnDiscoveryFailure;
    }
  }

  public static class Source {

    private String name;
    private String owner;
    private String repo;
    private String ref = "main";
    private String stateKey;
    private boolean enabled = true;
    private boolean clear = false;
    private List<Include> includes = new ArrayList<>();
    private Assets assets = new Assets();
    private LinkTransform linkTransform = new LinkTransform();

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getOwner() {
      return owner;
    }

    public void setOwner(String owner) {
      this.owner = owner;
    }

    public String getRepo() {
      return repo;
    }

    public void setRepo(String repo) {
      this.repo = repo;
    }

    public String getRef() {
      return ref;
    }

    public void setRef(String ref) {
      this.ref = ref;
    }

    public String getStateKey() {
      return stateKey;
    }

    public void setStateKey(String stateKey) {
      this.stateKey = stateKey;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isClear() {
      return clear;
    }

    public void setClear(boolean clear) {
      this.clear = clear;
    }

    public List<Include> getIncludes() {
      return includes;
    }

    public void setIncludes(List<Include> includes) {
      this.includes = includes;
    }

    public Assets getAssets() {
      return assets;
    }

    public void setAssets(Assets assets) {
      this.assets = assets;
    }

    public LinkTransform getLinkTransform() {
      return linkTransform;
    }

    public void setLinkTransform(LinkTransform linkTransform) {
      this.linkTransform = linkTransform;
    }
  }

  public static class Include {

    private String pattern;
    private String basePath;
    private List<Rename> renames = new ArrayList<>();

    public String getPattern() {
      return pattern;
    }

    public void setPattern(String pattern) {
      this.pattern = pattern;
    }

    public String getBasePath() {
      return basePath;
    }

    public void setBasePath(String basePath) {
      this.basePath = basePath;
    }

    public List<Rename> getRenames() {
      return renames;
    }

    public void setRenames(List<Rename> renames) {
      this.renames = renames;
    }
  }

  /**
   * One rename of an include. A {@code from} ending in {@code /} moves a folder, anything else
   * renames a single file. A list rather than a map: relaxed binding strips slashes from keys.
   */
  public static class Rename {

    private String from;
    private String to;

    public Rename() {}

    public Rename(String from, String to) {
      this.from = from;
      this.to = to;
    }

    public String getFrom() {
      return from;
    }

    public void setFrom(String from) {
      this.from = from;
    }

    public String getTo() {
      return to;
    }

    public void setTo(String to) {
      this.to = to;
    }
  }

  public static class Assets {

    private String path;
    private String baseUrl;
    private List<String> extensions = new ArrayList<>();

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public List<String> getExtensions() {
      return extensions;
    }

    public void setExtensions(List<String> extensions) {
      this.extensions = extensions;
    }
  }

  public static class LinkTransform {

    private List<String> stripPrefixes = new ArrayList<>();
    private boolean autoMappings = true;
    private List<LinkMapping> mappings = new ArrayList<>();

    public List<String> getStripPrefixes() {
      return stripPrefixes;
    }

    public void setStripPrefixes(List<String> stripPrefixes) {
      this.stripPrefixes = stripPrefixes;
    }

    public boolean isAutoMappings() {
      return autoMappings;
    }

    public void setAutoMappings(boolean autoMappings) {
      this.autoMappings = autoMappings;
    }

    public List<LinkMapping> getMappings() {
      return mappings;
    }

    public void setMappings(List<LinkMapping> mappings) {
      this.mappings = mappings;
    }
  }

  public static class LinkMapping {

    private String pattern;
    private boolean regex = true;
    private String replacement = "";
    private boolean global = false;
    private String description;

    public String getPattern() {
      return pattern;
    }

    public void setPattern(String pattern) {
      this.pattern = pattern;
    }

    public boolean isRegex() {
      return regex;
    }

    public void setRegex(boolean regex) {
      this.regex = regex;
    }

    public String getReplacement() {
      return replacement;
    }

    public void setReplacement(String replacement) {
      this.replacement = replacement;
    }

    public boolean isGlobal() {
      return global;
    }

    public void setGlobal(boolean global) {
      this.global = global;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }
  }
}
