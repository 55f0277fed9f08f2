package com.gitdocs.importer.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Renders dry-run results as the lines of a human-readable report. */
public class DryRunReportFormatter {

  private static final String RULE = "=".repeat(50);
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

  private final Clock clock;

  public DryRunReportFormatter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public List<String> format(List<RepositoryChangeInfo> results) {
    List<String> lines = new ArrayList<>();
    lines.add("Repository Import Status:");
    lines.add(RULE);
    int needsReimport = 0;
    int errors = 0;
    for (RepositoryChangeInfo result : results) {
      String name = result.source().displayName();
      if (result.failed()) {
        lines.add("[error] %s: %s".formatted(name, result.error()));
        errors++;
      } else if (result.needsReimport()) {
        lines.add("[changed] %s: Needs re-import".formatted(name));
        if (result.latestCommit() != null && result.latestCommit().summary() != null) {
          lines.add("   Latest commit: " + result.latestCommit().summary());
        }
        if (result.latestCommit() != null && result.latestCommit().date() != null) {
          lines.add("   Committed: " + timeAgo(result.latestCommit().date()));
        }
        lines.add("   Last imported: " + lastImported(result.state()));
        needsReimport++;
      } else {
        lines.add("[ok] %s: Up to date".formatted(name));
        if (result.state() != null && result.state().lastImported() != null) {
          lines.add("   Last imported: " + timeAgo(result.state().lastImported()));
        }
      }
    }
    lines.add(RULE);
    lines.add(summary(needsReimport, results.size(), errors));
    return lines;
  }

  public static String summary(int needsReimport, int total, int errors) {
    return "%d of %d repositories need re-import, %d errors"
        .formatted(needsReimport, total, errors);
  }

  private String lastImported(ImportState state) {
    if (state == null || state.lastImported() == null) {
      return "Never";
    }
    return timeAgo(state.lastImported());
  }

  /** Minutes below an hour, hours below a day, days below a week, then the date. */
  String timeAgo(Instant then) {
    Duration elapsed = Duration.between(then, clock.instant());
    if (elapsed.isNegative()) {
      elapsed = Duration.ZERO;
    }
    long minutes = elapsed.toMinutes();
    if (minutes < 60) {
      return plural(minutes, "minute");
    }
    long hours = elapsed.toHours();
    if (hours < 24) {
      return plural(hours, "hour");
    }
    long days = elapsed.toDays();
    if (days < 7) {
      return plural(days, "day");
    }
    return "on " + DATE.format(then);
  }

  private static String plural(long amount, String unit) {
    return amount + " " + unit + (amount == 1 ? "" : "s") + " ago";
  }
}
