package com.trendlens.engine.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;

public record SnapshotSet(Instant capturedAt, List<Snapshot> snapshots) {

  public SnapshotSet {
    snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
  }

  public LocalDate captureDate(ZoneId zone) {
    return capturedAt.atZone(zone).toLocalDate();
  }

  public List<NewsItem> allItems() {
    return snapshots.stream().flatMap(s -> s.items().stream()).toList();
  }

  public SnapshotSet onlyPlatforms(Collection<String> platforms) {
    if (platforms == null || platforms.isEmpty()) return this;
    return new SnapshotSet(capturedAt,
        snapshots.stream().filter(s -> platforms.contains(s.platform())).toList());
  }
}
