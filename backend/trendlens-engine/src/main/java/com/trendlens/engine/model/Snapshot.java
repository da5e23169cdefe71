package com.trendlens.engine.model;

import java.time.Instant;
import java.util.List;

public record Snapshot(String platform, Instant capturedAt, List<NewsItem> items) {

  public Snapshot {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
