package com.trendlens.engine.search;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ScoredItem;
import java.util.List;

public record SearchResult(
    String query,
    SearchMode requestedMode,
    SearchMode effectiveMode,
    SortOrder sort,
    DateRange range,
    List<ScoredItem> items,
    int totalFound,
    int returned,
    int skippedTicks
) {

  public boolean degraded() {
    return requestedMode != effectiveMode;
  }

  public boolean truncated() {
    return returned < totalFound;
  }
}
