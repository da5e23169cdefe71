package com.trendlens.engine.model;

import java.util.List;

public record SnapshotReadResult(List<SnapshotSet> sets, int skippedTicks) {

  public SnapshotReadResult {
    sets = sets == null ? List.of() : List.copyOf(sets);
  }

  public static SnapshotReadResult empty() {
    return new SnapshotReadResult(List.of(), 0);
  }

  public boolean isEmpty() {
    return sets.isEmpty();
  }
}
