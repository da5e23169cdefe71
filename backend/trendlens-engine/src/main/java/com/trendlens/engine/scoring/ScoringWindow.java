package com.trendlens.engine.scoring;

import com.trendlens.engine.model.ItemIdentity;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.SnapshotSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ScoringWindow {

  private final int tickCount;
  private final Map<ItemIdentity, Integer> appearances;
  private final double minHotness;
  private final double maxHotness;
  private final boolean hasHotness;

  private ScoringWindow(int tickCount, Map<ItemIdentity, Integer> appearances,
                        double minHotness, double maxHotness, boolean hasHotness) {
    this.tickCount = tickCount;
    this.appearances = appearances;
    this.minHotness = minHotness;
    this.maxHotness = maxHotness;
    this.hasHotness = hasHotness;
  }

  public static ScoringWindow of(List<SnapshotSet> sets) {
    Map<ItemIdentity, Integer> appearances = new HashMap<>();
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    boolean anyHotness = false;
    for (SnapshotSet set : sets) {
      Set<ItemIdentity> seenInTick = new HashSet<>();
      for (NewsItem item : set.allItems()) {
        if (seenInTick.add(item.identity())) {
          appearances.merge(item.identity(), 1, Integer::sum);
        }
        if (item.hasHotness()) {
          anyHotness = true;
          min = Math.min(min, item.hotness());
          max = Math.max(max, item.hotness());
        }
      }
    }
    return new ScoringWindow(sets.size(), Map.copyOf(appearances), min, max, anyHotness);
  }

  public int tickCount() {
    return tickCount;
  }

  public int appearances(ItemIdentity identity) {
    return appearances.getOrDefault(identity, 0);
  }

  public double frequencyScore(ItemIdentity identity) {
    if (tickCount == 0) return 0.0;
    return Math.min(1.0, (double) appearances(identity) / tickCount);
  }

  /** Min-max scaled hotness; 0 when absent, 1 when every hotness in the window is equal. */
  public double normalizedHotness(NewsItem item) {
    if (!item.hasHotness() || !hasHotness) return 0.0;
    double span = maxHotness - minHotness;
    if (span <= 0.0) return 1.0;
    double v = (item.hotness() - minHotness) / span;
    return Math.max(0.0, Math.min(1.0, v));
  }
}
