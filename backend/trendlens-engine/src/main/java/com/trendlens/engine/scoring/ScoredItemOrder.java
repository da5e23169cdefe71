package com.trendlens.engine.scoring;

import com.trendlens.engine.model.ScoredItem;
import java.util.Comparator;

public final class ScoredItemOrder {

  /** Composite score descending, then earliest capture, platform name, rank and title. */
  public static final Comparator<ScoredItem> BY_WEIGHT =
      Comparator.comparingDouble(ScoredItem::compositeScore).reversed()
          .thenComparing(s -> s.item().capturedAt())
          .thenComparing(s -> s.item().platform())
          .thenComparingInt(s -> s.item().rank())
          .thenComparing(s -> s.item().title());

  /** Most recent capture first, then platform name and rank. */
  public static final Comparator<ScoredItem> BY_TIME =
      Comparator.comparing((ScoredItem s) -> s.item().capturedAt()).reversed()
          .thenComparing(s -> s.item().platform())
          .thenComparingInt(s -> s.item().rank())
          .thenComparing(s -> s.item().title());

  private ScoredItemOrder() {
  }
}
