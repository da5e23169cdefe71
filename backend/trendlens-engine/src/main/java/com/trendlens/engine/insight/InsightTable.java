package com.trendlens.engine.insight;

import com.trendlens.engine.model.DateRange;
import java.util.List;

public record InsightTable<T>(DateRange range, List<T> rows, int skippedTicks) {

  public InsightTable {
    rows = List.copyOf(rows);
  }
}
