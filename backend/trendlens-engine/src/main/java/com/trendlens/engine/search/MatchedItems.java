package com.trendlens.engine.search;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ScoredItem;
import java.util.List;

public record MatchedItems(
    DateRange range,
    SearchMode effectiveMode,
    List<ScoredItem> occurrences,
    int ticksScanned,
    int skippedTicks
) {}
