package com.trendlens.engine.search;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ScoredItem;
import java.time.Instant;
import java.util.List;

public record ItemListing(
    DateRange range,
    Instant capturedAt,
    List<ScoredItem> items,
    int totalFound,
    int returned,
    int skippedTicks
) {}
