package com.trendlens.engine.analytics;

import com.trendlens.engine.model.DateRange;
import java.time.Instant;
import java.util.List;

/**
 * Watch keywords ranked by how many of today's items mention them.
 *
 * @param capturedAt newest tick counted
 * @param matchedKeywords watch keywords with at least one mention, before the top-N cut
 */
public record TrendingTopics(
    TrendingMode mode,
    DateRange range,
    Instant capturedAt,
    List<TrendingTopic> topics,
    int matchedKeywords,
    int skippedTicks
) {
}
