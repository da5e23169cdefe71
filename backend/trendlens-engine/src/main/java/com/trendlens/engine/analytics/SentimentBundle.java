package com.trendlens.engine.analytics;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ScoredItem;
import java.util.List;
import java.util.Map;

/**
 * Headlines prepared for an external sentiment classifier. The engine itself does not judge sentiment.
 *
 * @param topic             the filter applied, {@code null} when every headline was collected
 * @param byPlatform        selected items grouped by platform, groups ordered by their best item
 * @param prompt            plain-text instructions and the grouped headlines, ready to hand to a model
 * @param duplicatesRemoved occurrences folded into an identity seen earlier
 */
public record SentimentBundle(
    String topic,
    DateRange range,
    boolean sortedByWeight,
    Map<String, List<ScoredItem>> byPlatform,
    String prompt,
    int totalFound,
    int returned,
    int duplicatesRemoved,
    int skippedTicks
) {
}
