package com.trendlens.engine.analytics;

import java.util.List;

public record TrendingTopic(String keyword, long frequency, List<String> matchedTitles) {
}
