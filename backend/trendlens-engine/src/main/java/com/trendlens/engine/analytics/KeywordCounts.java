package com.trendlens.engine.analytics;

import com.trendlens.engine.model.DateRange;
import java.util.List;

public record KeywordCounts(DateRange range, List<KeywordCount> keywords, int skippedTicks) {
}
