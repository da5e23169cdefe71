package com.trendlens.engine.insight;

import com.trendlens.engine.model.DateRange;

public record SummaryReport(
    ReportType type,
    DateRange range,
    String markdown,
    int totalItems,
    int platformCount,
    int keywordCount,
    String topKeyword,
    int skippedTicks
) {
}
