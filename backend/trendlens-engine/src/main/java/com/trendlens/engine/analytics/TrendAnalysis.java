package com.trendlens.engine.analytics;

import java.time.LocalDate;
import java.util.List;

public record TrendAnalysis(
    TopicSeries series,
    TrendDirection direction,
    Double halfRatio,
    LifecyclePhase lifecycle,
    double peakShare,
    LocalDate peakDate,
    long peakCount,
    LocalDate firstAppearance,
    LocalDate lastAppearance,
    int activeDays,
    long totalMentions,
    List<AnomalyPoint> anomalies,
    Forecast forecast,
    int skippedTicks
) {}
