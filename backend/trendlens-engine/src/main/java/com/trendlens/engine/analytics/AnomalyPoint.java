package com.trendlens.engine.analytics;

import java.time.LocalDate;

public record AnomalyPoint(LocalDate date, long count, double baselineMean, double baselineStddev, double zScore) {}
