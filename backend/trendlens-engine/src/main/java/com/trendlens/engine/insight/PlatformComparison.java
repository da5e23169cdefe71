package com.trendlens.engine.insight;

public record PlatformComparison(String platform, int matchCount, double meanScore, int totalItems, double coverageRate) {
}
