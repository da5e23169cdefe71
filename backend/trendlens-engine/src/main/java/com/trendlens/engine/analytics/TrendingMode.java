package com.trendlens.engine.analytics;

/** Which ticks of today a trending count draws from. */
public enum TrendingMode {
  DAILY,
  CURRENT
}
