package com.trendlens.engine.analytics;

public enum TrendDirection {
  RISING,
  FALLING,
  STABLE
}
