package com.trendlens.engine.analytics;

import java.time.LocalDate;

/**
 * Least-squares extrapolation of the next day's count. Always {@code naive}: it is a straight line
 * through a handful of points, not a validated forecast.
 */
public record Forecast(LocalDate date, double projectedCount, double slope, double intercept, boolean naive, String note) {

  static final String NOTE =
      "Naive linear extrapolation over the observed days; not a statistically validated forecast.";
}
