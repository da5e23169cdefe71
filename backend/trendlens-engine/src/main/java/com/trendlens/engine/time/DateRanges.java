package com.trendlens.engine.time;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.config.EngineSettings.DefaultDateRange;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import java.time.Clock;
import java.time.LocalDate;

public class DateRanges {

  private final Clock clock;
  private final EngineSettings settings;

  public DateRanges(Clock clock, EngineSettings settings) {
    this.clock = clock;
    this.settings = settings;
  }

  public LocalDate today() {
    return LocalDate.now(clock.withZone(settings.zoneId()));
  }

  public DateRange todayRange() {
    return DateRange.single(today());
  }

  public DateRange yesterdayRange() {
    return DateRange.single(today().minusDays(1));
  }

  public DateRange defaultRange() {
    return settings.defaultDateRange() == DefaultDateRange.YESTERDAY ? yesterdayRange() : todayRange();
  }

  public DateRange lastDays(int days) {
    LocalDate end = today();
    return DateRange.of(end.minusDays(Math.max(1, days) - 1L), end);
  }

  /** {@code requested} when given, else {@code fallback}; future dates are rejected. */
  public DateRange resolve(DateRange requested, DateRange fallback) {
    DateRange range = requested != null ? requested : fallback;
    LocalDate today = today();
    if (range.end().isAfter(today)) {
      throw new ValidationException("Querying future dates is not allowed: " + range + " (today is " + today + ")");
    }
    return range;
  }

  public DateRange resolve(DateRange requested) {
    return resolve(requested, defaultRange());
  }
}
