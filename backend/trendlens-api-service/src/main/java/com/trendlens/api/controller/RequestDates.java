package com.trendlens.api.controller;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.time.DateQueryParser;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Query-string dates. Each bound accepts anything {@link DateQueryParser} understands ("yesterday",
 * "3 days ago", "2025-10-10"); a single bound means that one day.
 */
@Component
public class RequestDates {

  private final DateQueryParser parser;

  public RequestDates(DateQueryParser parser) {
    this.parser = parser;
  }

  /** {@code null} when neither bound is given, leaving the default to the engine. */
  public DateRange range(String start, String end) {
    LocalDate from = date(start);
    LocalDate to = date(end);
    if (from == null && to == null) return null;
    if (from == null) return DateRange.single(to);
    if (to == null) return DateRange.single(from);
    return DateRange.of(from, to);
  }

  public LocalDate date(String value) {
    if (value == null || value.isBlank()) return null;
    return parser.parse(value);
  }
}
