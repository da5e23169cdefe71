package com.trendlens.engine.time;

import com.trendlens.engine.error.ValidationException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the date phrases callers type into concrete dates:
 * <ul>
 *   <li>{@code today}, {@code yesterday}, {@code day before yesterday}</li>
 *   <li>{@code N days ago} (at most 365)</li>
 *   <li>{@code last monday}, {@code this friday}</li>
 *   <li>{@code 2025-10-10}, {@code 2025/10/10}, {@code 10/10}</li>
 * </ul>
 * A month/day without a year that lies after the current month refers to last year.
 */
public class DateQueryParser {

  private static final Map<String, Integer> RELATIVE = Map.of(
      "today", 0,
      "yesterday", 1,
      "day before yesterday", 2);

  private static final Pattern DAYS_AGO = Pattern.compile("(\\d+)\\s*days?\\s+ago");
  private static final Pattern WEEKDAY = Pattern.compile(
      "(last|this)\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday)");
  private static final Pattern ISO = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
  private static final Pattern SLASH = Pattern.compile("(?:(\\d{4})/)?(\\d{1,2})/(\\d{1,2})");

  private static final int MAX_DAYS_AGO = 365;

  private final Clock clock;

  public DateQueryParser(Clock clock) {
    this.clock = clock;
  }

  public LocalDate parse(String query) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("Date query must not be empty, e.g. 'today', 'yesterday', '2025-10-10'");
    }
    String q = query.strip().toLowerCase(Locale.ROOT);
    LocalDate today = LocalDate.now(clock);

    Integer relative = RELATIVE.get(q);
    if (relative != null) {
      return today.minusDays(relative);
    }

    Matcher m = DAYS_AGO.matcher(q);
    if (m.matches()) {
      int days = Integer.parseInt(m.group(1));
      if (days > MAX_DAYS_AGO) {
        throw new ValidationException("Relative date too far back: " + days + " days (max " + MAX_DAYS_AGO + ")");
      }
      return today.minusDays(days);
    }

    m = WEEKDAY.matcher(q);
    if (m.matches()) {
      DayOfWeek target = DayOfWeek.valueOf(m.group(2).toUpperCase(Locale.ROOT));
      LocalDate thisWeek = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).with(
          TemporalAdjusters.nextOrSame(target));
      return "last".equals(m.group(1)) ? thisWeek.minusWeeks(1) : thisWeek;
    }

    m = ISO.matcher(q);
    if (m.matches()) {
      return dateOf(q, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }

    m = SLASH.matcher(q);
    if (m.matches()) {
      int month = Integer.parseInt(m.group(2));
      int day = Integer.parseInt(m.group(3));
      int year;
      if (m.group(1) != null) {
        year = Integer.parseInt(m.group(1));
      } else {
        year = today.getYear();
        if (month > today.getMonthValue()) year--;
      }
      return dateOf(q, year, month, day);
    }

    throw new ValidationException("Unrecognized date: '" + query
        + "'. Use today, yesterday, N days ago, last monday, 2025-10-10 or 2025/10/10");
  }

  private static LocalDate dateOf(String q, int year, int month, int day) {
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      throw new ValidationException("Invalid date: " + q, e);
    }
  }
}
