package com.trendlens.engine.model;

import com.trendlens.engine.error.EmptyRangeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record DateRange(LocalDate start, LocalDate end) {

  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new EmptyRangeException(start, end);
    }
  }

  public static DateRange of(LocalDate start, LocalDate end) {
    return new DateRange(start, end);
  }

  public static DateRange single(LocalDate date) {
    return new DateRange(date, date);
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  public int dayCount() {
    return (int) ChronoUnit.DAYS.between(start, end) + 1;
  }

  public List<LocalDate> days() {
    List<LocalDate> out = new ArrayList<>(dayCount());
    for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
      out.add(d);
    }
    return out;
  }

  public boolean isSingleDay() {
    return start.equals(end);
  }

  @Override
  public String toString() {
    return isSingleDay() ? start.toString() : start + " to " + end;
  }
}
