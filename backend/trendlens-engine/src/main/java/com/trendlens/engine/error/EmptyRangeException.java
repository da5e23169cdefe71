package com.trendlens.engine.error;

import java.time.LocalDate;

public class EmptyRangeException extends EngineException {

  private final LocalDate start;
  private final LocalDate end;

  public EmptyRangeException(LocalDate start, LocalDate end) {
    super("Start date " + start + " is after end date " + end);
    this.start = start;
    this.end = end;
  }

  public LocalDate getStart() {
    return start;
  }

  public LocalDate getEnd() {
    return end;
  }

  @Override
  public String code() {
    return "EMPTY_RANGE";
  }
}
