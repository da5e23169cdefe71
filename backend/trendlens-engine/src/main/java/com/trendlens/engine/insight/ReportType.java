package com.trendlens.engine.insight;

public enum ReportType {
  DAILY(1),
  WEEKLY(7);

  private final int days;

  ReportType(int days) {
    this.days = days;
  }

  public int days() {
    return days;
  }
}
