package com.trendlens.engine.analytics;

import java.time.LocalDate;
import java.util.List;

public record TopicPoint(LocalDate date, long count, double meanScore, List<String> sampleTitles) {

  public TopicPoint {
    sampleTitles = sampleTitles == null ? List.of() : List.copyOf(sampleTitles);
  }
}
