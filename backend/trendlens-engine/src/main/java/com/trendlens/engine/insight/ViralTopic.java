package com.trendlens.engine.insight;

import java.util.List;

public record ViralTopic(
    String keyword,
    int currentCount,
    int previousCount,
    Double growthRate,
    AlertLevel alertLevel,
    List<String> sampleTitles
) {

  public enum AlertLevel { MEDIUM, HIGH }

  public boolean isNew() {
    return growthRate == null;
  }
}
