package com.trendlens.engine.analytics;

import com.trendlens.engine.model.DateRange;
import java.util.List;

public record TopicSeries(String topic, DateRange range, List<TopicPoint> points) {

  public TopicSeries {
    points = List.copyOf(points);
  }

  public long[] counts() {
    return points.stream().mapToLong(TopicPoint::count).toArray();
  }

  public long total() {
    return points.stream().mapToLong(TopicPoint::count).sum();
  }

  public boolean isEmpty() {
    return total() == 0;
  }
}
