package com.trendlens.engine.analytics;

import com.trendlens.engine.config.EngineSettings;
import java.util.ArrayList;
import java.util.List;

public class SeriesClassifier {

  private final double trendMargin;
  private final double flashConcentration;
  private final int sustainedMinDays;
  private final double zThreshold;
  private final int minHistory;

  public SeriesClassifier(EngineSettings settings) {
    this.trendMargin = settings.trendMargin();
    this.flashConcentration = settings.flashConcentration();
    this.sustainedMinDays = settings.sustainedMinDays();
    this.zThreshold = settings.anomalyZThreshold();
    this.minHistory = settings.anomalyMinHistory();
  }

  public record Trend(TrendDirection direction, Double ratio) {}

  /**
   * Compares the mean of the second half to the first. With an odd number of days the middle day belongs to
   * neither half.
   */
  public Trend trend(long[] counts) {
    int n = counts.length;
    if (n < 2) return new Trend(TrendDirection.STABLE, 1.0);
    int half = n / 2;
    double first = mean(counts, 0, half);
    double second = mean(counts, n - half, n);
    if (first == 0.0) {
      return new Trend(second > 0.0 ? TrendDirection.RISING : TrendDirection.STABLE, null);
    }
    double ratio = second / first;
    if (ratio > trendMargin) return new Trend(TrendDirection.RISING, ratio);
    if (ratio < 1.0 / trendMargin) return new Trend(TrendDirection.FALLING, ratio);
    return new Trend(TrendDirection.STABLE, ratio);
  }

  public LifecyclePhase lifecycle(long[] counts) {
    long total = 0;
    int peakIdx = 0;
    int nonZero = 0;
    int lastNonZero = -1;
    for (int i = 0; i < counts.length; i++) {
      total += counts[i];
      if (counts[i] > counts[peakIdx]) peakIdx = i;
      if (counts[i] > 0) {
        nonZero++;
        lastNonZero = i;
      }
    }
    if (total == 0) {
      throw new IllegalArgumentException("Cannot classify an all-zero series");
    }
    double share = (double) counts[peakIdx] / total;
    if (share > flashConcentration) return LifecyclePhase.FLASH;
    if (nonZero >= sustainedMinDays) return LifecyclePhase.SUSTAINED;

    double third = counts.length / 3.0;
    if (peakIdx >= counts.length - third) return LifecyclePhase.EMERGING;
    if (peakIdx < third) return LifecyclePhase.FADING;
    return lastNonZero > peakIdx ? LifecyclePhase.EMERGING : LifecyclePhase.FADING;
  }

  public double peakShare(long[] counts) {
    long total = 0;
    long peak = 0;
    for (long c : counts) {
      total += c;
      peak = Math.max(peak, c);
    }
    return total == 0 ? 0.0 : (double) peak / total;
  }

  /**
   * Days whose z-score against every earlier day in the series exceeds the threshold. Days with fewer
   * than {@code minHistory} earlier days, or a flat history, are skipped rather than flagged.
   */
  public List<AnomalyPoint> anomalies(List<TopicPoint> points) {
    List<AnomalyPoint> out = new ArrayList<>();
    long[] counts = points.stream().mapToLong(TopicPoint::count).toArray();
    for (int i = minHistory; i < counts.length; i++) {
      double mean = mean(counts, 0, i);
      double std = sampleStddev(counts, 0, i, mean);
      if (std <= 0.0) continue;
      double z = (counts[i] - mean) / std;
      if (z > zThreshold) {
        out.add(new AnomalyPoint(points.get(i).date(), counts[i], mean, std, z));
      }
    }
    return out;
  }

  public Forecast forecast(List<TopicPoint> points) {
    int n = points.size();
    if (n == 0) {
      throw new IllegalArgumentException("Cannot extrapolate an empty series");
    }
    double xMean = (n - 1) / 2.0;
    double yMean = 0.0;
    for (TopicPoint p : points) yMean += p.count();
    yMean /= n;

    double num = 0.0;
    double den = 0.0;
    for (int i = 0; i < n; i++) {
      double dx = i - xMean;
      num += dx * (points.get(i).count() - yMean);
      den += dx * dx;
    }
    double slope = den == 0.0 ? 0.0 : num / den;
    double intercept = yMean - slope * xMean;
    double projected = Math.max(0.0, intercept + slope * n);
    return new Forecast(points.get(n - 1).date().plusDays(1), projected, slope, intercept, true, Forecast.NOTE);
  }

  private static double mean(long[] values, int from, int to) {
    if (to <= from) return 0.0;
    double sum = 0.0;
    for (int i = from; i < to; i++) sum += values[i];
    return sum / (to - from);
  }

  private static double sampleStddev(long[] values, int from, int to, double mean) {
    int n = to - from;
    if (n < 2) return 0.0;
    double var = 0.0;
    for (int i = from; i < to; i++) {
      double d = values[i] - mean;
      var += d * d;
    }
    return Math.sqrt(var / (n - 1));
  }
}
