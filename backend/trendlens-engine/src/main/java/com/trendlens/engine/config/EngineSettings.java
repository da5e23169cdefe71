package com.trendlens.engine.config;

import com.trendlens.engine.error.ValidationException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "trendlens.engine")
public record EngineSettings(
    @DefaultValue("0.6") double rankWeight,
    @DefaultValue("0.3") double frequencyWeight,
    @DefaultValue("0.1") double hotnessWeight,
    @DefaultValue("0.6") double dedupThreshold,
    @DefaultValue("0.4") double relatedThreshold,
    @DefaultValue("TODAY") DefaultDateRange defaultDateRange,
    @DefaultValue("50") int resultLimitDefault,
    @DefaultValue("1000") int maxResultLimit,
    List<String> watchKeywords,
    @DefaultValue("RECIPROCAL") RankScale rankScale,
    @DefaultValue("10") int rankCap,
    Map<String, PlatformSignal> platformSignals,
    @DefaultValue("1.2") double trendMargin,
    @DefaultValue("0.5") double flashConcentration,
    @DefaultValue("3") int sustainedMinDays,
    @DefaultValue("2.0") double anomalyZThreshold,
    @DefaultValue("3") int anomalyMinHistory,
    @DefaultValue("7") int trendDefaultDays,
    @DefaultValue("PT2M") Duration captureJitter,
    @DefaultValue("true") boolean entityExtractionEnabled,
    @DefaultValue("3") int cooccurrenceMinFrequency,
    List<String> extraStopwords,
    @DefaultValue("UTC") String zone
) {

  public enum DefaultDateRange { TODAY, YESTERDAY }

  public enum RankScale {
    RECIPROCAL,
    /** {@code (cap + 1 - min(rank, cap)) / cap}, flat beyond the cap. */
    LINEAR
  }

  public enum PlatformSignal { RANK, HOTNESS }

  public EngineSettings {
    watchKeywords = watchKeywords == null ? List.of() : List.copyOf(watchKeywords);
    platformSignals = platformSignals == null ? Map.of() : Map.copyOf(platformSignals);
    extraStopwords = extraStopwords == null ? List.of() : List.copyOf(extraStopwords);
    if (defaultDateRange == null) defaultDateRange = DefaultDateRange.TODAY;
    if (rankScale == null) rankScale = RankScale.RECIPROCAL;
    if (captureJitter == null) captureJitter = Duration.ofMinutes(2);
    if (zone == null || zone.isBlank()) zone = "UTC";
    validate(rankWeight, frequencyWeight, hotnessWeight, dedupThreshold, relatedThreshold,
        resultLimitDefault, maxResultLimit, rankCap, trendMargin, flashConcentration, sustainedMinDays,
        anomalyZThreshold, anomalyMinHistory, trendDefaultDays, captureJitter, cooccurrenceMinFrequency, zone);
  }

  public static EngineSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }

  public double weightSum() {
    return rankWeight + frequencyWeight + hotnessWeight;
  }

  public PlatformSignal signalFor(String platform) {
    return platformSignals.getOrDefault(platform, PlatformSignal.RANK);
  }

  public int resolveLimit(Integer requested) {
    if (requested == null) return resultLimitDefault;
    if (requested < 1 || requested > maxResultLimit) {
      throw new ValidationException("limit must be within 1.." + maxResultLimit + ", got " + requested);
    }
    return requested;
  }

  private static void validate(double rankWeight, double frequencyWeight, double hotnessWeight,
                               double dedupThreshold, double relatedThreshold,
                               int resultLimitDefault, int maxResultLimit, int rankCap,
                               double trendMargin, double flashConcentration, int sustainedMinDays,
                               double anomalyZThreshold, int anomalyMinHistory, int trendDefaultDays,
                               Duration captureJitter, int cooccurrenceMinFrequency, String zone) {
    if (rankWeight < 0 || frequencyWeight < 0 || hotnessWeight < 0) {
      throw new ValidationException("Weights must be non-negative");
    }
    if (rankWeight + frequencyWeight + hotnessWeight <= 0) {
      throw new ValidationException("At least one weight must be positive");
    }
    requireUnit("dedup-threshold", dedupThreshold);
    requireUnit("related-threshold", relatedThreshold);
    if (relatedThreshold > dedupThreshold) {
      throw new ValidationException("related-threshold (" + relatedThreshold
          + ") must not exceed dedup-threshold (" + dedupThreshold + ")");
    }
    if (resultLimitDefault < 1 || maxResultLimit < resultLimitDefault) {
      throw new ValidationException("result-limit-default must be >= 1 and <= max-result-limit");
    }
    if (rankCap < 1) {
      throw new ValidationException("rank-cap must be >= 1");
    }
    if (trendMargin < 1.0) {
      throw new ValidationException("trend-margin must be >= 1.0");
    }
    requireUnit("flash-concentration", flashConcentration);
    if (sustainedMinDays < 1 || anomalyMinHistory < 2 || trendDefaultDays < 1) {
      throw new ValidationException("sustained-min-days and trend-default-days must be >= 1, anomaly-min-history >= 2");
    }
    if (anomalyZThreshold <= 0) {
      throw new ValidationException("anomaly-z-threshold must be positive");
    }
    if (captureJitter.isNegative()) {
      throw new ValidationException("capture-jitter must not be negative");
    }
    if (cooccurrenceMinFrequency < 1) {
      throw new ValidationException("cooccurrence-min-frequency must be >= 1");
    }
    try {
      ZoneId.of(zone);
    } catch (RuntimeException e) {
      throw new ValidationException("Unknown zone: " + zone, e);
    }
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new ValidationException(name + " must be within [0, 1], got " + value);
    }
  }

  public static final class Builder {
    private double rankWeight = 0.6;
    private double frequencyWeight = 0.3;
    private double hotnessWeight = 0.1;
    private double dedupThreshold = 0.6;
    private double relatedThreshold = 0.4;
    private DefaultDateRange defaultDateRange = DefaultDateRange.TODAY;
    private int resultLimitDefault = 50;
    private int maxResultLimit = 1000;
    private List<String> watchKeywords = new ArrayList<>();
    private RankScale rankScale = RankScale.RECIPROCAL;
    private int rankCap = 10;
    private Map<String, PlatformSignal> platformSignals = new HashMap<>();
    private double trendMargin = 1.2;
    private double flashConcentration = 0.5;
    private int sustainedMinDays = 3;
    private double anomalyZThreshold = 2.0;
    private int anomalyMinHistory = 3;
    private int trendDefaultDays = 7;
    private Duration captureJitter = Duration.ofMinutes(2);
    private boolean entityExtractionEnabled = true;
    private int cooccurrenceMinFrequency = 3;
    private List<String> extraStopwords = new ArrayList<>();
    private String zone = "UTC";

    private Builder() {
    }

    public Builder weights(double rank, double frequency, double hotness) {
      this.rankWeight = rank;
      this.frequencyWeight = frequency;
      this.hotnessWeight = hotness;
      return this;
    }

    public Builder thresholds(double dedup, double related) {
      this.dedupThreshold = dedup;
      this.relatedThreshold = related;
      return this;
    }

    public Builder defaultDateRange(DefaultDateRange v) { this.defaultDateRange = v; return this; }

    public Builder resultLimits(int defaultLimit, int maxLimit) {
      this.resultLimitDefault = defaultLimit;
      this.maxResultLimit = maxLimit;
      return this;
    }

    public Builder watchKeywords(List<String> v) { this.watchKeywords = v; return this; }

    public Builder rankScale(RankScale scale, int cap) {
      this.rankScale = scale;
      this.rankCap = cap;
      return this;
    }

    public Builder platformSignal(String platform, PlatformSignal signal) {
      this.platformSignals.put(platform, signal);
      return this;
    }

    public Builder trendMargin(double v) { this.trendMargin = v; return this; }

    public Builder lifecycle(double flashConcentration, int sustainedMinDays) {
      this.flashConcentration = flashConcentration;
      this.sustainedMinDays = sustainedMinDays;
      return this;
    }

    public Builder anomaly(double zThreshold, int minHistory) {
      this.anomalyZThreshold = zThreshold;
      this.anomalyMinHistory = minHistory;
      return this;
    }

    public Builder trendDefaultDays(int v) { this.trendDefaultDays = v; return this; }

    public Builder captureJitter(Duration v) { this.captureJitter = v; return this; }

    public Builder entityExtractionEnabled(boolean v) { this.entityExtractionEnabled = v; return this; }

    public Builder cooccurrenceMinFrequency(int v) { this.cooccurrenceMinFrequency = v; return this; }

    public Builder extraStopwords(List<String> v) { this.extraStopwords = v; return this; }

    public Builder zone(String v) { this.zone = v; return this; }

    public EngineSettings build() {
      return new EngineSettings(rankWeight, frequencyWeight, hotnessWeight, dedupThreshold, relatedThreshold,
          defaultDateRange, resultLimitDefault, maxResultLimit, watchKeywords, rankScale, rankCap,
          platformSignals, trendMargin, flashConcentration, sustainedMinDays, anomalyZThreshold,
          anomalyMinHistory, trendDefaultDays, captureJitter, entityExtractionEnabled,
          cooccurrenceMinFrequency, extraStopwords, zone);
    }
  }
}
