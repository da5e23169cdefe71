package com.trendlens.engine.analytics;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.error.InsufficientDataException;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ItemIdentity;
import com.trendlens.engine.model.ScoredItem;
import com.trendlens.engine.scoring.ScoredItemOrder;
import com.trendlens.engine.search.MatchedItems;
import com.trendlens.engine.search.SearchMode;
import com.trendlens.engine.search.SearchService;
import com.trendlens.engine.time.DateRanges;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TrendAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);
  private static final int SAMPLE_TITLES = 3;

  private final SearchService search;
  private final SeriesClassifier classifier;
  private final DateRanges dates;
  private final ZoneId zone;
  private final int defaultDays;
  private final MeterRegistry metrics;
  private final Timer duration;

  public TrendAnalyzer(SearchService search, DateRanges dates, EngineSettings settings, MeterRegistry metrics) {
    this.search = search;
    this.classifier = new SeriesClassifier(settings);
    this.dates = dates;
    this.zone = settings.zoneId();
    this.defaultDays = settings.trendDefaultDays();
    this.metrics = metrics;
    this.duration = metrics.timer("trendlens_trend_analysis_duration_seconds");
  }

  public TrendAnalysis analyze(String topic, DateRange range) {
    return analyze(topic, range, CancellationToken.none());
  }

  /**
   * @throws InsufficientDataException when no day in the range has a matching item
   * @throws java.util.concurrent.CancellationException when {@code cancel} fires between days
   */
  public TrendAnalysis analyze(String topic, DateRange range, CancellationToken cancel) {
    Timer.Sample sample = Timer.start(metrics);
    try {
      Built built = build(topic, range, cancel);
      TopicSeries series = built.series();
      if (series.isEmpty()) {
        throw new InsufficientDataException("Topic '" + series.topic() + "' has no matches in " + series.range());
      }

      long[] counts = series.counts();
      SeriesClassifier.Trend trend = classifier.trend(counts);
      LifecyclePhase lifecycle = classifier.lifecycle(counts);
      List<AnomalyPoint> anomalies = classifier.anomalies(series.points());
      Forecast forecast = classifier.forecast(series.points());

      TopicPoint peak = series.points().get(0);
      LocalDate first = null;
      LocalDate last = null;
      int active = 0;
      for (TopicPoint p : series.points()) {
        if (p.count() > peak.count()) peak = p;
        if (p.count() > 0) {
          if (first == null) first = p.date();
          last = p.date();
          active++;
        }
      }

      log.info("[trend] topic='{}' range={} total={} direction={} lifecycle={} anomalies={}",
          series.topic(), series.range(), series.total(), trend.direction(), lifecycle, anomalies.size());
      return new TrendAnalysis(series, trend.direction(), trend.ratio(), lifecycle, classifier.peakShare(counts),
          peak.date(), peak.count(), first, last, active, series.total(), anomalies, forecast, built.skippedTicks());
    } finally {
      sample.stop(duration);
    }
  }

  public TopicSeries series(String topic, DateRange range, CancellationToken cancel) {
    return build(topic, range, cancel).series();
  }

  private Built build(String topic, DateRange range, CancellationToken cancel) {
    if (topic == null || topic.isBlank()) {
      throw new ValidationException("Topic must not be empty");
    }
    DateRange window = dates.resolve(range, dates.lastDays(defaultDays));
    MatchedItems matched = search.matchAll(topic.strip(), window, null, SearchMode.FUZZY);

    Map<LocalDate, Map<ItemIdentity, ScoredItem>> byDay = new HashMap<>();
    for (ScoredItem s : matched.occurrences()) {
      LocalDate day = s.item().capturedAt().atZone(zone).toLocalDate();
      byDay.computeIfAbsent(day, d -> new LinkedHashMap<>())
          .merge(s.identity(), s, (a, b) -> ScoredItemOrder.BY_WEIGHT.compare(a, b) <= 0 ? a : b);
    }

    List<TopicPoint> points = new ArrayList<>(window.dayCount());
    for (LocalDate day : window.days()) {
      cancel.throwIfCancelled();
      Map<ItemIdentity, ScoredItem> items = byDay.getOrDefault(day, Map.of());
      double mean = items.values().stream().mapToDouble(ScoredItem::compositeScore).average().orElse(0.0);
      List<String> samples = items.values().stream()
          .sorted(ScoredItemOrder.BY_WEIGHT)
          .limit(SAMPLE_TITLES)
          .map(s -> s.item().title())
          .toList();
      points.add(new TopicPoint(day, items.size(), mean, samples));
    }
    return new Built(new TopicSeries(topic.strip(), window, points), matched.skippedTicks());
  }

  private record Built(TopicSeries series, int skippedTicks) {}
}
