package com.trendlens.engine.insight;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ItemIdentity;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.ScoredItem;
import com.trendlens.engine.model.Snapshot;
import com.trendlens.engine.model.SnapshotReadResult;
import com.trendlens.engine.model.SnapshotSet;
import com.trendlens.engine.scoring.ScoredItemOrder;
import com.trendlens.engine.scoring.ScoringEngine;
import com.trendlens.engine.scoring.ScoringWindow;
import com.trendlens.engine.search.SearchMode;
import com.trendlens.engine.search.SearchService;
import com.trendlens.engine.search.TitleMatcher;
import com.trendlens.engine.store.SnapshotStore;
import com.trendlens.engine.text.Tokenizer;
import com.trendlens.engine.time.DateRanges;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class InsightService {

  private static final Logger log = LoggerFactory.getLogger(InsightService.class);

  static final int DEFAULT_TOP_N = 20;
  static final double DEFAULT_VIRAL_THRESHOLD = 3.0;
  static final int NEW_TOPIC_MIN_MENTIONS = 5;
  private static final int SAMPLE_TITLES = 3;
  private static final int BUSIEST_HOURS = 3;
  private static final int REPORT_KEYWORDS = 10;
  private static final int REPORT_SAMPLES = 5;

  private final WindowReader data;
  private final TitleMatcher matcher;
  private final Tokenizer tokenizer;
  private final DateRanges dates;
  private final EngineSettings settings;
  private final ZoneId zone;

  public InsightService(SnapshotStore store,
                        ScoringEngine scoring,
                        TitleMatcher matcher,
                        Tokenizer tokenizer,
                        DateRanges dates,
                        EngineSettings settings) {
    this.data = new WindowReader(store, scoring);
    this.matcher = matcher;
    this.tokenizer = tokenizer;
    this.dates = dates;
    this.settings = settings;
    this.zone = settings.zoneId();
  }

  public InsightTable<PlatformComparison> comparePlatforms(String topic, DateRange range) {
    if (topic == null || topic.isBlank()) {
      throw new ValidationException("Topic must not be empty");
    }
    DateRange window = dates.resolve(range);
    Scored scored = data.distinct(window);
    TitleMatcher.Query query = matcher.compile(topic.strip(), SearchMode.KEYWORD);

    Map<String, List<ScoredItem>> all = new TreeMap<>();
    for (ScoredItem s : scored.items()) {
      all.computeIfAbsent(s.item().platform(), p -> new ArrayList<>()).add(s);
    }

    List<PlatformComparison> rows = new ArrayList<>();
    for (Map.Entry<String, List<ScoredItem>> e : all.entrySet()) {
      List<ScoredItem> matches = e.getValue().stream().filter(s -> query.test(s.item().title())).toList();
      double mean = matches.stream().mapToDouble(ScoredItem::compositeScore).average().orElse(0.0);
      int total = e.getValue().size();
      rows.add(new PlatformComparison(e.getKey(), matches.size(), mean, total, (double) matches.size() / total));
    }
    rows.sort(Comparator.comparingInt(PlatformComparison::matchCount).reversed()
        .thenComparing(PlatformComparison::platform));

    log.info("[compare] topic='{}' range={} platforms={}", topic.strip(), window, rows.size());
    return new InsightTable<>(window, rows, scored.skippedTicks());
  }

  public InsightTable<PlatformActivity> activityStats(DateRange range) {
    DateRange window = dates.resolve(range);
    SnapshotReadResult read = data.store().read(window, null);

    Map<String, List<Instant>> captures = new TreeMap<>();
    Map<String, Set<ItemIdentity>> items = new HashMap<>();
    Map<String, Set<LocalDate>> days = new HashMap<>();
    Map<String, int[]> hours = new HashMap<>();
    for (SnapshotSet set : read.sets()) {
      for (Snapshot snap : set.snapshots()) {
        String p = snap.platform();
        captures.computeIfAbsent(p, k -> new ArrayList<>()).add(set.capturedAt());
        days.computeIfAbsent(p, k -> new HashSet<>()).add(set.captureDate(zone));
        hours.computeIfAbsent(p, k -> new int[24])[set.capturedAt().atZone(zone).getHour()]++;
        Set<ItemIdentity> seen = items.computeIfAbsent(p, k -> new HashSet<>());
        for (NewsItem item : snap.items()) seen.add(item.identity());
      }
    }

    List<PlatformActivity> rows = new ArrayList<>();
    for (Map.Entry<String, List<Instant>> e : captures.entrySet()) {
      String p = e.getKey();
      List<Instant> times = e.getValue();
      rows.add(new PlatformActivity(p, times.size(), averageInterval(times), items.get(p).size(),
          days.get(p).size(), busiest(hours.get(p))));
    }
    rows.sort(Comparator.comparingInt(PlatformActivity::captureCount).reversed()
        .thenComparing(PlatformActivity::platform));
    return new InsightTable<>(window, rows, read.skippedTicks());
  }

  public InsightTable<CooccurrencePair> cooccurrence(String topic, DateRange range) {
    return cooccurrence(topic, range, null, null);
  }

  public InsightTable<CooccurrencePair> cooccurrence(String topic, DateRange range, Integer minFrequency, Integer topN) {
    int min = minFrequency == null ? settings.cooccurrenceMinFrequency() : minFrequency;
    if (min < 1) {
      throw new ValidationException("minFrequency must be >= 1, got " + min);
    }
    int top = topN == null ? DEFAULT_TOP_N : settings.resolveLimit(topN);
    DateRange window = dates.resolve(range);
    Scored scored = data.distinct(window);
    TitleMatcher.Query query = topic == null || topic.isBlank() ? null : matcher.compile(topic.strip(), SearchMode.KEYWORD);

    Map<List<String>, Integer> counts = new HashMap<>();
    Map<List<String>, List<String>> samples = new HashMap<>();
    for (ScoredItem s : scored.items()) {
      String title = s.item().title();
      if (query != null && !query.test(title)) continue;
      List<String> tokens = new ArrayList<>(new TreeSet<>(tokenizer.tokens(title)));
      for (int i = 0; i < tokens.size(); i++) {
        for (int j = i + 1; j < tokens.size(); j++) {
          List<String> pair = List.of(tokens.get(i), tokens.get(j));
          counts.merge(pair, 1, Integer::sum);
          List<String> sample = samples.computeIfAbsent(pair, k -> new ArrayList<>());
          if (sample.size() < SAMPLE_TITLES) sample.add(title);
        }
      }
    }

    List<CooccurrencePair> rows = new ArrayList<>();
    for (Map.Entry<List<String>, Integer> e : counts.entrySet()) {
      if (e.getValue() < min) continue;
      List<String> pair = e.getKey();
      rows.add(new CooccurrencePair(pair.get(0), pair.get(1), e.getValue(), List.copyOf(samples.get(pair))));
    }
    rows.sort(Comparator.comparingInt(CooccurrencePair::count).reversed()
        .thenComparing(CooccurrencePair::first)
        .thenComparing(CooccurrencePair::second));
    List<CooccurrencePair> page = rows.subList(0, Math.min(top, rows.size()));
    log.info("[cooccurrence] topic='{}' range={} pairs={} returned={}", topic, window, rows.size(), page.size());
    return new InsightTable<>(window, page, scored.skippedTicks());
  }

  /**
   * Tokens whose distinct-title count on {@code date} grew by at least {@code threshold} against the day
   * before, plus tokens absent the day before with at least five mentions.
   */
  public InsightTable<ViralTopic> viralTopics(LocalDate date, Double threshold) {
    double t = threshold == null ? DEFAULT_VIRAL_THRESHOLD : threshold;
    if (Double.isNaN(t) || t < 1.0) {
      throw new ValidationException("threshold must be >= 1.0, got " + t);
    }
    DateRange day = dates.resolve(date == null ? null : DateRange.single(date), dates.todayRange());
    LocalDate previousDay = day.end().minusDays(1);
    DateRange current = DateRange.single(day.end());

    Scored now = data.distinct(current);
    Scored before = data.distinct(DateRange.single(previousDay));
    Map<String, List<String>> currentTitles = new HashMap<>();
    Map<String, Integer> currentCounts = tokenCounts(now.items(), currentTitles);
    Map<String, Integer> previousCounts = tokenCounts(before.items(), null);

    List<ViralTopic> rows = new ArrayList<>();
    for (Map.Entry<String, Integer> e : currentCounts.entrySet()) {
      int cur = e.getValue();
      int prev = previousCounts.getOrDefault(e.getKey(), 0);
      List<String> sample = currentTitles.get(e.getKey());
      if (prev == 0) {
        if (cur >= NEW_TOPIC_MIN_MENTIONS) {
          rows.add(new ViralTopic(e.getKey(), cur, 0, null, ViralTopic.AlertLevel.HIGH, sample));
        }
        continue;
      }
      double growth = (double) cur / prev;
      if (growth >= t) {
        ViralTopic.AlertLevel level = growth > 2 * t ? ViralTopic.AlertLevel.HIGH : ViralTopic.AlertLevel.MEDIUM;
        rows.add(new ViralTopic(e.getKey(), cur, prev, growth, level, sample));
      }
    }
    rows.sort(Comparator.comparing(ViralTopic::isNew).reversed()
        .thenComparing(Comparator.comparingDouble((ViralTopic v) -> v.isNew() ? v.currentCount() : v.growthRate()).reversed())
        .thenComparing(ViralTopic::keyword));

    log.info("[viral] date={} threshold={} detected={}", current, t, rows.size());
    return new InsightTable<>(current, rows, now.skippedTicks() + before.skippedTicks());
  }

  public SummaryReport summaryReport(ReportType type, LocalDate endDate) {
    ReportType kind = type == null ? ReportType.DAILY : type;
    LocalDate end = dates.resolve(endDate == null ? null : DateRange.single(endDate), dates.todayRange()).end();
    DateRange window = DateRange.of(end.minusDays(kind.days() - 1L), end);
    Scored scored = data.distinct(window);

    Map<String, Integer> keywords = tokenCounts(scored.items(), null);
    List<Map.Entry<String, Integer>> topKeywords = keywords.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.<String, Integer>comparingByKey()))
        .limit(REPORT_KEYWORDS)
        .toList();
    Map<String, Integer> perPlatform = new TreeMap<>();
    for (ScoredItem s : scored.items()) perPlatform.merge(s.item().platform(), 1, Integer::sum);
    List<ScoredItem> samples = scored.items().stream().sorted(ScoredItemOrder.BY_WEIGHT).limit(REPORT_SAMPLES).toList();

    StringBuilder md = new StringBuilder();
    md.append("# ").append(kind == ReportType.DAILY ? "Daily" : "Weekly").append(" News Summary\n\n")
        .append("**Period**: ").append(window).append("\n\n")
        .append("## Overview\n\n")
        .append("- **Items**: ").append(scored.items().size()).append('\n')
        .append("- **Platforms**: ").append(perPlatform.size()).append('\n')
        .append("- **Keywords**: ").append(keywords.size()).append("\n\n")
        .append("## Top Keywords\n\n");
    int i = 1;
    for (Map.Entry<String, Integer> k : topKeywords) {
      md.append(i++).append(". **").append(k.getKey()).append("** - ").append(k.getValue()).append(" mentions\n");
    }
    md.append("\n## Platform Activity\n\n");
    perPlatform.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.<String, Integer>comparingByKey()))
        .forEach(e -> md.append("- **").append(e.getKey()).append("**: ").append(e.getValue()).append(" items\n"));
    md.append("\n## Selected Headlines\n\n");
    for (ScoredItem s : samples) {
      md.append("- [").append(s.item().platform()).append("] ").append(s.item().title()).append('\n');
    }
    if (scored.skippedTicks() > 0) {
      md.append("\n_").append(scored.skippedTicks()).append(" unreadable ticks were skipped._\n");
    }

    String top = topKeywords.isEmpty() ? null : topKeywords.get(0).getKey();
    log.info("[report] type={} range={} items={}", kind, window, scored.items().size());
    return new SummaryReport(kind, window, md.toString(), scored.items().size(), perPlatform.size(),
        keywords.size(), top, scored.skippedTicks());
  }

  private Map<String, Integer> tokenCounts(List<ScoredItem> items, Map<String, List<String>> samples) {
    Map<String, Integer> counts = new HashMap<>();
    for (ScoredItem s : items) {
      for (String token : tokenizer.tokenSet(s.item().title())) {
        counts.merge(token, 1, Integer::sum);
        if (samples != null) {
          List<String> sample = samples.computeIfAbsent(token, k -> new ArrayList<>());
          if (sample.size() < SAMPLE_TITLES) sample.add(s.item().title());
        }
      }
    }
    return counts;
  }

  private static Duration averageInterval(List<Instant> times) {
    if (times.size() < 2) return null;
    List<Instant> sorted = times.stream().sorted().toList();
    Duration span = Duration.between(sorted.get(0), sorted.get(sorted.size() - 1));
    return span.dividedBy(sorted.size() - 1);
  }

  private static List<Integer> busiest(int[] hours) {
    List<Integer> order = new ArrayList<>();
    for (int h = 0; h < hours.length; h++) {
      if (hours[h] > 0) order.add(h);
    }
    order.sort(Comparator.comparingInt((Integer h) -> hours[h]).reversed().thenComparing(h -> h));
    return List.copyOf(order.subList(0, Math.min(BUSIEST_HOURS, order.size())));
  }

  private record Scored(List<ScoredItem> items, int skippedTicks) {}

  private record WindowReader(SnapshotStore store, ScoringEngine scoring) {

    Scored distinct(DateRange range) {
      SnapshotReadResult read = store.read(range, null);
      ScoringWindow window = ScoringWindow.of(read.sets());
      List<ScoredItem> scored = new ArrayList<>();
      for (SnapshotSet set : read.sets()) {
        scored.addAll(scoring.scoreAll(set.allItems(), window));
      }
      return new Scored(SearchService.collapse(scored), read.skippedTicks());
    }
  }
}
