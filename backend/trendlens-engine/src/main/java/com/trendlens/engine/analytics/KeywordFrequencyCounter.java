package com.trendlens.engine.analytics;

import com.trendlens.engine.config.CacheConfig;
import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.error.InsufficientDataException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ItemIdentity;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.SnapshotReadResult;
import com.trendlens.engine.model.SnapshotSet;
import com.trendlens.engine.store.SnapshotStore;
import com.trendlens.engine.time.DateRanges;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

@Service
public class KeywordFrequencyCounter {

  private static final Logger log = LoggerFactory.getLogger(KeywordFrequencyCounter.class);

  static final int DEFAULT_TOP_N = 10;

  private final SnapshotStore store;
  private final DateRanges dates;
  private final EngineSettings settings;
  private final ZoneId zone;

  public KeywordFrequencyCounter(SnapshotStore store, DateRanges dates, EngineSettings settings) {
    this.store = store;
    this.dates = dates;
    this.settings = settings;
    this.zone = settings.zoneId();
  }

  public KeywordCounts count(DateRange range) {
    return count(null, range);
  }

  /**
   * One entry per non-blank keyword, in input order. An item counts once per day however many ticks
   * carried it.
   */
  public KeywordCounts count(List<String> keywords, DateRange range) {
    List<String> watch = normalize(keywords == null || keywords.isEmpty() ? settings.watchKeywords() : keywords);
    DateRange window = dates.resolve(range);
    if (watch.isEmpty()) {
      return new KeywordCounts(window, List.of(), 0);
    }
    SnapshotReadResult read = store.read(window, null);

    Map<LocalDate, Set<ItemIdentity>> seenPerDay = new HashMap<>();
    Map<String, Map<LocalDate, Long>> counts = new LinkedHashMap<>();
    for (String k : watch) {
      Map<LocalDate, Long> perDay = new LinkedHashMap<>();
      for (LocalDate d : window.days()) perDay.put(d, 0L);
      counts.put(k, perDay);
    }

    for (SnapshotSet set : read.sets()) {
      LocalDate day = set.captureDate(zone);
      Set<ItemIdentity> seen = seenPerDay.computeIfAbsent(day, d -> new HashSet<>());
      for (NewsItem item : set.allItems()) {
        if (!seen.add(item.identity())) continue;
        String title = item.title().toLowerCase(Locale.ROOT);
        for (String k : watch) {
          if (title.contains(k)) {
            counts.get(k).merge(day, 1L, Long::sum);
          }
        }
      }
    }

    List<KeywordCount> out = new ArrayList<>(watch.size());
    for (Map.Entry<String, Map<LocalDate, Long>> e : counts.entrySet()) {
      long total = e.getValue().values().stream().mapToLong(Long::longValue).sum();
      out.add(new KeywordCount(e.getKey(), total, Collections.unmodifiableMap(e.getValue())));
    }
    log.info("[keywords] {} keywords over {} ({} ticks, {} skipped)",
        watch.size(), window, read.sets().size(), read.skippedTicks());
    return new KeywordCounts(window, out, read.skippedTicks());
  }

  @Cacheable(cacheNames = CacheConfig.TRENDING)
  public TrendingTopics trending(Integer topN, TrendingMode mode) {
    TrendingMode effective = mode == null ? TrendingMode.CURRENT : mode;
    int limit = topN == null ? DEFAULT_TOP_N : settings.resolveLimit(topN);
    DateRange today = dates.todayRange();
    SnapshotReadResult read = store.read(today, null);
    if (read.sets().isEmpty()) {
      throw new InsufficientDataException("No snapshots captured on " + today.start());
    }
    SnapshotSet newest = read.sets().get(read.sets().size() - 1);
    List<SnapshotSet> sets = effective == TrendingMode.CURRENT ? List.of(newest) : read.sets();

    List<String> watch = normalize(settings.watchKeywords());
    Map<String, Set<String>> titles = new LinkedHashMap<>();
    Map<String, Long> frequency = new HashMap<>();
    Set<ItemIdentity> seen = new HashSet<>();
    for (SnapshotSet set : sets) {
      for (NewsItem item : set.allItems()) {
        if (!seen.add(item.identity())) continue;
        String title = item.title().toLowerCase(Locale.ROOT);
        for (String k : watch) {
          if (title.contains(k)) {
            frequency.merge(k, 1L, Long::sum);
            titles.computeIfAbsent(k, x -> new LinkedHashSet<>()).add(item.title());
          }
        }
      }
    }

    List<TrendingTopic> ranked = frequency.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()))
        .limit(limit)
        .map(e -> new TrendingTopic(e.getKey(), e.getValue(), List.copyOf(titles.get(e.getKey()))))
        .toList();
    log.info("[trending] {} of {} watch keywords mentioned ({} mode, {} ticks)",
        frequency.size(), watch.size(), effective, sets.size());
    return new TrendingTopics(effective, today, newest.capturedAt(), ranked, frequency.size(), read.skippedTicks());
  }

  private static List<String> normalize(List<String> keywords) {
    List<String> out = new ArrayList<>();
    for (String k : keywords) {
      if (k == null || k.isBlank()) continue;
      String lower = k.strip().toLowerCase(Locale.ROOT);
      if (!out.contains(lower)) out.add(lower);
    }
    return out;
  }
}
