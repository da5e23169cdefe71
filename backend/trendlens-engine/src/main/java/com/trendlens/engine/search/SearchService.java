package com.trendlens.engine.search;

import com.trendlens.engine.config.CacheConfig;
import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ItemIdentity;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.ScoredItem;
import com.trendlens.engine.model.SnapshotReadResult;
import com.trendlens.engine.model.SnapshotSet;
import com.trendlens.engine.scoring.ScoredItemOrder;
import com.trendlens.engine.scoring.ScoringEngine;
import com.trendlens.engine.scoring.ScoringWindow;
import com.trendlens.engine.similarity.SimilarityEngine;
import com.trendlens.engine.store.SnapshotStore;
import com.trendlens.engine.time.DateRanges;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final SnapshotStore store;
  private final ScoringEngine scoring;
  private final SimilarityEngine similarity;
  private final TitleMatcher matcher;
  private final DateRanges dates;
  private final EngineSettings settings;

  public SearchService(SnapshotStore store,
                       ScoringEngine scoring,
                       SimilarityEngine similarity,
                       TitleMatcher matcher,
                       DateRanges dates,
                       EngineSettings settings) {
    this.store = store;
    this.scoring = scoring;
    this.similarity = similarity;
    this.matcher = matcher;
    this.dates = dates;
    this.settings = settings;
  }

  public SearchResult search(String query, DateRange range, Collection<String> platforms,
                             SearchMode mode, Integer limit, SortOrder sort) {
    String q = requireQuery(query);
    SearchMode requested = mode == null ? SearchMode.KEYWORD : mode;
    SortOrder order = sort == null ? SortOrder.WEIGHT : sort;
    int cap = settings.resolveLimit(limit);
    DateRange window = dates.resolve(range);

    MatchedItems matched = matchAll(q, window, platforms, requested);
    List<ScoredItem> distinct = collapse(matched.occurrences());
    distinct.sort(order == SortOrder.TIME ? ScoredItemOrder.BY_TIME : ScoredItemOrder.BY_WEIGHT);
    List<ScoredItem> page = List.copyOf(distinct.subList(0, Math.min(cap, distinct.size())));

    log.info("[search] q='{}' mode={} range={} found={} returned={}",
        q, matched.effectiveMode(), window, distinct.size(), page.size());
    return new SearchResult(q, requested, matched.effectiveMode(), order, window, page,
        distinct.size(), page.size(), matched.skippedTicks());
  }

  public MatchedItems matchAll(String query, DateRange range, Collection<String> platforms, SearchMode mode) {
    SnapshotReadResult read = store.read(range, platforms);
    ScoringWindow window = ScoringWindow.of(read.sets());
    TitleMatcher.Query compiled = matcher.compile(query, mode);

    List<ScoredItem> occurrences = new ArrayList<>();
    for (SnapshotSet set : read.sets()) {
      for (NewsItem item : set.allItems()) {
        if (compiled.test(item.title())) {
          occurrences.add(scoring.score(item, window));
        }
      }
    }
    return new MatchedItems(range, compiled.mode(), occurrences, read.sets().size(), read.skippedTicks());
  }

  public SimilarResult findSimilar(NewsItem reference, DateRange range, Integer limit) {
    if (reference == null) {
      throw new ValidationException("Reference item is required");
    }
    return similar(reference.title(), reference.identity(), dates.resolve(range),
        limit, similarity.dedupThreshold());
  }

  public SimilarResult findSimilar(String referenceText, DateRange range, Integer limit) {
    return similar(requireQuery(referenceText), null, dates.resolve(range), limit, similarity.dedupThreshold());
  }

  public SimilarResult searchRelatedHistory(String topic, DateRange range, Integer limit) {
    return similar(requireQuery(topic), null, dates.resolve(range, dates.yesterdayRange()),
        limit, similarity.relatedThreshold());
  }

  private SimilarResult similar(String text, ItemIdentity exclude, DateRange range, Integer limit, double threshold) {
    int cap = settings.resolveLimit(limit);
    SnapshotReadResult read = store.read(range, null);
    ScoringWindow window = ScoringWindow.of(read.sets());

    Map<ItemIdentity, SimilarMatch> best = new LinkedHashMap<>();
    for (SnapshotSet set : read.sets()) {
      for (NewsItem item : set.allItems()) {
        ItemIdentity id = item.identity();
        if (id.equals(exclude)) continue;
        double sim = similarity.similarity(text, item.title());
        if (sim < threshold) continue;
        SimilarMatch candidate = new SimilarMatch(scoring.score(item, window), sim);
        best.merge(id, candidate, (a, b) -> ScoredItemOrder.BY_WEIGHT.compare(a.item(), b.item()) <= 0 ? a : b);
      }
    }

    List<SimilarMatch> all = new ArrayList<>(best.values());
    all.sort(Comparator.comparingDouble(SimilarMatch::similarity).reversed()
        .thenComparing(SimilarMatch::item, ScoredItemOrder.BY_WEIGHT));
    List<SimilarMatch> page = List.copyOf(all.subList(0, Math.min(cap, all.size())));
    log.info("[similar] ref='{}' threshold={} range={} found={} returned={}",
        text, threshold, range, all.size(), page.size());
    return new SimilarResult(text, threshold, range, page, all.size(), page.size(), read.skippedTicks());
  }

  @Cacheable(cacheNames = CacheConfig.LATEST)
  public ItemListing latest(Collection<String> platforms, Integer limit) {
    int cap = settings.resolveLimit(limit);
    DateRange today = dates.todayRange();
    SnapshotReadResult read = store.read(today, platforms);
    if (read.isEmpty()) {
      return new ItemListing(today, null, List.of(), 0, 0, read.skippedTicks());
    }
    SnapshotSet newest = read.sets().get(read.sets().size() - 1);
    ScoringWindow window = ScoringWindow.of(List.of(newest));
    List<ScoredItem> items = new ArrayList<>(scoring.scoreAll(newest.allItems(), window));
    items.sort(Comparator.comparingInt((ScoredItem s) -> s.item().rank())
        .thenComparing(s -> s.item().platform()));
    List<ScoredItem> page = List.copyOf(items.subList(0, Math.min(cap, items.size())));
    return new ItemListing(today, newest.capturedAt(), page, items.size(), page.size(), read.skippedTicks());
  }

  @Cacheable(cacheNames = CacheConfig.BY_DATE)
  public ItemListing byDate(LocalDate date, Collection<String> platforms, Integer limit) {
    int cap = settings.resolveLimit(limit);
    DateRange day = dates.resolve(DateRange.single(date));
    SnapshotReadResult read = store.read(day, platforms);
    ScoringWindow window = ScoringWindow.of(read.sets());
    List<ScoredItem> scored = new ArrayList<>();
    for (SnapshotSet set : read.sets()) {
      scored.addAll(scoring.scoreAll(set.allItems(), window));
    }
    List<ScoredItem> distinct = collapse(scored);
    distinct.sort(ScoredItemOrder.BY_WEIGHT);
    List<ScoredItem> page = List.copyOf(distinct.subList(0, Math.min(cap, distinct.size())));
    var newest = read.isEmpty() ? null : read.sets().get(read.sets().size() - 1).capturedAt();
    return new ItemListing(day, newest, page, distinct.size(), page.size(), read.skippedTicks());
  }

  /** One entry per identity: the occurrence that sorts first by weight. */
  public static List<ScoredItem> collapse(List<ScoredItem> occurrences) {
    Map<ItemIdentity, ScoredItem> best = new LinkedHashMap<>();
    for (ScoredItem s : occurrences) {
      best.merge(s.identity(), s, (a, b) -> ScoredItemOrder.BY_WEIGHT.compare(a, b) <= 0 ? a : b);
    }
    return new ArrayList<>(best.values());
  }

  private static String requireQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("Query text must not be empty");
    }
    return query.strip();
  }
}
