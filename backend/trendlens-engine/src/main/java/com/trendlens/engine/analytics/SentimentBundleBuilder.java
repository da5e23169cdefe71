package com.trendlens.engine.analytics;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.error.InsufficientDataException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.ScoredItem;
import com.trendlens.engine.scoring.ScoredItemOrder;
import com.trendlens.engine.search.MatchedItems;
import com.trendlens.engine.search.SearchMode;
import com.trendlens.engine.search.SearchService;
import com.trendlens.engine.time.DateRanges;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SentimentBundleBuilder {

  private static final Logger log = LoggerFactory.getLogger(SentimentBundleBuilder.class);

  private final SearchService search;
  private final DateRanges dates;
  private final EngineSettings settings;

  public SentimentBundleBuilder(SearchService search, DateRanges dates, EngineSettings settings) {
    this.search = search;
    this.dates = dates;
    this.settings = settings;
  }

  /**
   * @param topic keyword filter; blank collects every headline in the range
   * @throws InsufficientDataException when nothing in the range matches
   */
  public SentimentBundle build(String topic, DateRange range, Collection<String> platforms,
                               Integer limit, boolean sortByWeight) {
    String filter = topic == null || topic.isBlank() ? null : topic.strip();
    int cap = settings.resolveLimit(limit);
    DateRange window = dates.resolve(range);

    MatchedItems matched = search.matchAll(filter == null ? "" : filter, window, platforms, SearchMode.KEYWORD);
    if (matched.occurrences().isEmpty()) {
      throw new InsufficientDataException(filter == null
          ? "No headlines stored for " + window
          : "No headlines about '" + filter + "' in " + window);
    }

    List<ScoredItem> distinct = SearchService.collapse(matched.occurrences());
    distinct.sort(sortByWeight ? ScoredItemOrder.BY_WEIGHT : ScoredItemOrder.BY_TIME);
    List<ScoredItem> selected = distinct.subList(0, Math.min(cap, distinct.size()));

    Map<String, List<ScoredItem>> byPlatform = new LinkedHashMap<>();
    for (ScoredItem s : selected) {
      byPlatform.computeIfAbsent(s.item().platform(), p -> new ArrayList<>()).add(s);
    }
    byPlatform.replaceAll((p, items) -> List.copyOf(items));

    int duplicates = matched.occurrences().size() - distinct.size();
    log.info("[sentiment] topic='{}' range={} found={} returned={} duplicates={}",
        filter, window, distinct.size(), selected.size(), duplicates);
    return new SentimentBundle(filter, window, sortByWeight, byPlatform, prompt(filter, window, byPlatform, selected.size()),
        distinct.size(), selected.size(), duplicates, matched.skippedTicks());
  }

  static String prompt(String topic, DateRange range, Map<String, List<ScoredItem>> byPlatform, int total) {
    StringBuilder sb = new StringBuilder();
    if (topic != null) {
      sb.append("Classify the sentiment of the following headlines about '").append(topic).append("'.\n");
    } else {
      sb.append("Classify the sentiment of the following headlines.\n");
    }
    sb.append('\n')
        .append("For each headline decide Positive, Negative or Neutral. Report the count and share of each class,\n")
        .append("compare platforms, summarize the overall tone and list typical positive and negative examples.\n")
        .append('\n')
        .append("Headlines: ").append(total).append('\n')
        .append("Platforms: ").append(byPlatform.size()).append('\n')
        .append("Dates: ").append(range).append('\n')
        .append('\n');

    for (Map.Entry<String, List<ScoredItem>> group : byPlatform.entrySet()) {
      sb.append("[").append(group.getKey()).append("] (").append(group.getValue().size()).append(" items)\n");
      int i = 1;
      for (ScoredItem s : group.getValue()) {
        sb.append(i++).append(". ").append(s.item().title()).append('\n');
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
