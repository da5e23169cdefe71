package com.trendlens.engine.scoring;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.config.EngineSettings.PlatformSignal;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.ScoredItem;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Composite score of an item within a window:
 * {@code (rw * rankScore + fw * frequencyScore + hw * hotness) / (rw + fw + hw)}. Weights are divided by
 * their sum so scores stay in [0, 1] whatever the configuration.
 */
@Component
public class ScoringEngine {

  private final EngineSettings settings;
  private final double weightSum;

  public ScoringEngine(EngineSettings settings) {
    this.settings = settings;
    this.weightSum = settings.weightSum();
  }

  public ScoredItem score(NewsItem item, ScoringWindow window) {
    double hotness = window.normalizedHotness(item);
    double positional = settings.signalFor(item.platform()) == PlatformSignal.HOTNESS && item.hasHotness()
        ? hotness
        : rankScore(item.rank());
    double composite = settings.rankWeight() * positional
        + settings.frequencyWeight() * window.frequencyScore(item.identity())
        + settings.hotnessWeight() * hotness;
    return new ScoredItem(item, composite / weightSum, window.appearances(item.identity()));
  }

  public List<ScoredItem> scoreAll(Collection<NewsItem> items, ScoringWindow window) {
    List<ScoredItem> out = new ArrayList<>(items.size());
    for (NewsItem item : items) {
      out.add(score(item, window));
    }
    return out;
  }

  public double rankScore(int rank) {
    if (rank < 1) return 0.0;
    return switch (settings.rankScale()) {
      case RECIPROCAL -> 1.0 / rank;
      case LINEAR -> {
        int cap = settings.rankCap();
        yield (double) (cap + 1 - Math.min(rank, cap)) / cap;
      }
    };
  }
}
