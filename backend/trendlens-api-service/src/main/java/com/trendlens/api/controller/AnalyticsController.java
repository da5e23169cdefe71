package com.trendlens.api.controller;

import com.trendlens.engine.analytics.KeywordCounts;
import com.trendlens.engine.analytics.KeywordFrequencyCounter;
import com.trendlens.engine.analytics.SentimentBundle;
import com.trendlens.engine.analytics.SentimentBundleBuilder;
import com.trendlens.engine.analytics.TrendAnalysis;
import com.trendlens.engine.analytics.TrendAnalyzer;
import com.trendlens.engine.analytics.TrendingMode;
import com.trendlens.engine.analytics.TrendingTopics;
import com.trendlens.engine.insight.CooccurrencePair;
import com.trendlens.engine.insight.InsightService;
import com.trendlens.engine.insight.InsightTable;
import com.trendlens.engine.insight.PlatformActivity;
import com.trendlens.engine.insight.PlatformComparison;
import com.trendlens.engine.insight.ReportType;
import com.trendlens.engine.insight.SummaryReport;
import com.trendlens.engine.insight.ViralTopic;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalyticsController {

  private final TrendAnalyzer trends;
  private final InsightService insights;
  private final KeywordFrequencyCounter keywords;
  private final SentimentBundleBuilder sentiment;
  private final RequestDates dates;

  public AnalyticsController(TrendAnalyzer trends,
                             InsightService insights,
                             KeywordFrequencyCounter keywords,
                             SentimentBundleBuilder sentiment,
                             RequestDates dates) {
    this.trends = trends;
    this.insights = insights;
    this.keywords = keywords;
    this.sentiment = sentiment;
    this.dates = dates;
  }

  @GetMapping("/api/analytics/trend")
  public TrendAnalysis trend(
      @RequestParam(name = "topic") String topic,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end
  ) {
    return trends.analyze(topic, dates.range(start, end));
  }

  @GetMapping("/api/analytics/platforms")
  public InsightTable<PlatformComparison> platforms(
      @RequestParam(name = "topic") String topic,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end
  ) {
    return insights.comparePlatforms(topic, dates.range(start, end));
  }

  @GetMapping("/api/analytics/activity")
  public InsightTable<PlatformActivity> activity(
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end
  ) {
    return insights.activityStats(dates.range(start, end));
  }

  @GetMapping("/api/analytics/cooccurrence")
  public InsightTable<CooccurrencePair> cooccurrence(
      @RequestParam(name = "topic", required = false) String topic,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end,
      @RequestParam(name = "minFrequency", required = false) Integer minFrequency,
      @RequestParam(name = "topN", required = false) Integer topN
  ) {
    return insights.cooccurrence(topic, dates.range(start, end), minFrequency, topN);
  }

  @GetMapping("/api/analytics/viral")
  public InsightTable<ViralTopic> viral(
      @RequestParam(name = "date", required = false) String date,
      @RequestParam(name = "threshold", required = false) Double threshold
  ) {
    return insights.viralTopics(dates.date(date), threshold);
  }

  @GetMapping("/api/analytics/keywords")
  public KeywordCounts keywords(
      @RequestParam(name = "keywords", required = false) List<String> watch,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end
  ) {
    return keywords.count(watch, dates.range(start, end));
  }

  @GetMapping("/api/analytics/trending")
  public TrendingTopics trending(
      @RequestParam(name = "topN", required = false) Integer topN,
      @RequestParam(name = "mode", defaultValue = "CURRENT") TrendingMode mode
  ) {
    return keywords.trending(topN, mode);
  }

  @GetMapping("/api/analytics/report")
  public SummaryReport report(
      @RequestParam(name = "type", defaultValue = "DAILY") ReportType type,
      @RequestParam(name = "date", required = false) String date
  ) {
    return insights.summaryReport(type, dates.date(date));
  }

  @GetMapping("/api/analytics/sentiment-bundle")
  public SentimentBundle sentimentBundle(
      @RequestParam(name = "topic", required = false) String topic,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end,
      @RequestParam(name = "platforms", required = false) List<String> platforms,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "sortByWeight", defaultValue = "true") boolean sortByWeight
  ) {
    return sentiment.build(topic, dates.range(start, end), platforms, limit, sortByWeight);
  }
}
