package com.trendlens.engine.insight;

import com.trendlens.engine.EngineFixture;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.trendlens.engine.EngineFixture.TODAY;
import static com.trendlens.engine.EngineFixture.at;
import static com.trendlens.engine.EngineFixture.tick;
import static org.junit.jupiter.api.Assertions.*;

class InsightServiceTest {

  @TempDir
  Path root;

  private EngineFixture fx;
  private InsightService insights;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture(root);
    insights = new InsightService(fx.store, fx.scoring, fx.matcher, fx.tokenizer, fx.dates, fx.settings);
  }

  @Test
  void comparePlatformsOrdersByMatchCount() {
    Map<String, List<String>> byPlatform = new LinkedHashMap<>();
    byPlatform.put("hn", List.of("Climate summit opens", "Stocks rally", "Weather turns cold"));
    byPlatform.put("reddit", List.of("Climate bill passes", "Climate protest grows"));
    byPlatform.put("lobsters", List.of("Rust release notes"));
    fx.append(tick(at(TODAY, 9), byPlatform));

    InsightTable<PlatformComparison> table = insights.comparePlatforms("climate", null);

    assertEquals(List.of("reddit", "hn", "lobsters"), table.rows().stream().map(PlatformComparison::platform).toList());
    PlatformComparison reddit = table.rows().get(0);
    assertEquals(2, reddit.matchCount());
    assertEquals(2, reddit.totalItems());
    assertEquals(1.0, reddit.coverageRate());
    assertTrue(reddit.meanScore() > 0);
    PlatformComparison hn = table.rows().get(1);
    assertEquals(1, hn.matchCount());
    assertEquals(1.0 / 3.0, hn.coverageRate(), 1e-9);
    assertEquals(0, table.rows().get(2).matchCount());
    assertEquals(0.0, table.rows().get(2).meanScore());
  }

  @Test
  void comparePlatformsNeedsATopic() {
    assertThrows(ValidationException.class, () -> insights.comparePlatforms("", null));
  }

  @Test
  void activityStatsMeasureCaptureCadence() {
    fx.append(
        tick(at(TODAY, 8), "hn", "a"),
        tick(at(TODAY, 10), "hn", "a", "b"),
        tick(at(TODAY, 12).minusSeconds(3600), "hn", "c"),
        tick(at(TODAY, 9), "reddit", "x"));

    InsightTable<PlatformActivity> table = insights.activityStats(null);

    PlatformActivity hn = table.rows().get(0);
    assertEquals("hn", hn.platform());
    assertEquals(3, hn.captureCount());
    assertEquals(Duration.ofHours(1).plusMinutes(30), hn.averageInterval());
    assertEquals(3, hn.itemCount());
    assertEquals(1, hn.activeDays());
    PlatformActivity reddit = table.rows().get(1);
    assertNull(reddit.averageInterval());
    assertEquals(List.of(9), reddit.busiestHours());
  }

  @Test
  void cooccurrenceKeepsPairsAboveMinimum() {
    fx.append(tick(at(TODAY, 9), "hn",
        "Climate summit opens",
        "Climate summit delayed",
        "Climate summit ends",
        "Climate bill passes",
        "Football final tonight"));

    InsightTable<CooccurrencePair> table = insights.cooccurrence(null, null, 3, null);

    assertEquals(1, table.rows().size());
    CooccurrencePair pair = table.rows().get(0);
    assertEquals("climate", pair.first());
    assertEquals("summit", pair.second());
    assertEquals(3, pair.count());
    assertEquals(3, pair.sampleTitles().size());
  }

  @Test
  void cooccurrenceRestrictsToTopic() {
    fx.append(tick(at(TODAY, 9), "hn",
        "Climate summit opens",
        "Climate summit delayed",
        "Football final tonight",
        "Football final delayed"));

    InsightTable<CooccurrencePair> table = insights.cooccurrence("football", null, 2, 5);

    assertEquals(1, table.rows().size());
    assertEquals("final", table.rows().get(0).first());
    assertEquals("football", table.rows().get(0).second());
  }

  @Test
  void viralTopicsCompareAgainstPreviousDay() {
    fx.append(
        tick(at(TODAY.minusDays(1), 9), "hn", "Volcano alert issued", "Budget vote today"),
        tick(at(TODAY, 9), "hn",
            "Volcano erupts overnight", "Volcano ash grounds flights", "Volcano villages evacuated",
            "Budget vote today",
            "Robot wins chess", "Robot opens store", "Robot learns jokes", "Robot paints mural", "Robot sings anthem"));

    InsightTable<ViralTopic> table = insights.viralTopics(null, 3.0);

    List<String> keywords = table.rows().stream().map(ViralTopic::keyword).toList();
    assertEquals(List.of("robot", "volcano"), keywords);
    ViralTopic robot = table.rows().get(0);
    assertTrue(robot.isNew());
    assertEquals(ViralTopic.AlertLevel.HIGH, robot.alertLevel());
    ViralTopic volcano = table.rows().get(1);
    assertEquals(3.0, volcano.growthRate());
    assertEquals(ViralTopic.AlertLevel.MEDIUM, volcano.alertLevel());
    assertEquals(3, volcano.sampleTitles().size());
  }

  @Test
  void viralThresholdBelowOneIsRejected() {
    assertThrows(ValidationException.class, () -> insights.viralTopics(null, 0.5));
  }

  @Test
  void dailyReportSummarizesTheDay() {
    Map<String, List<String>> byPlatform = new LinkedHashMap<>();
    byPlatform.put("hn", List.of("Climate summit opens", "Climate bill passes"));
    byPlatform.put("reddit", List.of("Football final tonight"));
    fx.append(tick(at(TODAY, 9), byPlatform));

    SummaryReport report = insights.summaryReport(ReportType.DAILY, null);

    assertEquals(DateRange.single(TODAY), report.range());
    assertEquals(3, report.totalItems());
    assertEquals(2, report.platformCount());
    assertEquals("climate", report.topKeyword());
    assertTrue(report.markdown().startsWith("# Daily News Summary"));
    assertTrue(report.markdown().contains("1. **climate** - 2 mentions"));
    assertTrue(report.markdown().contains("- **hn**: 2 items"));
    assertTrue(report.markdown().contains("- [hn] Climate summit opens"));
  }

  @Test
  void weeklyReportSpansSevenDays() {
    SummaryReport report = insights.summaryReport(ReportType.WEEKLY, TODAY.minusDays(1));
    assertEquals(DateRange.of(TODAY.minusDays(7), TODAY.minusDays(1)), report.range());
    assertEquals(0, report.totalItems());
    assertNull(report.topKeyword());
  }
}
