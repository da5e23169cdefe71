package com.trendlens.api.controller;

import com.trendlens.engine.analytics.KeywordCount;
import com.trendlens.engine.analytics.KeywordCounts;
import com.trendlens.engine.analytics.KeywordFrequencyCounter;
import com.trendlens.engine.analytics.SentimentBundleBuilder;
import com.trendlens.engine.analytics.TrendAnalyzer;
import com.trendlens.engine.analytics.TrendingMode;
import com.trendlens.engine.analytics.TrendingTopic;
import com.trendlens.engine.analytics.TrendingTopics;
import com.trendlens.engine.error.InsufficientDataException;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.insight.InsightService;
import com.trendlens.engine.insight.ReportType;
import com.trendlens.engine.insight.SummaryReport;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.time.DateQueryParser;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyticsController.class)
@Import(RequestDates.class)
class AnalyticsControllerTest {

  static final LocalDate TODAY = LocalDate.of(2026, 10, 18);

  @TestConfiguration
  static class FixedDates {
    @Bean
    DateQueryParser dateQueryParser() {
      return new DateQueryParser(Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC));
    }
  }

  @Autowired
  private MockMvc mvc;

  @MockBean
  private TrendAnalyzer trends;
  @MockBean
  private InsightService insights;
  @MockBean
  private KeywordFrequencyCounter keywords;
  @MockBean
  private SentimentBundleBuilder sentiment;

  @Test
  void trendWithoutMentionsIsNotFound() throws Exception {
    when(trends.analyze(eq("quantum"), isNull()))
        .thenThrow(new InsufficientDataException("no mentions of 'quantum' in 2026-10-12..2026-10-18"));

    mvc.perform(get("/api/analytics/trend").param("topic", "quantum"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("INSUFFICIENT_DATA"));
  }

  @Test
  void viralThresholdBelowOneIsBadRequest() throws Exception {
    when(insights.viralTopics(eq(TODAY), eq(0.5)))
        .thenThrow(new ValidationException("threshold must be at least 1, got 0.5"));

    mvc.perform(get("/api/analytics/viral").param("date", "today").param("threshold", "0.5"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void nonNumericThresholdIsBadRequest() throws Exception {
    mvc.perform(get("/api/analytics/viral").param("threshold", "lots"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void weeklyReportEndsOnTheRequestedDay() throws Exception {
    DateRange week = DateRange.of(TODAY.minusDays(6), TODAY);
    SummaryReport report = new SummaryReport(ReportType.WEEKLY, week, "# Weekly News Summary\n", 12, 2, 30, "climate", 0);
    when(insights.summaryReport(ReportType.WEEKLY, TODAY)).thenReturn(report);

    mvc.perform(get("/api/analytics/report").param("type", "WEEKLY").param("date", "2026-10-18"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.range.start").value("2026-10-12"))
        .andExpect(jsonPath("$.topKeyword").value("climate"))
        .andExpect(jsonPath("$.totalItems").value(12));
  }

  @Test
  void keywordCountsReportSkippedTicks() throws Exception {
    DateRange range = DateRange.single(TODAY);
    KeywordCounts counts = new KeywordCounts(range, List.of(
        new KeywordCount("ai", 3, Map.of(TODAY, 3L)),
        new KeywordCount("election", 0, Map.of(TODAY, 0L))), 1);
    when(keywords.count(eq(List.of("ai", "election")), isNull())).thenReturn(counts);

    mvc.perform(get("/api/analytics/keywords").param("keywords", "ai", "election"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.range.end").value("2026-10-18"))
        .andExpect(jsonPath("$.skippedTicks").value(1))
        .andExpect(jsonPath("$.keywords[0].keyword").value("ai"))
        .andExpect(jsonPath("$.keywords[0].total").value(3))
        .andExpect(jsonPath("$.keywords[1].total").value(0));
  }

  @Test
  void trendingDefaultsToTheNewestTick() throws Exception {
    TrendingTopics topics = new TrendingTopics(TrendingMode.CURRENT, DateRange.single(TODAY),
        Instant.parse("2026-10-18T11:00:00Z"),
        List.of(new TrendingTopic("climate", 2, List.of("Climate summit opens", "Climate talks stall"))), 1, 0);
    when(keywords.trending(isNull(), eq(TrendingMode.CURRENT))).thenReturn(topics);

    mvc.perform(get("/api/analytics/trending"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.mode").value("CURRENT"))
        .andExpect(jsonPath("$.topics[0].keyword").value("climate"))
        .andExpect(jsonPath("$.topics[0].matchedTitles.length()").value(2));
  }

  @Test
  void trendingWithoutDataIsNotFound() throws Exception {
    when(keywords.trending(eq(5), eq(TrendingMode.DAILY)))
        .thenThrow(new InsufficientDataException("No snapshots captured on 2026-10-18"));

    mvc.perform(get("/api/analytics/trending").param("topN", "5").param("mode", "DAILY"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("INSUFFICIENT_DATA"));
  }

  @Test
  void blankTopicComparisonIsRejected() throws Exception {
    when(insights.comparePlatforms(eq(" "), any()))
        .thenThrow(new ValidationException("topic must not be blank"));

    mvc.perform(get("/api/analytics/platforms").param("topic", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("topic must not be blank"));
  }
}
