package com.trendlens.api.controller;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.ScoredItem;
import com.trendlens.engine.search.ItemListing;
import com.trendlens.engine.search.SearchService;
import com.trendlens.engine.time.DateQueryParser;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NewsController.class)
@Import(RequestDates.class)
class NewsControllerTest {

  static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

  @TestConfiguration
  static class FixedDates {
    @Bean
    DateQueryParser dateQueryParser() {
      return new DateQueryParser(Clock.fixed(NOW, ZoneOffset.UTC));
    }
  }

  @Autowired
  private MockMvc mvc;

  @MockBean
  private SearchService search;

  @Test
  void byDateDefaultsToToday() throws Exception {
    LocalDate today = LocalDate.of(2026, 10, 18);
    ItemListing listing = new ItemListing(DateRange.single(today), NOW,
        List.of(new ScoredItem(NewsItem.of("hn", "Climate summit opens", 1, NOW), 0.8, 3)), 1, 1, 0);
    when(search.byDate(eq(today), isNull(), isNull())).thenReturn(listing);

    mvc.perform(get("/api/news/by-date"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.range.start").value("2026-10-18"))
        .andExpect(jsonPath("$.items[0].appearances").value(3));
  }

  @Test
  void latestPassesPlatformFilter() throws Exception {
    ItemListing listing = new ItemListing(DateRange.single(LocalDate.of(2026, 10, 18)), NOW,
        List.of(new ScoredItem(NewsItem.of("weibo", "Typhoon warning issued", 1, NOW), 1.0, 1)), 4, 1, 0);
    when(search.latest(eq(List.of("weibo")), eq(1))).thenReturn(listing);

    mvc.perform(get("/api/news/latest").param("platforms", "weibo").param("limit", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalFound").value(4))
        .andExpect(jsonPath("$.items[0].item.platform").value("weibo"));
  }

  @Test
  void unreadableDateIsBadRequest() throws Exception {
    mvc.perform(get("/api/news/by-date").param("date", "someday"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }
}
