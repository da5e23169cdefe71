package com.trendlens.api.controller;

import com.trendlens.engine.search.ItemListing;
import com.trendlens.engine.search.SearchService;
import java.time.LocalDate;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class NewsController {

  private final SearchService search;
  private final RequestDates dates;

  public NewsController(SearchService search, RequestDates dates) {
    this.search = search;
    this.dates = dates;
  }

  @GetMapping("/api/news/latest")
  public ItemListing latest(
      @RequestParam(name = "platforms", required = false) List<String> platforms,
      @RequestParam(name = "limit", required = false) Integer limit
  ) {
    return search.latest(platforms, limit);
  }

  @GetMapping("/api/news/by-date")
  public ItemListing byDate(
      @RequestParam(name = "date", defaultValue = "today") String date,
      @RequestParam(name = "platforms", required = false) List<String> platforms,
      @RequestParam(name = "limit", required = false) Integer limit
  ) {
    LocalDate day = dates.date(date);
    return search.byDate(day, platforms, limit);
  }
}
