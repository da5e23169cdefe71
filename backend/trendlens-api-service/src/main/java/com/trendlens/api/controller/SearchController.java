package com.trendlens.api.controller;

import com.trendlens.engine.search.SearchMode;
import com.trendlens.engine.search.SearchResult;
import com.trendlens.engine.search.SearchService;
import com.trendlens.engine.search.SimilarResult;
import com.trendlens.engine.search.SortOrder;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {

  private final SearchService search;
  private final RequestDates dates;

  public SearchController(SearchService search, RequestDates dates) {
    this.search = search;
    this.dates = dates;
  }

  @GetMapping("/api/search")
  public SearchResult search(
      @RequestParam(name = "q") String query,
      @RequestParam(name = "mode", defaultValue = "KEYWORD") SearchMode mode,
      @RequestParam(name = "sort", defaultValue = "WEIGHT") SortOrder sort,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end,
      @RequestParam(name = "platforms", required = false) List<String> platforms,
      @RequestParam(name = "limit", required = false) Integer limit
  ) {
    return search.search(query, dates.range(start, end), platforms, mode, limit, sort);
  }

  @GetMapping("/api/search/similar")
  public SimilarResult similar(
      @RequestParam(name = "title") String title,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end,
      @RequestParam(name = "limit", required = false) Integer limit
  ) {
    return search.findSimilar(title, dates.range(start, end), limit);
  }

  @GetMapping("/api/search/related-history")
  public SimilarResult relatedHistory(
      @RequestParam(name = "topic") String topic,
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end,
      @RequestParam(name = "limit", required = false) Integer limit
  ) {
    return search.searchRelatedHistory(topic, dates.range(start, end), limit);
  }
}
