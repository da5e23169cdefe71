package com.trendlens.engine.search;

public enum SearchMode {
  KEYWORD,
  FUZZY,
  ENTITY
}
