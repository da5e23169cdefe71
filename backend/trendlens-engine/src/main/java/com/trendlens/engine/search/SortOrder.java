package com.trendlens.engine.search;

public enum SortOrder {
  WEIGHT,
  TIME
}
