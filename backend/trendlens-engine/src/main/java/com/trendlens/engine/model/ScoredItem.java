package com.trendlens.engine.model;

public record ScoredItem(NewsItem item, double compositeScore, int appearances) {

  public ItemIdentity identity() {
    return item.identity();
  }
}
