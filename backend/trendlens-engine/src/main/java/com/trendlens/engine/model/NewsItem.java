package com.trendlens.engine.model;

import java.time.Instant;

/**
 * One ranked entry of a platform snapshot.
 *
 * @param rank    1-based position within the platform snapshot
 * @param hotness platform-reported popularity signal, {@code null} when the feed does not report one
 */
public record NewsItem(
    String platform,
    String title,
    String url,
    String mobileUrl,
    int rank,
    Double hotness,
    Instant capturedAt
) {

  public static NewsItem of(String platform, String title, int rank, Instant capturedAt) {
    return new NewsItem(platform, title, null, null, rank, null, capturedAt);
  }

  public ItemIdentity identity() {
    return ItemIdentity.of(platform, title);
  }

  public boolean hasHotness() {
    return hotness != null && !hotness.isNaN();
  }
}
