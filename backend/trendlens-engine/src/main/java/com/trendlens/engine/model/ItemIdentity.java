package com.trendlens.engine.model;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Dedup identity of a news item. The same story is re-crawled under different URLs, so identity is the
 * platform plus the normalized title rather than the link.
 */
public record ItemIdentity(String platform, String normalizedTitle) {

  public static ItemIdentity of(String platform, String title) {
    return new ItemIdentity(platform, normalizeTitle(title));
  }

  public static String normalizeTitle(String title) {
    if (title == null) return "";
    return Normalizer.normalize(title, Normalizer.Form.NFKC)
        .toLowerCase(Locale.ROOT)
        .replaceAll("\\s+", " ")
        .trim();
  }
}
