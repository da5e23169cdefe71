package com.trendlens.engine.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Lower-cased, accent-folded content tokens of a headline with stopwords removed. */
public class Tokenizer {

  private final Stopwords stopwords;
  private final int minLen;
  private final int maxLen;

  public Tokenizer(Stopwords stopwords, int minLen, int maxLen) {
    this.stopwords = stopwords;
    this.minLen = minLen;
    this.maxLen = maxLen;
  }

  public List<String> tokens(String text) {
    List<String> out = new ArrayList<>();
    for (String p : words(text)) {
      if (p.length() < minLen || p.length() > maxLen) continue;
      if (stopwords.contains(p)) continue;
      out.add(p);
    }
    return out;
  }

  public Set<String> tokenSet(String text) {
    return new LinkedHashSet<>(tokens(text));
  }

  public List<String> words(String text) {
    if (text == null || text.isBlank()) return List.of();
    String norm = Normalizer.normalize(text, Normalizer.Form.NFKD)
        .replaceAll("\\p{M}+", "")
        .toLowerCase(Locale.ROOT);

    // drop links, keep letters, digits and intra-word apostrophes
    norm = norm.replaceAll("https?://\\S+", " ")
        .replaceAll("(?<=\\p{L})'(?=\\p{L})", "")
        .replaceAll("[^\\p{L}\\p{N}]+", " ")
        .trim();
    if (norm.isEmpty()) return List.of();
    return List.of(norm.split("\\s+"));
  }

  public boolean isStopword(String word) {
    return stopwords.contains(word.toLowerCase(Locale.ROOT));
  }
}
