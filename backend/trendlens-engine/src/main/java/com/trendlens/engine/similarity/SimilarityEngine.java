package com.trendlens.engine.similarity;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.model.ItemIdentity;
import com.trendlens.engine.text.Tokenizer;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Token-set overlap normalized by the smaller set (overlap coefficient):
 * {@code |A ∩ B| / min(|A|, |B|)}. Symmetric, 1.0 for identical text, and never decreases when both
 * sides gain a shared token. A one-word topic fully contained in a title scores 1.0.
 */
@Component
public class SimilarityEngine {

  private final Tokenizer tokenizer;
  private final double dedupThreshold;
  private final double relatedThreshold;

  public SimilarityEngine(Tokenizer tokenizer, EngineSettings settings) {
    this.tokenizer = tokenizer;
    this.dedupThreshold = settings.dedupThreshold();
    this.relatedThreshold = settings.relatedThreshold();
  }

  public double similarity(String a, String b) {
    Set<String> left = tokenizer.tokenSet(a);
    Set<String> right = tokenizer.tokenSet(b);
    if (left.isEmpty() || right.isEmpty()) {
      // stopword-only text: compare the raw words instead
      left = new HashSet<>(tokenizer.words(a));
      right = new HashSet<>(tokenizer.words(b));
    }
    if (left.isEmpty() || right.isEmpty()) {
      String na = ItemIdentity.normalizeTitle(a);
      return !na.isEmpty() && na.equals(ItemIdentity.normalizeTitle(b)) ? 1.0 : 0.0;
    }
    return overlap(left, right);
  }

  public static double overlap(Set<String> left, Set<String> right) {
    if (left.isEmpty() || right.isEmpty()) return 0.0;
    Set<String> small = left.size() <= right.size() ? left : right;
    Set<String> large = small == left ? right : left;
    int shared = 0;
    for (String token : small) {
      if (large.contains(token)) shared++;
    }
    return (double) shared / small.size();
  }

  public boolean isDuplicate(String a, String b) {
    return similarity(a, b) >= dedupThreshold;
  }

  public boolean isRelated(String a, String b) {
    return similarity(a, b) >= relatedThreshold;
  }

  public double dedupThreshold() {
    return dedupThreshold;
  }

  public double relatedThreshold() {
    return relatedThreshold;
  }

  public List<String> tokens(String text) {
    return tokenizer.tokens(text);
  }
}
