package com.trendlens.engine.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Heuristic extractor: runs of capitalized words and all-caps acronyms are entities, stopwords break a
 * run. "Elon Musk visits Berlin" yields {@code Elon Musk} and {@code Berlin}.
 */
public class CapitalizedEntityExtractor implements EntityExtractor {

  private final Tokenizer tokenizer;

  public CapitalizedEntityExtractor(Tokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  @Override
  public Set<String> extract(String title) {
    Set<String> entities = new LinkedHashSet<>();
    if (title == null || title.isBlank()) return entities;

    List<String> run = new ArrayList<>();
    for (String raw : title.split("\\s+")) {
      String word = raw.replaceAll("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$", "");
      if (word.endsWith("'s") || word.endsWith("’s")) {
        word = word.substring(0, word.length() - 2);
      }
      boolean entityLike = !word.isEmpty()
          && Character.isUpperCase(word.codePointAt(0))
          && !tokenizer.isStopword(word);
      if (entityLike) {
        run.add(word);
      } else {
        flush(run, entities);
      }
      // punctuation at the end of a word closes the run
      if (entityLike && !raw.equals(word) && raw.matches(".*[,.:;!?)\\]]$")) {
        flush(run, entities);
      }
    }
    flush(run, entities);
    return entities;
  }

  private static void flush(List<String> run, Set<String> entities) {
    if (!run.isEmpty()) {
      entities.add(String.join(" ", run));
      run.clear();
    }
  }
}
