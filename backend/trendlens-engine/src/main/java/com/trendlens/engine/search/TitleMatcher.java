package com.trendlens.engine.search;

import com.trendlens.engine.similarity.SimilarityEngine;
import com.trendlens.engine.text.EntityExtractor;
import com.trendlens.engine.text.Tokenizer;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class TitleMatcher {

  private static final Logger log = LoggerFactory.getLogger(TitleMatcher.class);

  private final SimilarityEngine similarity;
  private final Tokenizer tokenizer;
  private final EntityExtractor entities;

  @Autowired
  public TitleMatcher(SimilarityEngine similarity, Tokenizer tokenizer, ObjectProvider<EntityExtractor> entities) {
    this(similarity, tokenizer, Optional.ofNullable(entities.getIfAvailable()));
  }

  public TitleMatcher(SimilarityEngine similarity, Tokenizer tokenizer, Optional<EntityExtractor> entities) {
    this.similarity = similarity;
    this.tokenizer = tokenizer;
    this.entities = entities.orElse(null);
    if (this.entities == null) {
      log.info("No entity extractor configured; entity searches run as keyword searches");
    }
  }

  /** Entity search degrades to keyword search when no extractor is configured. */
  public SearchMode effectiveMode(SearchMode requested) {
    if (requested == SearchMode.ENTITY && entities == null) {
      return SearchMode.KEYWORD;
    }
    return requested;
  }

  public Query compile(String query, SearchMode mode) {
    return new Query(query, effectiveMode(mode));
  }

  public boolean keywordMatch(String query, String title) {
    return compile(query, SearchMode.KEYWORD).test(title);
  }

  public final class Query {
    private final String raw;
    private final String lower;
    private final Set<String> tokens;
    private final SearchMode mode;

    private Query(String raw, SearchMode mode) {
      this.raw = raw;
      this.lower = raw.strip().toLowerCase(Locale.ROOT);
      this.tokens = new HashSet<>(tokenizer.tokens(raw));
      this.mode = mode;
    }

    public SearchMode mode() {
      return mode;
    }

    public boolean test(String title) {
      if (title == null) return false;
      return switch (mode) {
        case KEYWORD -> keyword(title);
        case FUZZY -> similarity.similarity(raw, title) >= similarity.relatedThreshold();
        case ENTITY -> keyword(title) && entity(title);
      };
    }

    private boolean keyword(String title) {
      if (title.toLowerCase(Locale.ROOT).contains(lower)) return true;
      if (tokens.isEmpty()) return false;
      List<String> titleTokens = tokenizer.tokens(title);
      return titleTokens.containsAll(tokens);
    }

    private boolean entity(String title) {
      for (String entity : entities.extract(title)) {
        if (entity.toLowerCase(Locale.ROOT).contains(lower)) return true;
      }
      return false;
    }
  }
}
