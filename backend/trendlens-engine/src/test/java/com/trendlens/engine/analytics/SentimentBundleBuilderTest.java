package com.trendlens.engine.analytics;

import com.trendlens.engine.EngineFixture;
import com.trendlens.engine.error.InsufficientDataException;
import com.trendlens.engine.model.ScoredItem;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.trendlens.engine.EngineFixture.TODAY;
import static com.trendlens.engine.EngineFixture.at;
import static com.trendlens.engine.EngineFixture.tick;
import static org.junit.jupiter.api.Assertions.*;

class SentimentBundleBuilderTest {

  @TempDir
  Path root;

  private EngineFixture fx;
  private SentimentBundleBuilder builder;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture(root);
    builder = new SentimentBundleBuilder(fx.search, fx.dates, fx.settings);

    Map<String, List<String>> first = new LinkedHashMap<>();
    first.put("hn", List.of("Tesla recalls vehicles", "Weather turns cold"));
    first.put("reddit", List.of("Tesla stock jumps"));
    Map<String, List<String>> second = new LinkedHashMap<>();
    second.put("hn", List.of("Tesla recalls vehicles"));
    second.put("reddit", List.of("Tesla stock jumps", "Tesla opens new factory"));
    fx.append(tick(at(TODAY, 8), first), tick(at(TODAY, 9), second));
  }

  @Test
  void groupsDistinctMatchesByPlatform() {
    SentimentBundle bundle = builder.build("tesla", null, null, null, true);

    assertEquals("tesla", bundle.topic());
    assertEquals(3, bundle.totalFound());
    assertEquals(3, bundle.returned());
    assertEquals(2, bundle.duplicatesRemoved());
    assertEquals(List.of("Tesla recalls vehicles"), titles(bundle.byPlatform().get("hn")));
    assertEquals(2, bundle.byPlatform().get("reddit").size());
    assertTrue(bundle.prompt().contains("about 'tesla'"));
    assertTrue(bundle.prompt().contains("[reddit] (2 items)"));
  }

  @Test
  void limitTruncatesAfterSorting() {
    SentimentBundle bundle = builder.build("tesla", null, null, 1, true);
    assertEquals(3, bundle.totalFound());
    assertEquals(1, bundle.returned());
  }

  @Test
  void blankTopicCollectsEverything() {
    SentimentBundle bundle = builder.build(null, null, null, null, false);
    assertNull(bundle.topic());
    assertEquals(4, bundle.totalFound());
  }

  @Test
  void noMatchesIsInsufficientData() {
    assertThrows(InsufficientDataException.class, () -> builder.build("volcano", null, null, null, true));
  }

  private static List<String> titles(List<ScoredItem> items) {
    return items.stream().map(s -> s.item().title()).toList();
  }
}
