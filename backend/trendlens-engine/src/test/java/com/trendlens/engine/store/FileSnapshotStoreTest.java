package com.trendlens.engine.store;

import com.trendlens.engine.EngineFixture;
import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.Snapshot;
import com.trendlens.engine.model.SnapshotReadResult;
import com.trendlens.engine.model.SnapshotSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.trendlens.engine.EngineFixture.TODAY;
import static com.trendlens.engine.EngineFixture.at;
import static com.trendlens.engine.EngineFixture.tick;
import static org.junit.jupiter.api.Assertions.*;

class FileSnapshotStoreTest {

  @TempDir
  Path root;

  private EngineFixture fx;
  private FileSnapshotStore store;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture(root);
    store = fx.store;
  }

  @Test
  void appendedTickReadsBack() {
    Instant t = at(TODAY, 9);
    store.append(tick(t, "hn", "First headline", "Second headline"));

    SnapshotReadResult read = store.read(DateRange.single(TODAY), null);

    assertEquals(1, read.sets().size());
    assertEquals(0, read.skippedTicks());
    SnapshotSet set = read.sets().get(0);
    assertEquals(t, set.capturedAt());
    assertEquals(List.of("First headline", "Second headline"),
        set.allItems().stream().map(NewsItem::title).toList());
    assertEquals(1.0, fx.metrics.counter("trendlens_snapshots_appended_total").count());
  }

  @Test
  void itemsAreStoredInRankOrder() {
    Instant t = at(TODAY, 9);
    NewsItem second = NewsItem.of("hn", "Second", 2, t);
    NewsItem first = NewsItem.of("hn", "First", 1, t);
    store.append(new SnapshotSet(t, List.of(new Snapshot("hn", t, List.of(second, first)))));

    List<NewsItem> items = store.read(DateRange.single(TODAY), null).sets().get(0).allItems();
    assertEquals(1, items.get(0).rank());
    assertEquals("First", items.get(0).title());
  }

  @Test
  void ticksComeBackInCaptureOrderAcrossDays() {
    LocalDate yesterday = TODAY.minusDays(1);
    store.append(tick(at(TODAY, 10), "hn", "c"));
    store.append(tick(at(yesterday, 23), "hn", "b"));
    store.append(tick(at(yesterday, 1), "hn", "a"));

    List<SnapshotSet> sets = store.read(DateRange.of(yesterday, TODAY), null).sets();
    assertEquals(List.of(at(yesterday, 1), at(yesterday, 23), at(TODAY, 10)),
        sets.stream().map(SnapshotSet::capturedAt).toList());
    assertEquals(List.of(yesterday, TODAY), store.listDates(DateRange.of(yesterday.minusDays(5), TODAY)));
    assertEquals(List.of(TODAY), store.listDates(DateRange.single(TODAY)));
  }

  @Test
  void duplicateTickIsRejected() {
    Instant t = at(TODAY, 9);
    store.append(tick(t, "hn", "Once"));
    assertThrows(ValidationException.class, () -> store.append(tick(t, "hn", "Twice")));
    assertEquals(1, store.read(DateRange.single(TODAY), null).sets().size());
  }

  @Test
  void invalidTickLeavesNothingBehind() throws IOException {
    Instant t = at(TODAY, 9);
    NewsItem gap = NewsItem.of("hn", "Rank three of one", 3, t);
    SnapshotSet bad = new SnapshotSet(t, List.of(new Snapshot("hn", t, List.of(gap))));

    assertThrows(ValidationException.class, () -> store.append(bad));
    try (Stream<Path> files = Files.walk(root)) {
      assertEquals(0, files.filter(Files::isRegularFile).count());
    }
  }

  @Test
  void corruptTickIsSkippedAndCounted() throws IOException {
    store.append(tick(at(TODAY, 9), "hn", "Good tick"));
    Files.writeString(root.resolve(TODAY.toString()).resolve("20261018T100000_000000000Z.json"), "{ not json");

    SnapshotReadResult read = store.read(DateRange.single(TODAY), null);

    assertEquals(1, read.sets().size());
    assertEquals(1, read.skippedTicks());
    assertEquals(1.0, fx.metrics.counter("trendlens_snapshot_ticks_skipped_total").count());
  }

  @Test
  void strayTempFilesAreIgnored() throws IOException {
    store.append(tick(at(TODAY, 9), "hn", "Good tick"));
    Files.writeString(root.resolve(TODAY.toString()).resolve(".tmp-abandoned.json"), "{");

    SnapshotReadResult read = store.read(DateRange.single(TODAY), null);
    assertEquals(1, read.sets().size());
    assertEquals(0, read.skippedTicks());
  }

  @Test
  void platformFilterKeepsOnlyRequestedPlatforms() {
    Map<String, List<String>> byPlatform = new LinkedHashMap<>();
    byPlatform.put("hn", List.of("From hn"));
    byPlatform.put("reddit", List.of("From reddit"));
    store.append(tick(at(TODAY, 9), byPlatform));

    List<NewsItem> items = store.read(DateRange.single(TODAY), List.of("reddit")).sets().get(0).allItems();
    assertEquals(1, items.size());
    assertEquals("reddit", items.get(0).platform());
  }

  @Test
  void emptyRangeReadsNothing() {
    SnapshotReadResult read = store.read(DateRange.single(TODAY), null);
    assertTrue(read.isEmpty());
  }

  @Test
  void statusSummarizesStoredTicks() {
    assertEquals(0, store.status().tickCount());
    assertNull(store.status().earliestDate());

    store.append(tick(at(TODAY.minusDays(2), 9), "hn", "a"));
    store.append(tick(at(TODAY, 9), "hn", "b"));
    store.append(tick(at(TODAY, 10), "hn", "c"));

    StoreStatus status = store.status();
    assertEquals(TODAY.minusDays(2), status.earliestDate());
    assertEquals(TODAY, status.latestDate());
    assertEquals(2, status.dateCount());
    assertEquals(3, status.tickCount());
    assertTrue(status.totalBytes() > 0);
  }

  @Test
  void repeatedLocalHourAtDstFallBackKeepsBothTicks() {
    EngineSettings newYork = EngineSettings.builder().zone("America/New_York").build();
    FileSnapshotStore local = new EngineFixture(root, newYork, true).store;
    LocalDate fallBack = LocalDate.of(2026, 11, 1);
    Instant firstOneThirty = Instant.parse("2026-11-01T05:30:00Z");
    Instant secondOneThirty = Instant.parse("2026-11-01T06:30:00Z");
    Instant earlyMorning = Instant.parse("2026-11-01T04:30:00Z");
    Instant lateEvening = Instant.parse("2026-11-02T04:30:00Z");

    local.append(tick(firstOneThirty, "hn", "Clocks go back tonight"));
    local.append(tick(secondOneThirty, "hn", "Clocks went back"));
    local.append(tick(earlyMorning, "hn", "Night shift begins"));
    local.append(tick(lateEvening, "hn", "Longest day of the year ends"));

    List<SnapshotSet> sets = local.read(DateRange.single(fallBack), null).sets();
    assertEquals(List.of(earlyMorning, firstOneThirty, secondOneThirty, lateEvening),
        sets.stream().map(SnapshotSet::capturedAt).toList());
    assertEquals(List.of(fallBack), local.listDates(DateRange.of(fallBack.minusDays(1), fallBack.plusDays(1))));
  }

  @Test
  void listDatesSkipsEmptyAndForeignDirectories() throws IOException {
    store.append(tick(at(TODAY, 9), "hn", "Only real tick"));
    Files.createDirectories(root.resolve(TODAY.minusDays(1).toString()));
    Files.createDirectories(root.resolve(TODAY.minusDays(2).toString()));
    Files.writeString(root.resolve(TODAY.minusDays(2).toString()).resolve(".tmp-left-over.json"), "{");
    Files.createDirectories(root.resolve("exports"));
    Files.writeString(root.resolve("exports").resolve("dump.json"), "{}");
    Files.createDirectories(root.resolve("2026-13-45"));
    Files.writeString(root.resolve(TODAY.minusDays(3).toString()), "not a directory");

    assertEquals(List.of(TODAY), store.listDates(DateRange.of(TODAY.minusDays(5), TODAY)));
    assertEquals(1, store.status().dateCount());
    assertEquals(1, store.read(DateRange.of(TODAY.minusDays(5), TODAY), null).sets().size());
  }
}
