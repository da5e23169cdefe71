package com.trendlens.engine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendlens.engine.config.CacheConfig;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.Snapshot;
import com.trendlens.engine.model.SnapshotReadResult;
import com.trendlens.engine.model.SnapshotSet;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;

/**
 * Filesystem store, one JSON document per tick under {@code <root>/<yyyy-MM-dd>/<yyyyMMdd'T'HHmmss_nanos>Z.json}.
 * The directory is the capture date in the configured zone; the file name is the capture instant in UTC,
 * so it stays unique when local clocks repeat an hour. A tick is written to a hidden temp file and
 * published with an atomic move.
 */
public class FileSnapshotStore implements SnapshotStore {

  private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

  private static final DateTimeFormatter TICK_NAME = DateTimeFormatter.ofPattern("uuuuMMdd'T'HHmmss'_'nnnnnnnnn'Z'")
      .withZone(ZoneOffset.UTC);
  private static final String SUFFIX = ".json";
  private static final String TEMP_PREFIX = ".tmp-";

  private final Path root;
  private final ObjectMapper mapper;
  private final ZoneId zone;
  private final Duration jitter;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final Counter appended;
  private final Counter skipped;

  public FileSnapshotStore(Path root, ObjectMapper mapper, ZoneId zone, Duration jitter, MeterRegistry metrics) {
    this.root = root;
    this.mapper = mapper;
    this.zone = zone;
    this.jitter = jitter;
    this.appended = metrics.counter("trendlens_snapshots_appended_total");
    this.skipped = metrics.counter("trendlens_snapshot_ticks_skipped_total");
    try {
      Files.createDirectories(root);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create snapshot root " + root, e);
    }
  }

  @Override
  @CacheEvict(cacheNames = {CacheConfig.LATEST, CacheConfig.BY_DATE, CacheConfig.TRENDING}, allEntries = true)
  public void append(SnapshotSet set) {
    SnapshotValidator.validate(set, jitter);
    SnapshotSet normalized = sortedByRank(set);

    Path dateDir = root.resolve(set.captureDate(zone).toString());
    Path target = dateDir.resolve(TICK_NAME.format(set.capturedAt()) + SUFFIX);

    writeLock.lock();
    try {
      if (Files.exists(target)) {
        throw new ValidationException("A snapshot set captured at " + set.capturedAt() + " already exists");
      }
      Files.createDirectories(dateDir);
      Path tmp = dateDir.resolve(TEMP_PREFIX + UUID.randomUUID() + SUFFIX);
      try {
        mapper.writeValue(tmp.toFile(), normalized);
        publish(tmp, target);
      } finally {
        Files.deleteIfExists(tmp);
      }
      appended.increment();
      log.info("[append] Published tick {} with {} snapshots", set.capturedAt(), set.snapshots().size());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write snapshot set " + set.capturedAt(), e);
    } finally {
      writeLock.unlock();
    }
  }

  private void publish(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic move unsupported under {}, falling back to plain move", root);
      Files.move(tmp, target);
    }
  }

  @Override
  public List<LocalDate> listDates(DateRange range) {
    List<LocalDate> out = new ArrayList<>();
    for (Path dir : dateDirectories()) {
      LocalDate date = LocalDate.parse(dir.getFileName().toString());
      if (range.contains(date) && !tickFiles(dir).isEmpty()) {
        out.add(date);
      }
    }
    return out;
  }

  @Override
  public SnapshotReadResult read(DateRange range, Collection<String> platforms) {
    List<SnapshotSet> sets = new ArrayList<>();
    int bad = 0;
    for (LocalDate date : listDates(range)) {
      for (Path file : tickFiles(root.resolve(date.toString()))) {
        try {
          SnapshotSet set = mapper.readValue(file.toFile(), SnapshotSet.class);
          SnapshotValidator.validate(set, jitter);
          sets.add(set.onlyPlatforms(platforms));
        } catch (IOException | ValidationException e) {
          bad++;
          skipped.increment();
          log.warn("Skipping unreadable tick {}: {}", file, e.getMessage());
        }
      }
    }
    sets.sort(Comparator.comparing(SnapshotSet::capturedAt));
    log.debug("[read] {} ticks for {} ({} skipped)", sets.size(), range, bad);
    return new SnapshotReadResult(sets, bad);
  }

  @Override
  public StoreStatus status() {
    List<LocalDate> dates = new ArrayList<>();
    int ticks = 0;
    long bytes = 0;
    for (Path dir : dateDirectories()) {
      List<Path> files = tickFiles(dir);
      if (files.isEmpty()) continue;
      dates.add(LocalDate.parse(dir.getFileName().toString()));
      ticks += files.size();
      for (Path f : files) {
        try {
          bytes += Files.size(f);
        } catch (IOException e) {
          throw new UncheckedIOException("Cannot stat " + f, e);
        }
      }
    }
    if (dates.isEmpty()) {
      return new StoreStatus(null, null, 0, 0, 0L);
    }
    return new StoreStatus(dates.get(0), dates.get(dates.size() - 1), dates.size(), ticks, bytes);
  }

  public Path root() {
    return root;
  }

  private List<Path> dateDirectories() {
    try (Stream<Path> children = Files.list(root)) {
      return children
          .filter(Files::isDirectory)
          .filter(p -> isDateName(p.getFileName().toString()))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list snapshot root " + root, e);
    }
  }

  private static List<Path> tickFiles(Path dateDir) {
    if (!Files.isDirectory(dateDir)) return List.of();
    try (Stream<Path> files = Files.list(dateDir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> {
            String name = p.getFileName().toString();
            return name.endsWith(SUFFIX) && !name.startsWith(".");
          })
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list " + dateDir, e);
    }
  }

  private static boolean isDateName(String name) {
    try {
      LocalDate.parse(name);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static SnapshotSet sortedByRank(SnapshotSet set) {
    List<Snapshot> snapshots = set.snapshots().stream()
        .map(s -> new Snapshot(s.platform(), s.capturedAt(),
            s.items().stream().sorted(Comparator.comparingInt(NewsItem::rank)).toList()))
        .toList();
    return new SnapshotSet(set.capturedAt(), snapshots);
  }
}
