package com.trendlens.engine.store;

import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.NewsItem;
import com.trendlens.engine.model.Snapshot;
import com.trendlens.engine.model.SnapshotSet;
import java.time.Duration;
import java.time.Instant;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;

public final class SnapshotValidator {

  private SnapshotValidator() {
  }

  public static void validate(SnapshotSet set, Duration jitter) {
    if (set == null || set.capturedAt() == null) {
      throw new ValidationException("Snapshot set must carry a capture time");
    }
    if (set.snapshots().isEmpty()) {
      throw new ValidationException("Snapshot set captured at " + set.capturedAt() + " holds no snapshots");
    }
    Set<String> platforms = new HashSet<>();
    for (Snapshot snapshot : set.snapshots()) {
      String platform = snapshot.platform();
      if (platform == null || platform.isBlank()) {
        throw new ValidationException("Snapshot without platform in tick " + set.capturedAt());
      }
      if (!platforms.add(platform)) {
        throw new ValidationException("Platform '" + platform + "' appears twice in tick " + set.capturedAt());
      }
      checkJitter(set.capturedAt(), snapshot.capturedAt(), jitter, platform);
      checkItems(snapshot, set.capturedAt(), jitter);
    }
  }

  private static void checkItems(Snapshot snapshot, Instant tick, Duration jitter) {
    int n = snapshot.items().size();
    BitSet seen = new BitSet(n + 1);
    for (NewsItem item : snapshot.items()) {
      if (!snapshot.platform().equals(item.platform())) {
        throw new ValidationException("Item '" + item.title() + "' belongs to platform '" + item.platform()
            + "' but sits in the '" + snapshot.platform() + "' snapshot");
      }
      if (item.title() == null || item.title().isBlank()) {
        throw new ValidationException("Blank title at rank " + item.rank() + " of " + snapshot.platform());
      }
      int rank = item.rank();
      if (rank < 1 || rank > n) {
        throw new ValidationException("Rank " + rank + " of " + snapshot.platform()
            + " is outside 1.." + n + "; ranks must be contiguous from 1");
      }
      if (seen.get(rank)) {
        throw new ValidationException("Rank " + rank + " repeats in " + snapshot.platform());
      }
      seen.set(rank);
      checkJitter(tick, item.capturedAt(), jitter, snapshot.platform());
    }
  }

  private static void checkJitter(Instant tick, Instant captured, Duration jitter, String platform) {
    if (captured == null) {
      throw new ValidationException("Missing capture time in " + platform + " snapshot");
    }
    Duration drift = Duration.between(tick, captured).abs();
    if (drift.compareTo(jitter) > 0) {
      throw new ValidationException("Capture time " + captured + " of " + platform + " drifts " + drift
          + " from tick " + tick + " (tolerance " + jitter + ")");
    }
  }
}
