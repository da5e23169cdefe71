package com.trendlens.engine.store;

import com.trendlens.engine.model.DateRange;
import com.trendlens.engine.model.SnapshotReadResult;
import com.trendlens.engine.model.SnapshotSet;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface SnapshotStore {

  /**
   * Publishes a tick.
   *
   * @throws com.trendlens.engine.error.ValidationException if a snapshot breaks the rank invariants or a
   *     tick with the same capture time already exists
   */
  void append(SnapshotSet set);

  List<LocalDate> listDates(DateRange range);

  /**
   * Ticks captured within the range, ascending by capture time, optionally narrowed to a platform subset.
   * Undecodable ticks are skipped and counted in {@link SnapshotReadResult#skippedTicks()}.
   */
  SnapshotReadResult read(DateRange range, Collection<String> platforms);

  StoreStatus status();
}
