package com.trendlens.api.controller;

import com.trendlens.api.model.AppendResponse;
import com.trendlens.engine.model.Snapshot;
import com.trendlens.engine.model.SnapshotSet;
import com.trendlens.engine.store.SnapshotStore;
import com.trendlens.engine.store.StoreStatus;
import com.trendlens.engine.time.DateRanges;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SnapshotController {

  private final SnapshotStore store;
  private final RequestDates dates;
  private final DateRanges ranges;

  public SnapshotController(SnapshotStore store, RequestDates dates, DateRanges ranges) {
    this.store = store;
    this.dates = dates;
    this.ranges = ranges;
  }

  @PostMapping("/api/snapshots")
  public ResponseEntity<AppendResponse> append(@RequestBody SnapshotSet set) {
    store.append(set);
    List<String> platforms = set.snapshots().stream().map(Snapshot::platform).toList();
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new AppendResponse(set.capturedAt(), platforms, set.allItems().size()));
  }

  @GetMapping("/api/snapshots/dates")
  public List<LocalDate> dates(
      @RequestParam(name = "start", required = false) String start,
      @RequestParam(name = "end", required = false) String end
  ) {
    return store.listDates(ranges.resolve(dates.range(start, end), ranges.todayRange()));
  }

  @GetMapping("/api/snapshots/status")
  public StoreStatus status() {
    return store.status();
  }
}
