package com.trendlens.engine.store;

import java.time.LocalDate;

public record StoreStatus(
    LocalDate earliestDate,
    LocalDate latestDate,
    int dateCount,
    int tickCount,
    long totalBytes
) {}
