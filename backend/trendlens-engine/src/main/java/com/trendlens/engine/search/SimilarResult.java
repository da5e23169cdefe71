package com.trendlens.engine.search;

import com.trendlens.engine.model.DateRange;
import java.util.List;

public record SimilarResult(
    String reference,
    double threshold,
    DateRange range,
    List<SimilarMatch> matches,
    int totalFound,
    int returned,
    int skippedTicks
) {}
