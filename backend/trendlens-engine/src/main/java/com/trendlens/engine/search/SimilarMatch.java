package com.trendlens.engine.search;

import com.trendlens.engine.model.ScoredItem;

public record SimilarMatch(ScoredItem item, double similarity) {}
