package com.trendlens.engine.insight;

import java.util.List;

/** Two tokens, {@code first < second}, and the number of distinct titles carrying both. */
public record CooccurrencePair(String first, String second, int count, List<String> sampleTitles) {
}
