package com.trendlens.engine.analytics;

import java.time.LocalDate;
import java.util.Map;

public record KeywordCount(String keyword, long total, Map<LocalDate, Long> perDay) {
}
