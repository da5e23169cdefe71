package com.trendlens.api.model;

import java.time.Instant;
import java.util.List;

public record AppendResponse(Instant capturedAt, List<String> platforms, int itemCount) {
}
