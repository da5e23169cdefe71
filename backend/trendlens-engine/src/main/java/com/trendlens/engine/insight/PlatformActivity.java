package com.trendlens.engine.insight;

import java.time.Duration;
import java.util.List;

/**
 * Capture activity of one platform.
 *
 * @param averageInterval mean gap between consecutive captures, {@code null} with fewer than two
 * @param busiestHours    up to three capture hours (0-23), most captures first
 */
public record PlatformActivity(
    String platform,
    int captureCount,
    Duration averageInterval,
    int itemCount,
    int activeDays,
    List<Integer> busiestHours
) {
}
