package com.jasmin.floodguard.models;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Value
public class WindowSnapshot {
    Instant windowStart;
    Duration windowSize;
    // source key -> events with windowStart < t < windowStart + windowSize
    Map<String, Long> counts;

    public long totalEvents() {
        long total = 0L;
        for (long c : counts.values()) total += c;
        return total;
    }
}
