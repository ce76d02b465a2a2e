package com.jasmin.floodguard.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Per-source state kept in the source state cache. Immutable; every update replaces the record.
 */
@Value
@Builder(toBuilder = true)
public class SourceRecord {
    String key;

    // events seen in the last evaluated window
    long eventCount;

    double rateScore;
    double anomalyScore;
    double threatScore;

    @Builder.Default
    MitigationAction lastAction = MitigationAction.NONE;
    Instant lastActionAt;
    int rateLimitStrikes;

    Instant firstSeen;
    Instant lastEvaluatedAt;

    public static SourceRecord firstSeen(String key, Instant at) {
        return SourceRecord.builder()
                .key(key)
                .firstSeen(at)
                .build();
    }
}
