package com.jasmin.floodguard.models;

import lombok.Value;

import java.time.Instant;

/**
 * Scheduling entry for the mitigation consumer. Several entries for the same source may be queued at once.
 */
@Value
public class ThreatEntry {
    String sourceKey;
    double score;
    Instant evaluatedAt;
}
