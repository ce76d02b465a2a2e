package com.jasmin.floodguard.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Aggregate traffic metrics of one evaluation tick.
 */
@Value
@Builder
public class TrafficSample {
    Instant at;
    long totalEvents;
    int distinctSources;
    double requestsPerSecond;
    double entropy;
    double anomalyScore;
    AnomalyLevel level;
    double burstiness;
    double burstScore;
    // sources queued for mitigation by this tick
    int queuedSources;
}
