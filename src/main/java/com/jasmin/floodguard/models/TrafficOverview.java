package com.jasmin.floodguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class TrafficOverview {
    private Instant at;

    private long acceptedEvents;
    private long droppedInvalid;
    private long droppedFuture;
    private long droppedLate;
    private long droppedBackpressure;
    private int pendingEvents;

    private EntropySnapshot currentEntropy;
    private double requestsPerSecond;
    private double burstiness;
    private double burstScore;

    private int cachedSources;
    private int cacheCapacity;
    private int pendingThreats;

    private long activeMitigations;
    private long blockedSources;
}
