package com.jasmin.floodguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class EntropySnapshot {
    private long totalEvents;
    private int distinctSources;
    private Map<String, Long> distribution;

    /** Shannon entropy of the source distribution, in bits. */
    private double entropy;

    /** 0 for evenly spread traffic, 1 for traffic from a single source. */
    private double anomalyScore;

    private AnomalyLevel level;

    public static EntropySnapshot empty() {
        return new EntropySnapshot(0L, 0, Map.of(), 0.0, 0.0, AnomalyLevel.LOW);
    }
}
