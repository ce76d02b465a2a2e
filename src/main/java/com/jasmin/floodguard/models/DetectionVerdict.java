package com.jasmin.floodguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class DetectionVerdict {
    private String sourceKey;
    private double score;
    private MitigationAction action;
    private VerdictStatus status;
    private List<String> threats;
    private String details;
    private Instant decidedAt;

    public boolean isFresh() {
        return status == VerdictStatus.FRESH;
    }
}
