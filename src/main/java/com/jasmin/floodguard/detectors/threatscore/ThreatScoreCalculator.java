package com.jasmin.floodguard.detectors.threatscore;

import com.jasmin.floodguard.detectors.DetectorUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Blends a source's own rate with the global entropy anomaly.
 * <pre>
 * rateScore = min(1, count / rateCeiling)
 * share     = count / total
 * raw       = (wRate * rateScore + wAnomaly * anomaly * share) / (wRate + wAnomaly)
 * score     = max(raw, previous * decayFactor)
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class ThreatScoreCalculator {

    private final ThreatScoreProperties props;

    public double rateScore(long count) {
        if (count <= 0) return 0.0;
        return Math.min(1.0, (double) count / props.getRateCeiling());
    }

    public double blend(long count, long total, double anomalyScore) {
        double wRate = props.getRateWeight();
        double wAnomaly = props.getAnomalyWeight();
        double weights = wRate + wAnomaly;
        if (weights <= 0.0 || count <= 0 || total <= 0) {
            return 0.0;
        }
        double share = (double) count / total;
        double raw = (wRate * rateScore(count) + wAnomaly * DetectorUtils.clamp(anomalyScore, 0.0, 1.0) * share) / weights;
        return DetectorUtils.clamp(raw, 0.0, 1.0);
    }

    /** Keeps a recently hot source from cooling off faster than the decay factor allows. */
    public double withDecay(double current, double previous) {
        return Math.max(current, previous * props.getDecayFactor());
    }

    public boolean isReportable(double score) {
        return score >= props.getReportingThreshold();
    }
}
