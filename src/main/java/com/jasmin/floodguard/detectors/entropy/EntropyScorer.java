package com.jasmin.floodguard.detectors.entropy;

import com.jasmin.floodguard.detectors.DetectorUtils;
import com.jasmin.floodguard.models.AnomalyLevel;
import com.jasmin.floodguard.models.EntropySnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Scores how concentrated traffic is across sources using Shannon entropy.
 * <p>
 * {@code anomalyScore = clamp(1 - min(H, Hmax) / Hmax, 0, 1)}: a single source scores 1,
 * spread traffic approaches 0. No traffic scores 0.
 */
@Service
@RequiredArgsConstructor
public class EntropyScorer {

    private final EntropyProperties props;

    public EntropySnapshot score(Map<String, Long> distribution) {
        if (distribution == null || distribution.isEmpty()) {
            return EntropySnapshot.empty();
        }

        long total = 0L;
        int distinct = 0;
        for (Long c : distribution.values()) {
            if (c != null && c > 0) {
                total += c;
                distinct++;
            }
        }
        if (total == 0L) {
            return new EntropySnapshot(0L, 0, Map.copyOf(distribution), 0.0, 0.0, AnomalyLevel.LOW);
        }

        double h = entropy(distribution, total);
        double score = anomalyScore(h);
        return new EntropySnapshot(total, distinct, Map.copyOf(distribution), h, score, classify(score));
    }

    /** Shannon entropy in bits; zero counts contribute nothing. */
    public static double entropy(Map<String, Long> distribution, long total) {
        if (total <= 0L) return 0.0;
        double h = 0.0;
        for (Long c : distribution.values()) {
            if (c == null || c <= 0) continue;
            double p = (double) c / total;
            h -= p * DetectorUtils.log2(p);
        }
        // -0.0 for a single source
        return Math.max(0.0, h);
    }

    public double anomalyScore(double entropyBits) {
        double hMax = props.getMaxEntropyBits();
        return DetectorUtils.clamp(1.0 - Math.min(entropyBits, hMax) / hMax, 0.0, 1.0);
    }

    public AnomalyLevel classify(double anomalyScore) {
        if (anomalyScore > props.getHighThreshold()) return AnomalyLevel.HIGH;
        if (anomalyScore > props.getMediumThreshold()) return AnomalyLevel.MEDIUM;
        return AnomalyLevel.LOW;
    }
}
