package com.jasmin.floodguard.detectors.burst;

import com.jasmin.floodguard.detectors.DetectorUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scores how bursty the aggregate request rate is across recent ticks.
 * <p>
 * Burstiness is the coefficient of variation (population standard deviation over mean) of the
 * per-tick rates; it maps linearly from {@code threshold} to {@code ceiling} onto {@code [0, 1]}.
 */
@Service
@RequiredArgsConstructor
public class BurstScorer {

    private final BurstProperties props;

    /** Zero with fewer than two rates. A zero mean divides by 1. */
    public static double burstiness(List<Double> rates) {
        if (rates == null || rates.size() < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (double r : rates) sum += r;
        double mean = sum / rates.size();

        double squares = 0.0;
        for (double r : rates) {
            double d = r - mean;
            squares += d * d;
        }
        double std = Math.sqrt(squares / rates.size());
        return std / (mean > 0 ? mean : 1.0);
    }

    public double score(double burstiness) {
        double threshold = props.getThreshold();
        if (burstiness <= threshold) {
            return 0.0;
        }
        double span = props.getCeiling() - threshold;
        if (span <= 0) {
            return 1.0;
        }
        return DetectorUtils.clamp((burstiness - threshold) / span, 0.0, 1.0);
    }

    public int getSampleCount() {
        return props.getSampleCount();
    }
}
