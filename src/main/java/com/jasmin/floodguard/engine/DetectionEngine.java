package com.jasmin.floodguard.engine;

import com.jasmin.floodguard.detectors.DetectorUtils;
import com.jasmin.floodguard.detectors.burst.BurstScorer;
import com.jasmin.floodguard.detectors.entropy.EntropyScorer;
import com.jasmin.floodguard.detectors.slidingwindow.SlidingWindowCounter;
import com.jasmin.floodguard.detectors.threatscore.ThreatScoreCalculator;
import com.jasmin.floodguard.models.EntropySnapshot;
import com.jasmin.floodguard.models.SourceRecord;
import com.jasmin.floodguard.models.ThreatEntry;
import com.jasmin.floodguard.models.TrafficSample;
import com.jasmin.floodguard.models.WindowSnapshot;
import com.jasmin.floodguard.services.history.TrafficHistory;
import com.jasmin.floodguard.services.sourcestate.SourceStateCache;
import com.jasmin.floodguard.services.threatqueue.ThreatPriorityQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One evaluation tick: window snapshot, entropy score, per-source threat score,
 * source state update, and queueing of reportable sources for mitigation. Each tick
 * also appends an aggregate {@link TrafficSample} with its burst score to the history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DetectionEngine {
    private final SlidingWindowCounter windowCounter;
    private final EntropyScorer entropyScorer;
    private final ThreatScoreCalculator threatScoreCalculator;
    private final SourceStateCache sourceStateCache;
    private final ThreatPriorityQueue threatQueue;
    private final BurstScorer burstScorer;
    private final TrafficHistory trafficHistory;

    private volatile EntropySnapshot lastEntropy = EntropySnapshot.empty();
    private volatile Instant lastEvaluatedAt;

    /**
     * Runs a tick at {@code now}.
     *
     * @return the entries queued by this tick, highest score first
     */
    public List<ThreatEntry> evaluate(Instant now) {
        WindowSnapshot window = windowCounter.snapshot(now);
        EntropySnapshot entropy = entropyScorer.score(window.getCounts());
        long total = window.totalEvents();

        List<ThreatEntry> queued = new ArrayList<>();
        for (Map.Entry<String, Long> e : window.getCounts().entrySet()) {
            String key = e.getKey();
            long count = e.getValue();

            double raw = threatScoreCalculator.blend(count, total, entropy.getAnomalyScore());
            double rateScore = threatScoreCalculator.rateScore(count);

            SourceRecord updated = sourceStateCache.update(key, SourceRecord.firstSeen(key, now), prev -> prev.toBuilder()
                    .eventCount(count)
                    .rateScore(rateScore)
                    .anomalyScore(entropy.getAnomalyScore())
                    .threatScore(threatScoreCalculator.withDecay(raw, prev.getThreatScore()))
                    .lastEvaluatedAt(now)
                    .build());

            if (threatScoreCalculator.isReportable(updated.getThreatScore())) {
                ThreatEntry entry = new ThreatEntry(key, updated.getThreatScore(), now);
                threatQueue.upsert(entry);
                queued.add(entry);
            }
        }

        TrafficSample sample = sample(now, entropy, queued.size());
        trafficHistory.record(sample);
        lastEntropy = entropy;
        lastEvaluatedAt = now;

        if (!queued.isEmpty()) {
            log.info("Tick {}: {} events from {} sources, entropy={} anomaly={} ({}), burst={}, {} sources queued",
                    now, total, entropy.getDistinctSources(), String.format("%.3f", entropy.getEntropy()),
                    String.format("%.3f", entropy.getAnomalyScore()), entropy.getLevel(),
                    String.format("%.3f", sample.getBurstScore()), queued.size());
        } else {
            log.debug("Tick {}: {} events from {} sources, anomaly={}", now, total,
                    entropy.getDistinctSources(), entropy.getAnomalyScore());
        }

        queued.sort(Comparator.comparingDouble(ThreatEntry::getScore).reversed());
        return queued;
    }

    private TrafficSample sample(Instant now, EntropySnapshot entropy, int queuedSources) {
        double rps = DetectorUtils.perSecond(entropy.getTotalEvents(), windowCounter.getWindowSize());
        List<Double> rates = new ArrayList<>(trafficHistory.recentRates(burstScorer.getSampleCount() - 1));
        rates.add(rps);
        double burstiness = BurstScorer.burstiness(rates);

        return TrafficSample.builder()
                .at(now)
                .totalEvents(entropy.getTotalEvents())
                .distinctSources(entropy.getDistinctSources())
                .requestsPerSecond(rps)
                .entropy(entropy.getEntropy())
                .anomalyScore(entropy.getAnomalyScore())
                .level(entropy.getLevel())
                .burstiness(burstiness)
                .burstScore(burstScorer.score(burstiness))
                .queuedSources(queuedSources)
                .build();
    }

    public EntropySnapshot getLastEntropy() {
        return lastEntropy;
    }

    public Duration getWindowSize() {
        return windowCounter.getWindowSize();
    }

    public Instant getLastEvaluatedAt() {
        return lastEvaluatedAt;
    }

    public void reset() {
        windowCounter.reset();
        sourceStateCache.clear();
        threatQueue.clear();
        trafficHistory.clear();
        lastEntropy = EntropySnapshot.empty();
        lastEvaluatedAt = null;
    }
}
