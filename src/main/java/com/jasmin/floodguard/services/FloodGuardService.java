package com.jasmin.floodguard.services;

import com.jasmin.floodguard.detectors.DetectorUtils;
import com.jasmin.floodguard.engine.DetectionEngine;
import com.jasmin.floodguard.models.DetectionVerdict;
import com.jasmin.floodguard.models.EntropySnapshot;
import com.jasmin.floodguard.models.IngestStatus;
import com.jasmin.floodguard.models.SourceRecord;
import com.jasmin.floodguard.models.ThreatEntry;
import com.jasmin.floodguard.models.TrafficOverview;
import com.jasmin.floodguard.models.TrafficSample;
import com.jasmin.floodguard.services.history.TrafficHistory;
import com.jasmin.floodguard.services.ingestion.IngestionService;
import com.jasmin.floodguard.services.mitigation.MitigationService;
import com.jasmin.floodguard.services.sourcestate.SourceStateCache;
import com.jasmin.floodguard.services.threatqueue.ThreatPriorityQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the control plane: ingest events, run evaluations, and read state for dashboards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FloodGuardService {
    private final IngestionService ingestionService;
    private final DetectionEngine detectionEngine;
    private final SourceStateCache sourceStateCache;
    private final ThreatPriorityQueue threatQueue;
    private final MitigationService mitigationService;
    private final BlockListService blockListService;
    private final TrafficHistory trafficHistory;
    private final Clock clock;

    /** Never blocks. The status tells the caller whether the event was taken or dropped. */
    public IngestStatus ingest(String sourceKey, Instant timestamp) {
        return ingestionService.ingest(sourceKey, timestamp);
    }

    /** Folds pending events into the window, then runs one tick at {@code now}. */
    public List<ThreatEntry> evaluate(Instant now) {
        ingestionService.drainAll();
        return detectionEngine.evaluate(now);
    }

    /** Read-only; does not change the source's recency in the cache. */
    public Optional<SourceRecord> queryState(String sourceKey) {
        String key = DetectorUtils.normalizeSourceKey(sourceKey);
        if (key == null) {
            return Optional.empty();
        }
        return sourceStateCache.peek(key);
    }

    public List<SourceRecord> topOffenders(int limit) {
        return sourceStateCache.topByThreatScore(limit);
    }

    public EntropySnapshot currentEntropy() {
        return detectionEngine.getLastEntropy();
    }

    public List<DetectionVerdict> recentActions(int limit) {
        return mitigationService.recentActions(limit);
    }

    /** Per-tick samples taken within the last {@code lookback}, oldest first. */
    public List<TrafficSample> history(Duration lookback) {
        return trafficHistory.since(clock.instant().minus(lookback));
    }

    /** Lifts a block ahead of its expiry. */
    public void unblock(String sourceKey) {
        String key = DetectorUtils.normalizeSourceKey(sourceKey);
        if (key == null) {
            return;
        }
        log.info("Unblocking {}", key);
        blockListService.unblock(key);
    }

    public TrafficOverview overview() {
        EntropySnapshot entropy = detectionEngine.getLastEntropy();
        Optional<TrafficSample> latest = trafficHistory.latest();
        return TrafficOverview.builder()
                .at(clock.instant())
                .acceptedEvents(ingestionService.getAccepted())
                .droppedInvalid(ingestionService.getDroppedInvalid())
                .droppedFuture(ingestionService.getDroppedFuture())
                .droppedLate(ingestionService.getDroppedLate())
                .droppedBackpressure(ingestionService.getDroppedBackpressure())
                .pendingEvents(ingestionService.pendingCount())
                .currentEntropy(entropy)
                .requestsPerSecond(DetectorUtils.perSecond(entropy.getTotalEvents(),
                        detectionEngine.getWindowSize()))
                .burstiness(latest.map(TrafficSample::getBurstiness).orElse(0.0))
                .burstScore(latest.map(TrafficSample::getBurstScore).orElse(0.0))
                .cachedSources(sourceStateCache.size())
                .cacheCapacity(sourceStateCache.capacity())
                .pendingThreats(threatQueue.size())
                .activeMitigations(mitigationService.getActiveMitigations())
                .blockedSources(blockListService.countBlocked())
                .build();
    }

    /** Clears all in-memory detection state. The Redis block list is left to expire. */
    public void reset() {
        log.info("Resetting detection state");
        ingestionService.reset();
        detectionEngine.reset();
        mitigationService.reset();
    }
}
