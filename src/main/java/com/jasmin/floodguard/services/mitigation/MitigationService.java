package com.jasmin.floodguard.services.mitigation;

import com.jasmin.floodguard.constants.Constants;
import com.jasmin.floodguard.detectors.entropy.EntropyScorer;
import com.jasmin.floodguard.models.AnomalyLevel;
import com.jasmin.floodguard.models.DetectionVerdict;
import com.jasmin.floodguard.models.MitigationAction;
import com.jasmin.floodguard.models.SourceRecord;
import com.jasmin.floodguard.models.ThreatEntry;
import com.jasmin.floodguard.models.VerdictStatus;
import com.jasmin.floodguard.services.BlockListService;
import com.jasmin.floodguard.services.SecurityAlertPublisher;
import com.jasmin.floodguard.services.sourcestate.SourceStateCache;
import com.jasmin.floodguard.services.threatqueue.ThreatPriorityQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumer side of the threat queue: pops the worst offenders, applies {@link MitigationPolicy},
 * and feeds the action back into the source state cache.
 * <p>
 * All external I/O (block list, alerts) happens here, after extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MitigationService {

    private final ThreatPriorityQueue threatQueue;
    private final SourceStateCache sourceStateCache;
    private final MitigationPolicy policy;
    private final EntropyScorer entropyScorer;
    private final BlockListService blockListService;
    private final SecurityAlertPublisher alertPublisher;
    private final MitigationProperties props;
    private final Clock clock;

    private final Deque<DetectionVerdict> recentActions = new ArrayDeque<>();
    private final AtomicLong activeMitigations = new AtomicLong();

    public List<DetectionVerdict> drainAndMitigate() {
        if (!props.isEnabled()) {
            return List.of();
        }
        List<DetectionVerdict> verdicts = new ArrayList<>();
        for (ThreatEntry entry : threatQueue.drain(props.getDrainBatchSize())) {
            verdicts.add(handle(entry));
        }
        return verdicts;
    }

    public DetectionVerdict handle(ThreatEntry entry) {
        final String key = entry.getSourceKey();
        final Instant now = clock.instant();

        Optional<SourceRecord> current = sourceStateCache.peek(key);
        if (current.isPresent() && isHandled(current.get(), entry)) {
            return alreadyHandled(entry, current.get().getLastAction(), "Already handled at " + current.get().getLastActionAt(), now);
        }
        if (blockListService.isBlocked(key)) {
            markHandled(key, entry, MitigationAction.BLOCK, current.map(SourceRecord::getRateLimitStrikes).orElse(0));
            return alreadyHandled(entry, MitigationAction.BLOCK, "Source is on the block list", now);
        }

        int strikes = current.map(SourceRecord::getRateLimitStrikes).orElse(0);
        MitigationPolicy.Decision decision = policy.decide(entry.getScore(), strikes);
        markHandled(key, entry, decision.getAction(), decision.getStrikes());

        DetectionVerdict verdict = DetectionVerdict.builder()
                .sourceKey(key)
                .score(entry.getScore())
                .action(decision.getAction())
                .status(VerdictStatus.FRESH)
                .threats(threats(current.orElse(null), decision))
                .details(String.format("score=%.3f strikes=%d", entry.getScore(), decision.getStrikes()))
                .decidedAt(now)
                .build();

        if (decision.getAction() != MitigationAction.NONE) {
            apply(verdict);
        }
        return verdict;
    }

    public List<DetectionVerdict> recentActions(int limit) {
        List<DetectionVerdict> out = new ArrayList<>();
        synchronized (recentActions) {
            Iterator<DetectionVerdict> it = recentActions.descendingIterator();
            while (it.hasNext() && out.size() < limit) out.add(it.next());
        }
        return out;
    }

    public long getActiveMitigations() {
        return activeMitigations.get();
    }

    public void reset() {
        synchronized (recentActions) {
            recentActions.clear();
        }
        activeMitigations.set(0);
    }

    private void apply(DetectionVerdict verdict) {
        activeMitigations.incrementAndGet();
        log.info("Applied {} to {} with score {}", verdict.getAction(), verdict.getSourceKey(),
                String.format("%.2f", verdict.getScore()));

        if (verdict.getAction() == MitigationAction.BLOCK) {
            blockListService.block(verdict.getSourceKey(), "Threat score: " + String.format("%.2f", verdict.getScore()),
                    props.blockDuration());
        }
        if (props.isPublishAlerts()) {
            alertPublisher.publishAlert(verdict);
        }

        synchronized (recentActions) {
            recentActions.addLast(verdict);
            while (recentActions.size() > props.getRecentActionsLimit()) {
                recentActions.removeFirst();
            }
        }
    }

    // An action taken at or after this entry's tick covers it.
    private boolean isHandled(SourceRecord record, ThreatEntry entry) {
        return record.getLastActionAt() != null && !entry.getEvaluatedAt().isAfter(record.getLastActionAt());
    }

    private void markHandled(String key, ThreatEntry entry, MitigationAction action, int strikes) {
        sourceStateCache.update(key, SourceRecord.firstSeen(key, entry.getEvaluatedAt()), prev -> prev.toBuilder()
                .lastAction(action)
                .lastActionAt(entry.getEvaluatedAt())
                .rateLimitStrikes(strikes)
                .build());
    }

    private DetectionVerdict alreadyHandled(ThreatEntry entry, MitigationAction action, String details, Instant now) {
        log.debug("Skipping {} for {}: {}", entry.getScore(), entry.getSourceKey(), details);
        return DetectionVerdict.builder()
                .sourceKey(entry.getSourceKey())
                .score(entry.getScore())
                .action(action)
                .status(VerdictStatus.ALREADY_HANDLED)
                .threats(action == MitigationAction.BLOCK ? List.of(Constants.KNOWN_BLOCKED_SOURCE) : List.of())
                .details(details)
                .decidedAt(now)
                .build();
    }

    private List<String> threats(SourceRecord record, MitigationPolicy.Decision decision) {
        LinkedHashSet<String> threats = new LinkedHashSet<>();
        if (record != null) {
            if (record.getRateScore() >= 1.0) {
                threats.add(Constants.PER_SOURCE_RATE_EXCEEDED);
            }
            if (entropyScorer.classify(record.getAnomalyScore()) == AnomalyLevel.HIGH) {
                threats.add(Constants.LOW_ENTROPY_TRAFFIC);
            }
        }
        if (decision.isEscalated()) {
            threats.add(Constants.REPEATED_RATE_LIMIT);
        }
        if (decision.getAction() == MitigationAction.BLOCK) {
            threats.add(Constants.DDOS_ATTACK);
        }
        return new ArrayList<>(threats);
    }
}
