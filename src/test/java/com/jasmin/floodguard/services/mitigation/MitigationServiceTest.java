package com.jasmin.floodguard.services.mitigation;

import com.jasmin.floodguard.constants.Constants;
import com.jasmin.floodguard.detectors.entropy.EntropyProperties;
import com.jasmin.floodguard.detectors.entropy.EntropyScorer;
import com.jasmin.floodguard.models.DetectionVerdict;
import com.jasmin.floodguard.models.MitigationAction;
import com.jasmin.floodguard.models.SourceRecord;
import com.jasmin.floodguard.models.ThreatEntry;
import com.jasmin.floodguard.models.VerdictStatus;
import com.jasmin.floodguard.services.BlockListService;
import com.jasmin.floodguard.services.SecurityAlertPublisher;
import com.jasmin.floodguard.services.sourcestate.SourceStateCache;
import com.jasmin.floodguard.services.threatqueue.ThreatPriorityQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MitigationServiceTest {

    private static final Instant TICK = Instant.parse("2026-01-01T00:00:05Z");

    @Mock
    private BlockListService blockListService;

    @Mock
    private SecurityAlertPublisher alertPublisher;

    private ThreatPriorityQueue queue;
    private SourceStateCache cache;
    private MitigationProperties props;
    private MitigationService service;

    @BeforeEach
    void setUp() {
        queue = new ThreatPriorityQueue();
        cache = new SourceStateCache(10);
        props = new MitigationProperties();
        service = new MitigationService(queue, cache, new MitigationPolicy(props),
                new EntropyScorer(new EntropyProperties()), blockListService, alertPublisher, props,
                Clock.fixed(TICK.plusMillis(200), ZoneOffset.UTC));
    }

    private void seed(String key, double rateScore, double anomaly, int strikes) {
        cache.put(SourceRecord.firstSeen(key, TICK).toBuilder()
                .rateScore(rateScore)
                .anomalyScore(anomaly)
                .rateLimitStrikes(strikes)
                .lastEvaluatedAt(TICK)
                .build());
    }

    @Test
    void worstOffenderIsHandledFirstAndDuplicatesAreNoOps() {
        seed("10.0.0.1", 1.0, 0.9, 0);
        queue.insert(new ThreatEntry("10.0.0.2", 0.5, TICK));
        queue.insert(new ThreatEntry("10.0.0.1", 0.93, TICK));
        queue.insert(new ThreatEntry("10.0.0.1", 0.93, TICK));
        queue.insert(new ThreatEntry("10.0.0.3", 0.65, TICK));

        List<DetectionVerdict> verdicts = service.drainAndMitigate();

        assertThat(verdicts).extracting(DetectionVerdict::getSourceKey)
                .containsExactly("10.0.0.1", "10.0.0.1", "10.0.0.3", "10.0.0.2");
        assertThat(verdicts).extracting(DetectionVerdict::getStatus)
                .containsExactly(VerdictStatus.FRESH, VerdictStatus.ALREADY_HANDLED, VerdictStatus.FRESH, VerdictStatus.FRESH);
        assertThat(verdicts).extracting(DetectionVerdict::getAction)
                .containsExactly(MitigationAction.BLOCK, MitigationAction.BLOCK, MitigationAction.CHALLENGE, MitigationAction.RATE_LIMIT);

        assertThat(verdicts.get(0).getThreats()).containsExactly(
                Constants.PER_SOURCE_RATE_EXCEEDED, Constants.LOW_ENTROPY_TRAFFIC, Constants.DDOS_ATTACK);
        assertThat(verdicts.get(0).getDecidedAt()).isEqualTo(TICK.plusMillis(200));

        verify(blockListService, times(1)).block(eq("10.0.0.1"), anyString(), eq(Duration.ofHours(1)));
        verify(alertPublisher, times(3)).publishAlert(any(DetectionVerdict.class));
        assertThat(service.getActiveMitigations()).isEqualTo(3L);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void actionIsWrittenBackToSourceState() {
        seed("10.0.0.2", 0.5, 0.2, 1);

        service.handle(new ThreatEntry("10.0.0.2", 0.45, TICK));

        SourceRecord record = cache.peek("10.0.0.2").orElseThrow();
        assertThat(record.getLastAction()).isEqualTo(MitigationAction.RATE_LIMIT);
        assertThat(record.getLastActionAt()).isEqualTo(TICK);
        assertThat(record.getRateLimitStrikes()).isEqualTo(2);
        assertThat(record.getRateScore()).isEqualTo(0.5);
    }

    @Test
    void entryFromLaterTickIsFreshAgain() {
        service.handle(new ThreatEntry("a", 0.45, TICK));

        DetectionVerdict again = service.handle(new ThreatEntry("a", 0.45, TICK));
        DetectionVerdict later = service.handle(new ThreatEntry("a", 0.45, TICK.plusSeconds(1)));

        assertThat(again.getStatus()).isEqualTo(VerdictStatus.ALREADY_HANDLED);
        assertThat(later.getStatus()).isEqualTo(VerdictStatus.FRESH);
        assertThat(cache.peek("a").orElseThrow().getRateLimitStrikes()).isEqualTo(2);
    }

    @Test
    void repeatedRateLimitsEscalate() {
        seed("b", 0.4, 0.1, 5);

        DetectionVerdict v = service.handle(new ThreatEntry("b", 0.45, TICK));

        assertThat(v.getAction()).isEqualTo(MitigationAction.CHALLENGE);
        assertThat(v.getThreats()).containsExactly(Constants.REPEATED_RATE_LIMIT);
    }

    @Test
    void sourceOnBlockListIsAlreadyHandled() {
        when(blockListService.isBlocked("c")).thenReturn(true);

        DetectionVerdict v = service.handle(new ThreatEntry("c", 0.99, TICK));

        assertThat(v.getStatus()).isEqualTo(VerdictStatus.ALREADY_HANDLED);
        assertThat(v.getAction()).isEqualTo(MitigationAction.BLOCK);
        assertThat(v.getThreats()).containsExactly(Constants.KNOWN_BLOCKED_SOURCE);
        verify(blockListService, never()).block(anyString(), anyString(), any(Duration.class));
        verify(alertPublisher, never()).publishAlert(any(DetectionVerdict.class));
    }

    @Test
    void belowThresholdTakesNoActionAndPublishesNothing() {
        DetectionVerdict v = service.handle(new ThreatEntry("d", 0.31, TICK));

        assertThat(v.getAction()).isEqualTo(MitigationAction.NONE);
        assertThat(v.isFresh()).isTrue();
        verify(alertPublisher, never()).publishAlert(any(DetectionVerdict.class));
        assertThat(service.recentActions(10)).isEmpty();
    }

    @Test
    void recentActionsAreNewestFirstAndBounded() {
        props.setRecentActionsLimit(2);
        props.setPublishAlerts(false);

        service.handle(new ThreatEntry("a", 0.45, TICK));
        service.handle(new ThreatEntry("b", 0.65, TICK));
        service.handle(new ThreatEntry("c", 0.95, TICK));

        assertThat(service.recentActions(10)).extracting(DetectionVerdict::getSourceKey).containsExactly("c", "b");
        verify(alertPublisher, never()).publishAlert(any(DetectionVerdict.class));
    }

    @Test
    void disabledMitigationLeavesQueueUntouched() {
        props.setEnabled(false);
        queue.insert(new ThreatEntry("a", 0.9, TICK));

        assertThat(service.drainAndMitigate()).isEmpty();
        assertThat(queue.size()).isEqualTo(1);
    }
}
