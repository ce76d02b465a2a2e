package com.jasmin.floodguard.scheduling;

import com.jasmin.floodguard.models.DetectionVerdict;
import com.jasmin.floodguard.models.ThreatEntry;
import com.jasmin.floodguard.services.FloodGuardService;
import com.jasmin.floodguard.services.ingestion.IngestionService;
import com.jasmin.floodguard.services.mitigation.MitigationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Drives ingestion, evaluation and mitigation as independent jobs so a slow mitigation pass
 * never holds up the next tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "flood-guard.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EvaluationScheduler {
    private final FloodGuardService floodGuardService;
    private final IngestionService ingestionService;
    private final MitigationService mitigationService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${flood-guard.scheduling.ingestion-drain-millis:100}")
    public void drainIngestion() {
        try {
            ingestionService.drain();
        } catch (RuntimeException e) {
            log.error("Ingestion drain failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${flood-guard.scheduling.evaluation-cadence-millis:1000}")
    public void evaluate() {
        try {
            List<ThreatEntry> queued = floodGuardService.evaluate(clock.instant());
            if (!queued.isEmpty()) {
                log.debug("Top threat this tick: {} ({})", queued.get(0).getSourceKey(), queued.get(0).getScore());
            }
        } catch (RuntimeException e) {
            log.error("Evaluation tick failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${flood-guard.scheduling.mitigation-cadence-millis:1000}",
            initialDelayString = "${flood-guard.scheduling.mitigation-cadence-millis:1000}")
    public void mitigate() {
        try {
            List<DetectionVerdict> verdicts = mitigationService.drainAndMitigate();
            long fresh = verdicts.stream().filter(DetectionVerdict::isFresh).count();
            if (fresh > 0) {
                log.debug("Mitigation pass: {} fresh, {} already handled", fresh, verdicts.size() - fresh);
            }
        } catch (RuntimeException e) {
            log.error("Mitigation pass failed", e);
        }
    }
}
