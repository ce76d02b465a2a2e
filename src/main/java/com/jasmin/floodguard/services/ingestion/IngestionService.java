package com.jasmin.floodguard.services.ingestion;

import com.jasmin.floodguard.detectors.DetectorUtils;
import com.jasmin.floodguard.detectors.slidingwindow.SlidingWindowCounter;
import com.jasmin.floodguard.models.IngestStatus;
import com.jasmin.floodguard.models.SecurityEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accepts events without blocking and hands them to the window counter in batches.
 * <p>
 * The pending buffer is bounded; when it is full new events are dropped so that detection
 * latency stays bounded under the very flood being detected.
 */
@Slf4j
@Service
public class IngestionService {

    private final SlidingWindowCounter windowCounter;
    private final IngestionProperties props;
    private final Clock clock;

    private final BlockingQueue<SecurityEvent> pending;
    private final ReentrantLock drainLock = new ReentrantLock();

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong droppedInvalid = new AtomicLong();
    private final AtomicLong droppedFuture = new AtomicLong();
    private final AtomicLong droppedLate = new AtomicLong();
    private final AtomicLong droppedBackpressure = new AtomicLong();

    public IngestionService(SlidingWindowCounter windowCounter, IngestionProperties props, Clock clock) {
        this.windowCounter = windowCounter;
        this.props = props;
        this.clock = clock;
        this.pending = new ArrayBlockingQueue<>(props.getPendingCapacity());
    }

    public IngestStatus ingest(String sourceKey, Instant timestamp) {
        String key = DetectorUtils.normalizeSourceKey(sourceKey);
        if (key == null || timestamp == null) {
            droppedInvalid.incrementAndGet();
            return IngestStatus.DROPPED_INVALID;
        }

        if (timestamp.isAfter(clock.instant().plus(props.maxFutureSkew()))) {
            droppedFuture.incrementAndGet();
            log.debug("Dropping future event for {} at {}", key, timestamp);
            return IngestStatus.DROPPED_FUTURE;
        }

        if (!pending.offer(SecurityEvent.builder().sourceKey(key).timestamp(timestamp).build())) {
            long dropped = droppedBackpressure.incrementAndGet();
            // once per 10k drops is enough to show a flood in the log
            if (dropped % 10_000 == 1) {
                log.warn("Pending event buffer full ({}), {} events dropped so far", props.getPendingCapacity(), dropped);
            }
            return IngestStatus.DROPPED_BACKPRESSURE;
        }

        accepted.incrementAndGet();
        return IngestStatus.ACCEPTED;
    }

    /**
     * Folds up to one batch of pending events into the window counter.
     *
     * @return number of events recorded into the window
     */
    public int drain() {
        drainLock.lock();
        try {
            List<SecurityEvent> batch = new ArrayList<>(Math.min(pending.size(), props.getDrainBatchSize()));
            pending.drainTo(batch, props.getDrainBatchSize());

            int recorded = 0;
            for (SecurityEvent e : batch) {
                if (windowCounter.record(e.getSourceKey(), e.getTimestamp())) {
                    recorded++;
                } else {
                    droppedLate.incrementAndGet();
                }
            }
            return recorded;
        } finally {
            drainLock.unlock();
        }
    }

    /** Drains until the buffer is empty or a pass records nothing new. */
    public int drainAll() {
        int total = 0;
        while (!pending.isEmpty()) {
            int before = pending.size();
            total += drain();
            if (pending.size() >= before) break;
        }
        return total;
    }

    public int pendingCount() {
        return pending.size();
    }

    public long getAccepted() {
        return accepted.get();
    }

    public long getDroppedInvalid() {
        return droppedInvalid.get();
    }

    public long getDroppedFuture() {
        return droppedFuture.get();
    }

    public long getDroppedLate() {
        return droppedLate.get();
    }

    public long getDroppedBackpressure() {
        return droppedBackpressure.get();
    }

    public void reset() {
        drainLock.lock();
        try {
            pending.clear();
            accepted.set(0);
            droppedInvalid.set(0);
            droppedFuture.set(0);
            droppedLate.set(0);
            droppedBackpressure.set(0);
        } finally {
            drainLock.unlock();
        }
    }
}
