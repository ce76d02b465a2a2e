package com.jasmin.floodguard.detectors.slidingwindow;

import com.jasmin.floodguard.models.WindowSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts events per source over a single trailing window that only moves forward.
 * <p>
 * Events are kept in a time-ordered map of {@code epochMilli -> (source -> count)}, so out-of-order
 * arrivals inside the window are fine. {@link #snapshot(Instant)} drops everything at or before
 * {@code now - windowSize}; anything recorded at or before that horizon afterwards is rejected.
 * <p>
 * Counted interval for {@code snapshot(now)} is {@code (now - windowSize, now)}: an event at {@code t}
 * disappears from every snapshot with {@code now >= t + windowSize}.
 */
@Slf4j
@Service
public class SlidingWindowCounter {

    private final Duration windowSize;
    private final ReentrantLock lock = new ReentrantLock();

    private final NavigableMap<Long, Map<String, Long>> buckets = new TreeMap<>();

    // highest "now" passed to snapshot(); null until the first snapshot
    private Instant horizonNow;
    private long pending;

    @Autowired
    public SlidingWindowCounter(SlidingWindowProperties props) {
        this(props.windowSize());
    }

    public SlidingWindowCounter(Duration windowSize) {
        if (windowSize == null || windowSize.isZero() || windowSize.isNegative()) {
            throw new IllegalArgumentException("Window size must be positive");
        }
        this.windowSize = windowSize;
    }

    /**
     * Adds one occurrence for {@code sourceKey} at {@code timestamp}.
     *
     * @return {@code false} if the event is at or before the current window start and was dropped
     */
    public boolean record(String sourceKey, Instant timestamp) {
        lock.lock();
        try {
            Instant start = currentWindowStart();
            if (start != null && timestamp.toEpochMilli() <= start.toEpochMilli()) {
                log.debug("Dropping late event for {} at {} (window start {})", sourceKey, timestamp, start);
                return false;
            }
            buckets.computeIfAbsent(timestamp.toEpochMilli(), k -> new HashMap<>(4))
                    .merge(sourceKey, 1L, Long::sum);
            pending++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts per source for events in {@code (now - windowSize, now)} and discards expired events.
     */
    public WindowSnapshot snapshot(Instant now) {
        lock.lock();
        try {
            if (horizonNow == null || now.isAfter(horizonNow)) {
                horizonNow = now;
            }
            evictUpTo(horizonNow.minus(windowSize).toEpochMilli());

            Instant start = now.minus(windowSize);
            Map<String, Long> counts = new LinkedHashMap<>();
            // (start, now) exclusive on both ends
            for (Map<String, Long> bucket : buckets.subMap(start.toEpochMilli(), false, now.toEpochMilli(), false).values()) {
                for (Map.Entry<String, Long> e : bucket.entrySet()) {
                    counts.merge(e.getKey(), e.getValue(), Long::sum);
                }
            }
            return new WindowSnapshot(start, windowSize, counts);
        } finally {
            lock.unlock();
        }
    }

    /** Window start as of the latest snapshot, or {@code null} before the first one. */
    public Instant currentWindowStart() {
        lock.lock();
        try {
            return horizonNow == null ? null : horizonNow.minus(windowSize);
        } finally {
            lock.unlock();
        }
    }

    /** Events held, including ones not yet inside any snapshot. */
    public long pendingEvents() {
        lock.lock();
        try {
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    public void reset() {
        lock.lock();
        try {
            buckets.clear();
            horizonNow = null;
            pending = 0L;
        } finally {
            lock.unlock();
        }
    }

    private void evictUpTo(long cutoffMillisInclusive) {
        Iterator<Map.Entry<Long, Map<String, Long>>> it =
                buckets.headMap(cutoffMillisInclusive, true).entrySet().iterator();
        long evicted = 0L;
        while (it.hasNext()) {
            for (long c : it.next().getValue().values()) evicted += c;
            it.remove();
        }
        pending -= evicted;
        if (evicted > 0) {
            log.trace("Expired {} events at or before {}", evicted, Instant.ofEpochMilli(cutoffMillisInclusive));
        }
    }
}
