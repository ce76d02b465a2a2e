package com.jasmin.floodguard.services.sourcestate;

import com.jasmin.floodguard.models.SourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Thread-safe, bounded store of per-source state shared by the evaluation tick and the mitigation consumer.
 */
@Slf4j
@Service
public class SourceStateCache {

    private final LruCache<String, SourceRecord> cache;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong evictions = new AtomicLong();

    @Autowired
    public SourceStateCache(SourceStateProperties props) {
        this(props.getCapacity());
    }

    public SourceStateCache(int capacity) {
        this.cache = new LruCache<>(capacity);
    }

    public Optional<SourceRecord> get(String key) {
        lock.lock();
        try {
            return cache.get(key);
        } finally {
            lock.unlock();
        }
    }

    /** Diagnostic read: leaves recency order untouched. */
    public Optional<SourceRecord> peek(String key) {
        lock.lock();
        try {
            return cache.peek(key);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> put(SourceRecord record) {
        lock.lock();
        try {
            Optional<String> evicted = cache.put(record.getKey(), record);
            evicted.ifPresent(this::onEvicted);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read-modify-write under one lock acquisition. The current record (or {@code seed} when absent)
     * is passed to {@code update}; the result is stored and promoted.
     */
    public SourceRecord update(String key, SourceRecord seed, UnaryOperator<SourceRecord> update) {
        lock.lock();
        try {
            SourceRecord current = cache.peek(key).orElse(seed);
            SourceRecord next = update.apply(current);
            cache.put(key, next).ifPresent(this::onEvicted);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /** Highest threat scores first, without promoting anything. */
    public List<SourceRecord> topByThreatScore(int limit) {
        List<SourceRecord> all;
        lock.lock();
        try {
            all = cache.values();
        } finally {
            lock.unlock();
        }
        return all.stream()
                .sorted(Comparator.comparingDouble(SourceRecord::getThreatScore).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    public int size() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return cache.capacity();
    }

    public long evictions() {
        return evictions.get();
    }

    public void clear() {
        lock.lock();
        try {
            cache.clear();
        } finally {
            lock.unlock();
        }
    }

    private void onEvicted(String key) {
        evictions.incrementAndGet();
        log.debug("Evicted source state for {}", key);
    }
}
