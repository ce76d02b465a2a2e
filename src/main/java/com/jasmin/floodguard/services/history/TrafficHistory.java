package com.jasmin.floodguard.services.history;

import com.jasmin.floodguard.models.TrafficSample;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded ring of per-tick {@link TrafficSample}s, oldest first.
 */
@Service
public class TrafficHistory {

    private final Deque<TrafficSample> samples = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;

    @Autowired
    public TrafficHistory(HistoryProperties props) {
        this(props.getCapacity());
    }

    public TrafficHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    public void record(TrafficSample sample) {
        lock.lock();
        try {
            samples.addLast(sample);
            while (samples.size() > capacity) {
                samples.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Samples taken strictly after {@code cutoff}, oldest first. */
    public List<TrafficSample> since(Instant cutoff) {
        lock.lock();
        try {
            List<TrafficSample> out = new ArrayList<>();
            for (TrafficSample s : samples) {
                if (s.getAt().isAfter(cutoff)) out.add(s);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** Request rates of the latest {@code n} samples, oldest first. */
    public List<Double> recentRates(int n) {
        lock.lock();
        try {
            List<Double> rates = new ArrayList<>(Math.min(n, samples.size()));
            Iterator<TrafficSample> it = samples.descendingIterator();
            while (it.hasNext() && rates.size() < n) {
                rates.add(0, it.next().getRequestsPerSecond());
            }
            return rates;
        } finally {
            lock.unlock();
        }
    }

    public Optional<TrafficSample> latest() {
        lock.lock();
        try {
            return Optional.ofNullable(samples.peekLast());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return samples.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        lock.lock();
        try {
            samples.clear();
        } finally {
            lock.unlock();
        }
    }
}
