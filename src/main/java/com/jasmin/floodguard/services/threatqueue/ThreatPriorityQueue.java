package com.jasmin.floodguard.services.threatqueue;

import com.jasmin.floodguard.models.ThreatEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Array-backed binary max-heap of {@link ThreatEntry} ordered by score.
 * <p>
 * Every parent scores at least as high as its children. Sift-up and sift-down only swap on a
 * strictly greater score; between two equal children the left one wins. The lock is held for
 * one heap operation at a time so the producer tick and the draining consumer never wait long.
 * <p>
 * {@link #insert} keeps every entry, duplicates included. {@link #upsert} keeps at most one
 * pending entry per source, so a tick that re-reports the same sources does not grow the heap.
 */
@Service
public class ThreatPriorityQueue {

    private final List<Node> heap = new ArrayList<>();
    // source key -> its pending entry from upsert
    private final Map<String, Node> pending = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @return the queue size after the insert
     */
    public int insert(ThreatEntry entry) {
        lock.lock();
        try {
            add(new Node(entry));
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues {@code entry}, or replaces the source's pending upserted entry with it and
     * moves it to its new place in the heap.
     *
     * @return the queue size after the call
     */
    public int upsert(ThreatEntry entry) {
        lock.lock();
        try {
            Node existing = pending.get(entry.getSourceKey());
            if (existing == null) {
                Node node = new Node(entry);
                pending.put(entry.getSourceKey(), node);
                add(node);
            } else {
                double previous = existing.entry.getScore();
                existing.entry = entry;
                if (entry.getScore() > previous) {
                    siftUp(existing.index);
                } else {
                    siftDown(existing.index);
                }
            }
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    /** Removes the highest scoring entry; empty when nothing is queued. */
    public Optional<ThreatEntry> extractMax() {
        lock.lock();
        try {
            if (heap.isEmpty()) {
                return Optional.empty();
            }
            Node max = heap.get(0);
            Node last = heap.remove(heap.size() - 1);
            if (!heap.isEmpty()) {
                place(0, last);
                siftDown(0);
            }
            pending.remove(max.entry.getSourceKey(), max);
            return Optional.of(max.entry);
        } finally {
            lock.unlock();
        }
    }

    /** Extracts up to {@code max} entries, highest score first. */
    public List<ThreatEntry> drain(int max) {
        List<ThreatEntry> out = new ArrayList<>();
        for (int i = 0; i < max; i++) {
            Optional<ThreatEntry> next = extractMax();
            if (next.isEmpty()) break;
            out.add(next.get());
        }
        return out;
    }

    public Optional<ThreatEntry> peek() {
        lock.lock();
        try {
            return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0).entry);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        lock.lock();
        try {
            heap.clear();
            pending.clear();
        } finally {
            lock.unlock();
        }
    }

    /** Number of sources with a pending upserted entry. */
    public int pendingSources() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private void add(Node node) {
        heap.add(node);
        node.index = heap.size() - 1;
        siftUp(node.index);
    }

    private void siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (score(i) <= score(parent)) break;
            swap(i, parent);
            i = parent;
        }
    }

    private void siftDown(int i) {
        int size = heap.size();
        while (true) {
            int left = 2 * i + 1;
            int right = left + 1;
            int largest = i;

            if (left < size && score(left) > score(largest)) {
                largest = left;
            }
            if (right < size && score(right) > score(largest)) {
                largest = right;
            }
            if (largest == i) break;

            swap(i, largest);
            i = largest;
        }
    }

    private double score(int i) {
        return heap.get(i).entry.getScore();
    }

    private void swap(int a, int b) {
        Node tmp = heap.get(a);
        place(a, heap.get(b));
        place(b, tmp);
    }

    private void place(int i, Node node) {
        heap.set(i, node);
        node.index = i;
    }

    private static final class Node {
        ThreatEntry entry;
        int index;

        Node(ThreatEntry entry) {
            this.entry = entry;
        }
    }
}
