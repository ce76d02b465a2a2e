package com.jasmin.floodguard.services.sourcestate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used map: a hash index over a doubly linked recency list.
 * {@link #get} and {@link #put} are O(1) and promote the key; {@link #peek} does not.
 * <p>
 * Not thread-safe; {@link SourceStateCache} serializes access.
 */
public class LruCache<K, V> {

    private static final class Node<K, V> {
        final K key;
        V value;
        Node<K, V> prev;
        Node<K, V> next;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private final int capacity;
    private final Map<K, Node<K, V>> index;

    // head = most recently used, tail = least recently used
    private Node<K, V> head;
    private Node<K, V> tail;

    public LruCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.index = new HashMap<>(Math.min(capacity, 1 << 16) * 4 / 3 + 1);
    }

    /** Returns the value and marks the key most recently used. A miss changes nothing. */
    public Optional<V> get(K key) {
        Node<K, V> n = index.get(key);
        if (n == null) {
            return Optional.empty();
        }
        moveToHead(n);
        return Optional.ofNullable(n.value);
    }

    /** Returns the value without touching recency order. */
    public Optional<V> peek(K key) {
        Node<K, V> n = index.get(key);
        return n == null ? Optional.empty() : Optional.ofNullable(n.value);
    }

    /**
     * Inserts or overwrites {@code key} and marks it most recently used.
     *
     * @return the evicted key, if the insert pushed the cache over capacity
     */
    public Optional<K> put(K key, V value) {
        Node<K, V> n = index.get(key);
        if (n != null) {
            n.value = value;
            moveToHead(n);
            return Optional.empty();
        }

        n = new Node<>(key, value);
        index.put(key, n);
        linkAtHead(n);

        if (index.size() > capacity) {
            Node<K, V> lru = tail;
            unlink(lru);
            index.remove(lru.key);
            return Optional.of(lru.key);
        }
        return Optional.empty();
    }

    public Optional<V> remove(K key) {
        Node<K, V> n = index.remove(key);
        if (n == null) {
            return Optional.empty();
        }
        unlink(n);
        return Optional.ofNullable(n.value);
    }

    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    /** Keys from most to least recently used. */
    public List<K> keys() {
        List<K> out = new ArrayList<>(index.size());
        for (Node<K, V> n = head; n != null; n = n.next) out.add(n.key);
        return out;
    }

    /** Values from most to least recently used. */
    public List<V> values() {
        List<V> out = new ArrayList<>(index.size());
        for (Node<K, V> n = head; n != null; n = n.next) out.add(n.value);
        return out;
    }

    public int size() {
        return index.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        index.clear();
        head = null;
        tail = null;
    }

    private void moveToHead(Node<K, V> n) {
        if (n == head) return;
        unlink(n);
        linkAtHead(n);
    }

    private void linkAtHead(Node<K, V> n) {
        n.prev = null;
        n.next = head;
        if (head != null) head.prev = n;
        head = n;
        if (tail == null) tail = n;
    }

    private void unlink(Node<K, V> n) {
        if (n.prev != null) n.prev.next = n.next;
        else head = n.next;
        if (n.next != null) n.next.prev = n.prev;
        else tail = n.prev;
        n.prev = null;
        n.next = null;
    }
}
