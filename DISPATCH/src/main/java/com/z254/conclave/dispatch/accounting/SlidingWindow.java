package com.z254.conclave.dispatch.accounting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Append-only buffer that keeps the most recent {@code capacity} entries in arrival order.
 */
public class SlidingWindow<T> {

    private final int capacity;
    private final Deque<T> entries;

    public SlidingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 256));
    }

    public synchronized void add(T entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * All entries, oldest first.
     */
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * The newest {@code limit} entries, oldest first.
     */
    public synchronized List<T> latest(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<T> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized T newest() {
        return entries.peekLast();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
