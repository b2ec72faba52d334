package com.warden.core.audit;

import com.warden.core.model.Action;
import com.warden.core.model.Decision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded in-memory record of recent decisions, queryable by result and by
 * policy. Once {@code maxEntries} is reached the oldest entry is evicted for
 * each new one. Safe for concurrent writers; each append is atomic.
 */
public class AuditTrail {

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final int maxEntries;
    private final Deque<AuditEntry> entries = new ArrayDeque<>();

    public AuditTrail() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public AuditTrail(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public void record(Decision decision, Action action) {
        append(AuditEntry.of(decision, action));
    }

    public synchronized void append(AuditEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }

    /** Snapshot of all retained entries, oldest first. */
    public synchronized List<AuditEntry> getAll() {
        return new ArrayList<>(entries);
    }

    public List<AuditEntry> getDenied() {
        return filter(AuditEntry::denied);
    }

    public List<AuditEntry> getByPolicy(String policyId) {
        return filter(e -> policyId.equals(e.policyId()));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxEntries() {
        return maxEntries;
    }

    private synchronized List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        List<AuditEntry> matches = new ArrayList<>();
        for (AuditEntry entry : entries) {
            if (predicate.test(entry)) {
                matches.add(entry);
            }
        }
        return matches;
    }
}
