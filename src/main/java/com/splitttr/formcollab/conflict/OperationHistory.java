package com.splitttr.formcollab.conflict;

import com.splitttr.formcollab.message.FieldOperation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Recently accepted operations of one form, in acceptance order. Bounded by
 * entry count and by age; entries are never modified once appended.
 * Not thread-safe: owned by a single room.
 */
public class OperationHistory {

    public record Entry(long sequence, Instant acceptedAt, FieldOperation operation) {}

    private final Deque<Entry> entries = new ArrayDeque<>();
    private final int maxEntries;
    private final Duration maxAge;
    private long lastSequence;

    public OperationHistory(int maxEntries, Duration maxAge) {
        this(maxEntries, maxAge, 0);
    }

    /**
     * @param startSequence sequence of the last operation already reflected in the
     *                      stored document; the first appended entry gets {@code startSequence + 1}
     */
    public OperationHistory(int maxEntries, Duration maxAge, long startSequence) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.maxAge = maxAge;
        this.lastSequence = startSequence;
    }

    public Entry append(FieldOperation operation, Instant acceptedAt) {
        var entry = new Entry(++lastSequence, acceptedAt, operation);
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
        pruneExpired(acceptedAt);
        return entry;
    }

    /**
     * Drops entries accepted more than {@code maxAge} before {@code now}.
     *
     * @return number of entries removed
     */
    public int pruneExpired(Instant now) {
        Instant cutoff = now.minus(maxAge);
        int removed = 0;
        while (!entries.isEmpty() && entries.peekFirst().acceptedAt().isBefore(cutoff)) {
            entries.removeFirst();
            removed++;
        }
        return removed;
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<FieldOperation> operations() {
        return entries.stream().map(Entry::operation).toList();
    }

    public long lastSequence() {
        return lastSequence;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
