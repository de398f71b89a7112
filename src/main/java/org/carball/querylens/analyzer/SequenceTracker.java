package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.query.QueryOccurrence;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Arrival-ordered log of query occurrences, bounded both by age and by entry count.
 */
@Slf4j
public class SequenceTracker {

    private final Deque<QueryOccurrence> occurrences = new ArrayDeque<>();
    private final Duration retention;
    private final int capacity;
    private long droppedCount;

    public SequenceTracker(Duration retention, int capacity) {
        this.retention = retention;
        this.capacity = capacity;
    }

    /**
     * Appends an occurrence, then drops entries older than the retention window measured from
     * its timestamp and finally the oldest entries above capacity.
     */
    public synchronized void recordOccurrence(String fingerprint, Instant timestamp) {
        occurrences.addLast(new QueryOccurrence(fingerprint, timestamp));

        Instant cutoff = timestamp.minus(retention);
        while (!occurrences.isEmpty() && occurrences.peekFirst().timestamp().isBefore(cutoff)) {
            occurrences.removeFirst();
        }

        int overflow = occurrences.size() - capacity;
        if (overflow > 0) {
            for (int i = 0; i < overflow; i++) {
                occurrences.removeFirst();
            }
            droppedCount += overflow;
            if (droppedCount % capacity == overflow) {
                log.debug("Sequence log at capacity {}, dropping oldest occurrences", capacity);
            }
        }
    }

    /**
     * Drops every entry older than the retention window measured from {@code now}.
     *
     * @return the number of entries removed
     */
    public synchronized int prune(Instant now) {
        Instant cutoff = now.minus(retention);
        int before = occurrences.size();
        occurrences.removeIf(occurrence -> occurrence.timestamp().isBefore(cutoff));
        int removed = before - occurrences.size();
        if (removed > 0) {
            log.debug("Pruned {} occurrences older than {}", removed, cutoff);
        }
        return removed;
    }

    public synchronized List<QueryOccurrence> snapshot() {
        return new ArrayList<>(occurrences);
    }

    public synchronized int size() {
        return occurrences.size();
    }

    /**
     * Occurrences discarded because the log was full, not counting age-based pruning.
     */
    public synchronized long droppedCount() {
        return droppedCount;
    }

    public synchronized void clear() {
        occurrences.clear();
        droppedCount = 0;
    }
}
