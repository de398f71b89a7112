package org.carball.querylens.analyzer;

import org.carball.querylens.model.query.QueryOccurrence;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class SequenceTrackerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldPreserveArrivalOrder() {
        // Given
        SequenceTracker tracker = new SequenceTracker(Duration.ofMinutes(60), 100);

        // When
        tracker.recordOccurrence("a", T0);
        tracker.recordOccurrence("b", T0.plusSeconds(1));
        tracker.recordOccurrence("a", T0.plusSeconds(2));

        // Then
        assertThat(tracker.snapshot()).extracting(QueryOccurrence::fingerprint).containsExactly("a", "b", "a");
    }

    @Test
    void shouldPruneEntriesOutsideWindow() {
        // Given
        SequenceTracker tracker = new SequenceTracker(Duration.ofMinutes(60), 100);
        tracker.recordOccurrence("old", T0);
        tracker.recordOccurrence("recent", T0.plus(Duration.ofMinutes(30)));

        // When
        tracker.recordOccurrence("now", T0.plus(Duration.ofMinutes(61)));

        // Then
        assertThat(tracker.snapshot()).extracting(QueryOccurrence::fingerprint).containsExactly("recent", "now");
        assertThat(tracker.droppedCount()).isZero();
    }

    @Test
    void shouldDropOldestAboveCapacity() {
        // Given
        SequenceTracker tracker = new SequenceTracker(Duration.ofMinutes(60), 3);

        // When
        for (int i = 0; i < 5; i++) {
            tracker.recordOccurrence("fp" + i, T0.plusSeconds(i));
        }

        // Then
        assertThat(tracker.size()).isEqualTo(3);
        assertThat(tracker.droppedCount()).isEqualTo(2);
        assertThat(tracker.snapshot()).extracting(QueryOccurrence::fingerprint).containsExactly("fp2", "fp3", "fp4");
    }

    @Test
    void shouldClearEverything() {
        // Given
        SequenceTracker tracker = new SequenceTracker(Duration.ofMinutes(60), 1);
        tracker.recordOccurrence("a", T0);
        tracker.recordOccurrence("b", T0);

        // When
        tracker.clear();

        // Then
        assertThat(tracker.size()).isZero();
        assertThat(tracker.droppedCount()).isZero();
    }

    @Test
    void shouldPruneAgainstCurrentTimeWithoutNewOccurrences() {
        // Given
        SequenceTracker tracker = new SequenceTracker(Duration.ofMinutes(60), 100);
        tracker.recordOccurrence("a", T0);
        tracker.recordOccurrence("b", T0.plus(Duration.ofMinutes(20)));

        // When
        int removed = tracker.prune(T0.plus(Duration.ofMinutes(70)));

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(tracker.snapshot()).extracting(QueryOccurrence::fingerprint).containsExactly("b");
        assertThat(tracker.droppedCount()).isZero();
    }
}
