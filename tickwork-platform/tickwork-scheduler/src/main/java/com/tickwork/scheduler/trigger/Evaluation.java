package com.tickwork.scheduler.trigger;

import java.time.Instant;
import java.util.List;

/**
 * Result of one trigger evaluation.
 *
 * @param occurrences Due occurrences in claim order
 * @param evaluatedThrough Schedule cursor to persist once every occurrence is handed off
 * @param eventCursor Feed cursor to persist, null for schedule jobs
 * @param truncated Whether the catch-up limit cut the evaluation short
 */
public record Evaluation(List<TriggerOccurrence> occurrences, Instant evaluatedThrough,
                         String eventCursor, boolean truncated) {

    public Evaluation {
        occurrences = List.copyOf(occurrences);
    }

    public boolean isEmpty() {
        return occurrences.isEmpty();
    }
}
