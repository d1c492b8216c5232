package com.tickwork.scheduler.trigger;

import java.util.List;

/**
 * Page of events plus the cursor to resume from.
 */
public record EventBatch(List<ExternalEvent> events, String nextCursor) {

    public EventBatch {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static EventBatch empty(String cursor) {
        return new EventBatch(List.of(), cursor);
    }
}
