package com.tickwork.scheduler.trigger;

/**
 * Source of external events for event-triggered jobs. Implemented by
 * connectors and registered as Spring beans.
 */
public interface EventFeed {

    /**
     * Source type that jobs reference in their event source column.
     */
    String sourceType();

    /**
     * Reads events strictly after the cursor.
     *
     * @param cursor Opaque cursor from a previous batch, or null to start from the beginning
     * @param limit Maximum number of events to return
     * @return Events in feed order and the cursor that follows them
     */
    EventBatch fetch(String cursor, int limit);
}
