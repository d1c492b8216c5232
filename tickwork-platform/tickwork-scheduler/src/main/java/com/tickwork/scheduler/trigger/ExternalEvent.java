package com.tickwork.scheduler.trigger;

import java.time.Instant;

/**
 * One event read from an external feed.
 *
 * @param eventId Id unique within the feed, used for the occurrence key
 * @param eventType Type matched against the job's pattern
 * @param occurredAt When the source observed the event
 * @param payloadJson Event payload handed to the handler, may be null
 */
public record ExternalEvent(String eventId, String eventType, Instant occurredAt, String payloadJson) {

    public ExternalEvent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event id cannot be null or blank");
        }
    }
}
