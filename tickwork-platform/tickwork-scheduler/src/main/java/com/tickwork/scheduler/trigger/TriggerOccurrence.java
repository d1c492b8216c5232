package com.tickwork.scheduler.trigger;

import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.core.domain.TriggerEvent.TriggerSource;

import java.time.Instant;
import java.util.UUID;

/**
 * A due occurrence of a job's trigger, not yet claimed.
 *
 * @param jobId Job the occurrence belongs to
 * @param occurrenceKey Deduplication key, unique per job, at most 255 characters
 * @param source What produced the occurrence
 * @param scheduledFor Fire time for schedule occurrences, null otherwise
 * @param detectedAt Reference time of the evaluation that found it
 * @param payloadJson Event or manual payload, null for schedule occurrences
 */
public record TriggerOccurrence(UUID jobId, String occurrenceKey, TriggerSource source,
                                Instant scheduledFor, Instant detectedAt, String payloadJson) {

    public static final String EVENT_KEY_PREFIX = "event:";
    public static final String MANUAL_KEY_PREFIX = "manual:";

    public TriggerOccurrence {
        if (occurrenceKey == null || occurrenceKey.isBlank()) {
            throw new IllegalArgumentException("Occurrence key cannot be null or blank");
        }
        if (occurrenceKey.length() > TriggerEvent.MAX_OCCURRENCE_KEY_LENGTH) {
            throw new IllegalArgumentException("Occurrence key longer than "
                    + TriggerEvent.MAX_OCCURRENCE_KEY_LENGTH + " characters: "
                    + occurrenceKey.substring(0, 32) + "...");
        }
    }

    public static TriggerOccurrence scheduled(UUID jobId, Instant fireTime, Instant detectedAt) {
        return new TriggerOccurrence(jobId, fireTime.toString(), TriggerSource.SCHEDULE,
                fireTime, detectedAt, null);
    }

    public static TriggerOccurrence event(UUID jobId, ExternalEvent event, Instant detectedAt) {
        return new TriggerOccurrence(jobId, EVENT_KEY_PREFIX + event.eventId(), TriggerSource.EVENT,
                null, detectedAt, event.payloadJson());
    }

    public static TriggerOccurrence pushedEvent(UUID jobId, String eventId, String payloadJson, Instant detectedAt) {
        return new TriggerOccurrence(jobId, EVENT_KEY_PREFIX + eventId, TriggerSource.EVENT,
                null, detectedAt, payloadJson);
    }

    public static TriggerOccurrence manual(UUID jobId, String idempotencyKey, String payloadJson, Instant detectedAt) {
        return new TriggerOccurrence(jobId, MANUAL_KEY_PREFIX + idempotencyKey, TriggerSource.MANUAL,
                null, detectedAt, payloadJson);
    }
}
