package com.tickwork.scheduler.poll;

import java.util.UUID;

/**
 * Thrown when an occurrence, or an attempt of it, is already taken. Expected
 * under concurrency: another scheduler instance won the race.
 */
public class ClaimConflictException extends RuntimeException {

    private final UUID jobId;
    private final String occurrenceKey;

    public ClaimConflictException(UUID jobId, String occurrenceKey, String message) {
        super(message);
        this.jobId = jobId;
        this.occurrenceKey = occurrenceKey;
    }

    public ClaimConflictException(UUID jobId, String occurrenceKey, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.occurrenceKey = occurrenceKey;
    }

    public UUID getJobId() { return jobId; }
    public String getOccurrenceKey() { return occurrenceKey; }
}
