package com.tickwork.scheduler.run;

import java.util.UUID;

/**
 * Thrown instead of starting an attempt when the occurrence has already used
 * all of its attempts.
 */
public class AttemptsExhaustedException extends RuntimeException {

    private final UUID jobId;
    private final String occurrenceKey;
    private final int attempts;

    public AttemptsExhaustedException(UUID jobId, String occurrenceKey, int attempts) {
        super("Occurrence " + occurrenceKey + " of job " + jobId + " already used " + attempts + " attempt(s)");
        this.jobId = jobId;
        this.occurrenceKey = occurrenceKey;
        this.attempts = attempts;
    }

    public UUID getJobId() { return jobId; }
    public String getOccurrenceKey() { return occurrenceKey; }
    public int getAttempts() { return attempts; }
}
