package com.tickwork.core.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Trigger Event - one occurrence of a job's trigger condition.
 *
 * Rows form the claim table: the unique constraint on (job_id, occurrence_key)
 * is the only cross-replica synchronization the scheduler relies on. A row is
 * either inserted already claimed (schedule and feed occurrences) or recorded
 * unclaimed and claimed later by a conditional update (pushed events, manual
 * runs). Only the claim columns change after insert.
 */
@Entity
@Table(name = "custom_job_trigger_event",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_custom_job_trigger_event_occurrence", columnNames = {"job_id", "occurrence_key"})
    },
    indexes = {
        @Index(name = "idx_trigger_event_unclaimed", columnList = "claimed, detected_at"),
        @Index(name = "idx_trigger_event_claimed_at", columnList = "claimed_at")
    })
public class TriggerEvent {

    /** Width of the occurrence_key column. */
    public static final int MAX_OCCURRENCE_KEY_LENGTH = 255;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "occurrence_key", nullable = false, updatable = false, length = MAX_OCCURRENCE_KEY_LENGTH)
    private String occurrenceKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 32)
    private TriggerSource source;

    @Column(name = "scheduled_for", updatable = false)
    private Instant scheduledFor;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(name = "payload_json", updatable = false, columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "claimed", nullable = false)
    private boolean claimed;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claimed_by", length = 128)
    private String claimedBy;

    public enum TriggerSource {
        SCHEDULE, // Cron fire time
        EVENT,    // External event, polled or pushed
        MANUAL    // Operator-requested run
    }

    protected TriggerEvent() {}

    /**
     * Creates an event row that is claimed at insert time.
     */
    public static TriggerEvent claimed(UUID jobId, String occurrenceKey, TriggerSource source,
                                       Instant scheduledFor, Instant detectedAt, String payloadJson,
                                       String claimedBy) {
        TriggerEvent event = create(jobId, occurrenceKey, source, scheduledFor, detectedAt, payloadJson);
        if (claimedBy == null || claimedBy.isBlank()) {
            throw new IllegalArgumentException("Claimant cannot be null or blank");
        }
        event.claimed = true;
        event.claimedAt = detectedAt;
        event.claimedBy = claimedBy;
        return event;
    }

    /**
     * Creates an event row waiting to be claimed.
     */
    public static TriggerEvent unclaimed(UUID jobId, String occurrenceKey, TriggerSource source,
                                         Instant detectedAt, String payloadJson) {
        return create(jobId, occurrenceKey, source, null, detectedAt, payloadJson);
    }

    private static TriggerEvent create(UUID jobId, String occurrenceKey, TriggerSource source,
                                       Instant scheduledFor, Instant detectedAt, String payloadJson) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }
        if (occurrenceKey == null || occurrenceKey.isBlank()) {
            throw new IllegalArgumentException("Occurrence key cannot be null or blank");
        }
        if (occurrenceKey.length() > MAX_OCCURRENCE_KEY_LENGTH) {
            throw new IllegalArgumentException("Occurrence key longer than " + MAX_OCCURRENCE_KEY_LENGTH + " characters");
        }
        if (source == null) {
            throw new IllegalArgumentException("Trigger source cannot be null");
        }
        if (detectedAt == null) {
            throw new IllegalArgumentException("Detection time cannot be null");
        }
        TriggerEvent event = new TriggerEvent();
        event.id = UUID.randomUUID();
        event.jobId = jobId;
        event.occurrenceKey = occurrenceKey;
        event.source = source;
        event.scheduledFor = scheduledFor;
        event.detectedAt = detectedAt;
        event.payloadJson = payloadJson;
        event.claimed = false;
        return event;
    }

    /**
     * Claims a recorded event. The persistent claim is a conditional update;
     * this mirrors it on the loaded instance.
     */
    public void markClaimed(String claimedBy, Instant claimedAt) {
        if (claimed) {
            throw new IllegalStateException("Trigger event " + occurrenceKey + " is already claimed");
        }
        this.claimed = true;
        this.claimedBy = claimedBy;
        this.claimedAt = claimedAt;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getJobId() { return jobId; }
    public String getOccurrenceKey() { return occurrenceKey; }
    public TriggerSource getSource() { return source; }
    public Instant getScheduledFor() { return scheduledFor; }
    public Instant getDetectedAt() { return detectedAt; }
    public String getPayloadJson() { return payloadJson; }
    public boolean isClaimed() { return claimed; }
    public Instant getClaimedAt() { return claimedAt; }
    public String getClaimedBy() { return claimedBy; }
}
