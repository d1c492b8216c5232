package com.tickwork.core.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Job Run - execution history for one attempt at one trigger occurrence.
 *
 * (job_id, occurrence_key, attempt_number) is unique. Attempt n + 1 is only
 * inserted after attempt n has finished, so at most one attempt per occurrence
 * is RUNNING at any time.
 */
@Entity
@Table(name = "custom_job_run",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_custom_job_run_attempt",
            columnNames = {"job_id", "occurrence_key", "attempt_number"})
    },
    indexes = {
        @Index(name = "idx_custom_job_run_finished_at", columnList = "finished_at"),
        @Index(name = "idx_custom_job_run_status_started", columnList = "status, started_at"),
        @Index(name = "idx_custom_job_run_retry_at", columnList = "retry_at")
    })
public class JobRun {

    public static final int MAX_ERROR_SUMMARY_LENGTH = 2000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "occurrence_key", nullable = false, updatable = false)
    private String occurrenceKey;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private RunStatus status;

    @Column(name = "error_summary", columnDefinition = "TEXT")
    private String errorSummary;

    /**
     * Earliest time the next attempt may start. Null when no retry is planned.
     */
    @Column(name = "retry_at")
    private Instant retryAt;

    @Column(name = "attempts_exhausted", nullable = false)
    private boolean attemptsExhausted;

    @Column(name = "worker_id", length = 128)
    private String workerId;

    public enum RunStatus {
        RUNNING,
        SUCCESS,
        FAILURE,
        SKIPPED
    }

    protected JobRun() {}

    /**
     * Creates a RUNNING attempt.
     *
     * @param jobId Job being run
     * @param occurrenceKey Trigger occurrence this attempt serves
     * @param attemptNumber 1-based attempt number
     * @param startedAt Start time
     * @param workerId Scheduler instance executing the attempt
     */
    public static JobRun start(UUID jobId, String occurrenceKey, int attemptNumber,
                               Instant startedAt, String workerId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }
        if (occurrenceKey == null || occurrenceKey.isBlank()) {
            throw new IllegalArgumentException("Occurrence key cannot be null or blank");
        }
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be at least 1");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Start time cannot be null");
        }
        JobRun run = new JobRun();
        run.id = UUID.randomUUID();
        run.jobId = jobId;
        run.occurrenceKey = occurrenceKey;
        run.attemptNumber = attemptNumber;
        run.startedAt = startedAt;
        run.status = RunStatus.RUNNING;
        run.workerId = workerId;
        return run;
    }

    public void succeed(Instant now) {
        finish(RunStatus.SUCCESS, now, null);
    }

    public void skip(Instant now, String reason) {
        finish(RunStatus.SKIPPED, now, reason);
    }

    /**
     * Marks the attempt failed.
     *
     * @param retryAt When the next attempt may start, or null for no retry
     */
    public void fail(Instant now, String errorSummary, Instant retryAt) {
        finish(RunStatus.FAILURE, now, errorSummary);
        this.retryAt = retryAt;
    }

    /**
     * Marks the attempt failed with no further attempts for this occurrence.
     */
    public void exhaust(Instant now, String errorSummary) {
        finish(RunStatus.FAILURE, now, errorSummary);
        this.retryAt = null;
        this.attemptsExhausted = true;
    }

    private void finish(RunStatus outcome, Instant now, String error) {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + id + " already finished with " + status);
        }
        if (now == null) {
            throw new IllegalArgumentException("Finish time cannot be null");
        }
        this.status = outcome;
        this.finishedAt = now;
        this.errorSummary = truncate(error);
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    public boolean isRetryPlanned() {
        return status == RunStatus.FAILURE && retryAt != null;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_SUMMARY_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_SUMMARY_LENGTH);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getJobId() { return jobId; }
    public String getOccurrenceKey() { return occurrenceKey; }
    public int getAttemptNumber() { return attemptNumber; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public RunStatus getStatus() { return status; }
    public String getErrorSummary() { return errorSummary; }
    public Instant getRetryAt() { return retryAt; }
    public boolean isAttemptsExhausted() { return attemptsExhausted; }
    public String getWorkerId() { return workerId; }
}
