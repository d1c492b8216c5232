package com.tickwork.scheduler.history;

import com.tickwork.core.domain.JobRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of {@link JobRun} history.
 */
public interface JobHistoryStore {

    /**
     * Inserts a new attempt.
     *
     * @throws com.tickwork.scheduler.poll.ClaimConflictException if the attempt number is already taken
     */
    JobRun record(JobRun run);

    /**
     * Stores the outcome of a finished attempt, provided the stored row is
     * still RUNNING.
     *
     * @return false if the row had already been closed
     */
    boolean update(JobRun run);

    int countAttempts(UUID jobId, String occurrenceKey);

    Optional<JobRun> findLatestAttempt(UUID jobId, String occurrenceKey);

    List<JobRun> listAttempts(UUID jobId, String occurrenceKey);

    /**
     * Most recent runs of a job, newest first.
     */
    List<JobRun> listRuns(UUID jobId, int limit);

    long countRunning(UUID jobId);

    List<JobRun> findRunningStartedBefore(Instant cutoff);

    long countRunningStartedBefore(Instant cutoff);

    /**
     * Failed attempts with a retry due at {@code now} and no later attempt yet.
     */
    List<JobRun> findRetriesDue(Instant now, int limit);

    /**
     * Deletes finished runs with {@code finishedAt < cutoff}, one transaction
     * per batch. Running rows are never deleted.
     *
     * @return number of rows deleted
     */
    int purgeOlderThan(Instant cutoff, int batchSize);
}
