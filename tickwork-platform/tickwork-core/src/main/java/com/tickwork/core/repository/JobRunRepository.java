package com.tickwork.core.repository;

import com.tickwork.core.domain.JobRun;
import com.tickwork.core.domain.JobRun.RunStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for job run history.
 */
@Repository
public interface JobRunRepository extends JpaRepository<JobRun, UUID> {

    long countByJobIdAndOccurrenceKey(UUID jobId, String occurrenceKey);

    Optional<JobRun> findTopByJobIdAndOccurrenceKeyOrderByAttemptNumberDesc(UUID jobId, String occurrenceKey);

    List<JobRun> findByJobIdAndOccurrenceKeyOrderByAttemptNumberAsc(UUID jobId, String occurrenceKey);

    List<JobRun> findByJobIdOrderByStartedAtDesc(UUID jobId, Pageable pageable);

    long countByJobIdAndStatus(UUID jobId, RunStatus status);

    List<JobRun> findByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);

    long countByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);

    /**
     * Failed attempts whose retry is due and has not been taken yet.
     */
    @Query("SELECT r FROM JobRun r WHERE r.status = com.tickwork.core.domain.JobRun.RunStatus.FAILURE " +
           "AND r.retryAt IS NOT NULL AND r.retryAt <= :now " +
           "AND NOT EXISTS (SELECT n.id FROM JobRun n WHERE n.jobId = r.jobId " +
           "AND n.occurrenceKey = r.occurrenceKey AND n.attemptNumber > r.attemptNumber) " +
           "ORDER BY r.retryAt ASC")
    List<JobRun> findRetriesDue(@Param("now") Instant now, Pageable pageable);

    /**
     * Close a running attempt. Returns 0 when the attempt was already closed,
     * for example by stale-run reconciliation.
     */
    @Modifying
    @Query("UPDATE JobRun r SET r.status = :status, r.finishedAt = :finishedAt, r.errorSummary = :errorSummary, " +
           "r.retryAt = :retryAt, r.attemptsExhausted = :attemptsExhausted " +
           "WHERE r.id = :id AND r.status = com.tickwork.core.domain.JobRun.RunStatus.RUNNING")
    int finishRunning(@Param("id") UUID id,
                      @Param("status") RunStatus status,
                      @Param("finishedAt") Instant finishedAt,
                      @Param("errorSummary") String errorSummary,
                      @Param("retryAt") Instant retryAt,
                      @Param("attemptsExhausted") boolean attemptsExhausted);

    /**
     * Finished runs older than the cutoff. Running rows are never selected.
     */
    @Query("SELECT r.id FROM JobRun r WHERE r.finishedAt IS NOT NULL AND r.finishedAt < :cutoff " +
           "ORDER BY r.finishedAt ASC")
    List<UUID> findPurgeableIds(@Param("cutoff") Instant cutoff, Pageable pageable);
}
