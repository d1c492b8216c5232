package com.tickwork.core.repository;

import com.tickwork.core.domain.TriggerEvent;
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
 * Repository for the trigger claim table.
 */
@Repository
public interface TriggerEventRepository extends JpaRepository<TriggerEvent, UUID> {

    Optional<TriggerEvent> findByJobIdAndOccurrenceKey(UUID jobId, String occurrenceKey);

    boolean existsByJobIdAndOccurrenceKey(UUID jobId, String occurrenceKey);

    /**
     * Most recent occurrence of a job, any source.
     */
    Optional<TriggerEvent> findTopByJobIdOrderByDetectedAtDesc(UUID jobId);

    /**
     * Recorded events of enabled jobs waiting for a claim, oldest first.
     */
    @Query("SELECT e FROM TriggerEvent e WHERE e.claimed = false " +
           "AND EXISTS (SELECT j.id FROM CustomJob j WHERE j.id = e.jobId AND j.enabled = true) " +
           "ORDER BY e.detectedAt ASC")
    List<TriggerEvent> findUnclaimed(Pageable pageable);

    /**
     * Claim a recorded event. Returns 1 for the caller that won the claim and 0
     * for everyone else.
     */
    @Modifying
    @Query("UPDATE TriggerEvent e SET e.claimed = true, e.claimedAt = :claimedAt, e.claimedBy = :claimedBy " +
           "WHERE e.id = :id AND e.claimed = false")
    int claimRecorded(@Param("id") UUID id, @Param("claimedBy") String claimedBy,
                      @Param("claimedAt") Instant claimedAt);

    /**
     * Claimed events with no run at all, claimed before the cutoff. Left behind
     * when a worker rejected or lost the hand-off.
     */
    @Query("SELECT e FROM TriggerEvent e WHERE e.claimed = true AND e.claimedAt < :cutoff " +
           "AND NOT EXISTS (SELECT r.id FROM JobRun r WHERE r.jobId = e.jobId AND r.occurrenceKey = e.occurrenceKey) " +
           "ORDER BY e.claimedAt ASC")
    List<TriggerEvent> findClaimedWithoutRun(@Param("cutoff") Instant cutoff, Pageable pageable);

    /**
     * Claimed events older than the cutoff whose work is settled: at least one
     * run, none still running, and no retry planned on the latest attempt.
     */
    @Query("SELECT e.id FROM TriggerEvent e WHERE e.claimed = true AND e.claimedAt < :cutoff " +
           "AND EXISTS (SELECT r.id FROM JobRun r WHERE r.jobId = e.jobId " +
           "AND r.occurrenceKey = e.occurrenceKey) " +
           "AND NOT EXISTS (SELECT r.id FROM JobRun r WHERE r.jobId = e.jobId " +
           "AND r.occurrenceKey = e.occurrenceKey AND r.finishedAt IS NULL) " +
           "AND NOT EXISTS (SELECT r.id FROM JobRun r WHERE r.jobId = e.jobId " +
           "AND r.occurrenceKey = e.occurrenceKey " +
           "AND r.status = com.tickwork.core.domain.JobRun.RunStatus.FAILURE " +
           "AND r.retryAt IS NOT NULL AND r.attemptsExhausted = false " +
           "AND NOT EXISTS (SELECT n.id FROM JobRun n WHERE n.jobId = r.jobId " +
           "AND n.occurrenceKey = r.occurrenceKey AND n.attemptNumber > r.attemptNumber)) " +
           "ORDER BY e.claimedAt ASC")
    List<UUID> findPurgeableIds(@Param("cutoff") Instant cutoff, Pageable pageable);
}
