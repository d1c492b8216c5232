package com.tickwork.scheduler.poll;

import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.scheduler.trigger.TriggerOccurrence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The claim table. A claim is a conditional insert or a conditional update;
 * whichever caller's write lands first owns the occurrence.
 */
public interface TriggerClaimStore {

    /**
     * Inserts the occurrence already claimed by {@code claimedBy}.
     *
     * @throws ClaimConflictException if the occurrence key is already taken
     */
    TriggerEvent claim(TriggerOccurrence occurrence, String claimedBy);

    /**
     * Inserts the occurrence unclaimed.
     *
     * @return false if an occurrence with the same key already exists
     */
    boolean record(TriggerOccurrence occurrence);

    /**
     * Claims a recorded occurrence.
     *
     * @return true for the caller that won the claim
     */
    boolean claimRecorded(TriggerEvent event, String claimedBy, Instant claimedAt);

    List<TriggerEvent> findUnclaimed(int limit);

    Optional<TriggerEvent> find(UUID jobId, String occurrenceKey);

    Optional<TriggerEvent> findLatest(UUID jobId);

    /**
     * Claimed occurrences that never got a run, claimed before the cutoff.
     */
    List<TriggerEvent> findClaimedWithoutRun(Instant claimedBefore, int limit);

    /**
     * Deletes occurrences claimed before the cutoff whose work is settled:
     * they have runs, none unfinished, and the latest attempt plans no retry.
     * Unclaimed occurrences and claims still waiting for a run are kept.
     */
    int purgeClaimedBefore(Instant cutoff, int batchSize);
}
