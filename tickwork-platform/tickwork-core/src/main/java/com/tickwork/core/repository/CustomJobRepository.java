package com.tickwork.core.repository;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.CustomJob.TriggerType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for custom job definitions and their poller-owned cursors.
 */
@Repository
public interface CustomJobRepository extends JpaRepository<CustomJob, UUID> {

    /**
     * Find all enabled jobs, oldest first.
     */
    List<CustomJob> findByEnabledTrueOrderByCreatedAtAsc();

    /**
     * Find enabled jobs of one trigger type, oldest first.
     */
    List<CustomJob> findByEnabledTrueAndTriggerTypeOrderByCreatedAtAsc(TriggerType triggerType);

    List<CustomJob> findByNameOrderByCreatedAtAsc(String name);

    /**
     * Advance the schedule cursor. The guard keeps the cursor monotonic when
     * replicas race with different reference times.
     */
    @Modifying
    @Query("UPDATE CustomJob j SET j.lastEvaluatedAt = :evaluatedThrough " +
           "WHERE j.id = :id AND (j.lastEvaluatedAt IS NULL OR j.lastEvaluatedAt < :evaluatedThrough)")
    int advanceScheduleCursor(@Param("id") UUID id, @Param("evaluatedThrough") Instant evaluatedThrough);

    /**
     * Store the feed cursor of an event-triggered job.
     */
    @Modifying
    @Query("UPDATE CustomJob j SET j.eventCursor = :cursor, j.lastEvaluatedAt = :evaluatedAt WHERE j.id = :id")
    int advanceEventCursor(@Param("id") UUID id, @Param("cursor") String cursor,
                           @Param("evaluatedAt") Instant evaluatedAt);

    @Modifying
    @Query("UPDATE CustomJob j SET j.lastTriggeredAt = :triggeredAt " +
           "WHERE j.id = :id AND (j.lastTriggeredAt IS NULL OR j.lastTriggeredAt < :triggeredAt)")
    int markTriggered(@Param("id") UUID id, @Param("triggeredAt") Instant triggeredAt);
}
