package com.tickwork.scheduler.registry;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.CustomJob.TriggerType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Definitional metadata for custom jobs.
 *
 * Reads are not snapshot-isolated: every call sees the current state of the
 * store. Implementations throw
 * {@link com.tickwork.core.repository.StorageUnavailableException} when the
 * store cannot be reached.
 */
public interface JobRegistry {

    List<CustomJob> listEnabledJobs();

    List<CustomJob> listEnabledJobs(TriggerType triggerType);

    /**
     * @throws JobNotFoundException if no job has this id
     */
    CustomJob getJob(UUID jobId);

    /**
     * Creates a job. It is enabled only if the definition asks for it, in which
     * case the trigger must parse.
     *
     * @throws com.tickwork.scheduler.trigger.InvalidTriggerSpecException if an enabled definition does not parse
     */
    CustomJob register(JobDefinition definition);

    /**
     * @throws com.tickwork.scheduler.trigger.InvalidTriggerSpecException if the trigger does not parse
     */
    CustomJob enable(UUID jobId);

    CustomJob disable(UUID jobId);

    /**
     * Replaces the trigger. Enabled jobs are re-validated before the change is stored.
     */
    CustomJob updateTrigger(UUID jobId, TriggerDefinition trigger);

    /**
     * Moves the schedule cursor forward. A cursor already past
     * {@code evaluatedThrough} is left alone.
     */
    void advanceScheduleCursor(UUID jobId, Instant evaluatedThrough);

    void advanceEventCursor(UUID jobId, String cursor, Instant evaluatedAt);

    void markTriggered(UUID jobId, Instant triggeredAt);
}
