package com.tickwork.scheduler.dispatch;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.JobRun;
import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.core.repository.StorageUnavailableException;
import com.tickwork.scheduler.config.CustomJobConfiguration;
import com.tickwork.scheduler.config.CustomJobProperties;
import com.tickwork.scheduler.history.JobHistoryStore;
import com.tickwork.scheduler.history.RetentionResult;
import com.tickwork.scheduler.history.RetentionSweeper;
import com.tickwork.scheduler.history.StaleRunReconciler;
import com.tickwork.scheduler.poll.ClaimConflictException;
import com.tickwork.scheduler.poll.ClaimedTrigger;
import com.tickwork.scheduler.poll.TriggerClaimStore;
import com.tickwork.scheduler.poll.TriggerPoller;
import com.tickwork.scheduler.registry.JobNotFoundException;
import com.tickwork.scheduler.registry.JobRegistry;
import com.tickwork.scheduler.run.AttemptsExhaustedException;
import com.tickwork.scheduler.run.JobRunner;
import com.tickwork.scheduler.trigger.TriggerOccurrence;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Entry points invoked by the scheduling runtime.
 *
 * Tick methods return the number of items handled and never throw: a storage
 * failure aborts the tick with a warning and the next tick tries again.
 * Handlers run on the worker pool, never on the calling thread.
 */
@Service
public class CustomJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CustomJobDispatcher.class);

    private final JobRegistry registry;
    private final TriggerPoller poller;
    private final TriggerClaimStore claimStore;
    private final JobHistoryStore historyStore;
    private final JobRunner runner;
    private final RetentionSweeper retentionSweeper;
    private final StaleRunReconciler reconciler;
    private final TaskExecutor executor;
    private final Clock clock;
    private final boolean enabled;
    private final int claimLimit;
    private final Duration manualTriggerCooldown;
    private final Duration orphanClaimGrace;

    // occurrences queued or running in this process; avoids queueing the same work twice
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public CustomJobDispatcher(JobRegistry registry,
                               TriggerPoller poller,
                               TriggerClaimStore claimStore,
                               JobHistoryStore historyStore,
                               JobRunner runner,
                               RetentionSweeper retentionSweeper,
                               StaleRunReconciler reconciler,
                               @Qualifier(CustomJobConfiguration.EXECUTOR_BEAN) TaskExecutor executor,
                               Clock clock,
                               CustomJobProperties properties) {
        this.registry = registry;
        this.poller = poller;
        this.claimStore = claimStore;
        this.historyStore = historyStore;
        this.runner = runner;
        this.retentionSweeper = retentionSweeper;
        this.reconciler = reconciler;
        this.executor = executor;
        this.clock = clock;
        this.enabled = properties.isEnabled();
        this.claimLimit = properties.getClaimLimit();
        this.manualTriggerCooldown = properties.getManualTriggerCooldown();
        this.orphanClaimGrace = properties.getOrphanClaimGrace();
    }

    /**
     * Reconciles stale runs, then claims and dispatches due schedule occurrences.
     *
     * @return occurrences dispatched
     */
    public int checkForCustomJobs() {
        return tick("check_for_custom_jobs", () -> {
            Instant now = clock.instant();
            reconciler.reconcile(now);
            return dispatch(poller.pollScheduledJobs(now));
        });
    }

    /**
     * Claims recorded events and manual runs, then dispatches due retries and
     * claimed occurrences that never got a run.
     *
     * @return occurrences dispatched
     */
    public int checkForCustomJobTriggerEvents() {
        return tick("check_for_custom_job_trigger_events", () -> {
            Instant now = clock.instant();
            int dispatched = dispatch(poller.claimRecordedEvents(now));
            for (JobRun retry : historyStore.findRetriesDue(now, claimLimit)) {
                if (submit(retry.getJobId(), retry.getOccurrenceKey())) {
                    dispatched++;
                }
            }
            for (TriggerEvent orphan : claimStore.findClaimedWithoutRun(now.minus(orphanClaimGrace), claimLimit)) {
                if (submit(orphan.getJobId(), orphan.getOccurrenceKey())) {
                    log.info("Re-dispatching occurrence {} of job {} claimed at {} with no run",
                            orphan.getOccurrenceKey(), orphan.getJobId(), orphan.getClaimedAt());
                    dispatched++;
                }
            }
            return dispatched;
        });
    }

    /**
     * Polls event feeds of event-triggered jobs and dispatches new occurrences.
     *
     * @return occurrences dispatched
     */
    public int pollCustomJobTriggers() {
        return tick("poll_custom_job_triggers", () -> dispatch(poller.pollEventJobs(clock.instant())));
    }

    /**
     * Worker entry point: runs the next attempt of one claimed occurrence on
     * the calling thread.
     *
     * @return 1 if an attempt ran, 0 if the request was dropped
     */
    public int runCustomJob(UUID jobId, String occurrenceKey) {
        if (!enabled) {
            return 0;
        }
        try {
            CustomJob job = registry.getJob(jobId);
            Optional<TriggerEvent> event = claimStore.find(jobId, occurrenceKey);
            if (event.isEmpty() || !event.get().isClaimed()) {
                log.warn("Dropping run of job {}: occurrence {} is not claimed", jobId, occurrenceKey);
                return 0;
            }
            runner.run(job, event.get());
            return 1;
        } catch (JobNotFoundException e) {
            log.warn("Dropping run request: {}", e.getMessage());
        } catch (AttemptsExhaustedException e) {
            log.warn("Dropping run request: {}", e.getMessage());
        } catch (ClaimConflictException e) {
            log.debug("Run of job {} occurrence {} taken elsewhere: {}", jobId, occurrenceKey, e.getMessage());
        } catch (StorageUnavailableException e) {
            log.warn("Run of job {} occurrence {} aborted, store unavailable: {}", jobId, occurrenceKey, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Run of job {} occurrence {} failed outside the handler", jobId, occurrenceKey, e);
        }
        return 0;
    }

    /**
     * Deletes history past the retention horizon.
     *
     * @return rows deleted
     */
    public int cleanupCustomJobHistory() {
        return tick("cleanup_custom_job_history", () -> {
            RetentionResult result = retentionSweeper.sweep(clock.instant());
            return result.deleted();
        });
    }

    /**
     * @return runs closed
     */
    public int reconcileStaleRuns() {
        return tick("reconcile_stale_runs", () -> reconciler.reconcile(clock.instant()));
    }

    /**
     * Records a manual run request. The occurrence is claimed and dispatched
     * by the next trigger-events tick.
     *
     * @param idempotencyKey Requests with the same key map to one occurrence; null for a fresh key
     * @throws JobNotFoundException if the job does not exist
     * @throws ManualTriggerCooldownException if the job triggered within the cooldown
     * @throws IllegalArgumentException if the key does not fit an occurrence key
     */
    public ManualRunRequest requestManualRun(UUID jobId, String idempotencyKey) {
        CustomJob job = registry.getJob(jobId);
        String key = idempotencyKey == null || idempotencyKey.isBlank()
                ? UUID.randomUUID().toString()
                : idempotencyKey.trim();
        Instant now = clock.instant();
        TriggerOccurrence occurrence = TriggerOccurrence.manual(job.getId(), key, null, now);
        String occurrenceKey = occurrence.occurrenceKey();

        Optional<TriggerEvent> existing = claimStore.find(job.getId(), occurrenceKey);
        if (existing.isPresent()) {
            return new ManualRunRequest(existing.get(), false);
        }
        Optional<TriggerEvent> latest = claimStore.findLatest(job.getId());
        if (latest.isPresent() && !latest.get().getDetectedAt().isBefore(now.minus(manualTriggerCooldown))) {
            throw new ManualTriggerCooldownException(job.getId(), manualTriggerCooldown);
        }
        boolean created = claimStore.record(occurrence);
        TriggerEvent event = claimStore.find(job.getId(), occurrenceKey)
                .orElseThrow(() -> new IllegalStateException("Manual occurrence " + occurrenceKey + " vanished"));
        log.info("Manual run of job {} requested as {} (created={})", job.getId(), occurrenceKey, created);
        return new ManualRunRequest(event, created);
    }

    /**
     * Stores an event pushed by a collaborator for an event-triggered job.
     *
     * @return false if the event was already recorded
     * @throws JobNotFoundException if the job does not exist
     * @throws IllegalArgumentException if the event id is blank or does not fit an occurrence key
     */
    public boolean recordExternalEvent(UUID jobId, String eventId, String payloadJson) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event id cannot be null or blank");
        }
        CustomJob job = registry.getJob(jobId);
        boolean created = claimStore.record(
                TriggerOccurrence.pushedEvent(job.getId(), eventId.trim(), payloadJson, clock.instant()));
        if (!created) {
            log.debug("Event {} for job {} already recorded", eventId, jobId);
        }
        return created;
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = runner.cancelInFlight("scheduler shutting down");
        if (cancelled > 0) {
            log.warn("Cancelled {} in-flight run(s) on shutdown", cancelled);
        }
    }

    private int dispatch(List<ClaimedTrigger> claimed) {
        int dispatched = 0;
        for (ClaimedTrigger trigger : claimed) {
            if (submit(trigger.job().getId(), trigger.occurrenceKey())) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private boolean submit(UUID jobId, String occurrenceKey) {
        String token = jobId + "|" + occurrenceKey;
        if (!pending.add(token)) {
            return false;
        }
        try {
            executor.execute(() -> {
                try {
                    runCustomJob(jobId, occurrenceKey);
                } finally {
                    pending.remove(token);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            pending.remove(token);
            log.warn("Worker pool rejected job {} occurrence {}, it will be re-dispatched later",
                    jobId, occurrenceKey);
            return false;
        }
    }

    private int tick(String name, Supplier<Integer> work) {
        if (!enabled) {
            return 0;
        }
        try {
            return work.get();
        } catch (StorageUnavailableException e) {
            log.warn("{} aborted, store unavailable: {}", name, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} aborted", name, e);
        }
        return 0;
    }
}
