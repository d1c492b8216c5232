package com.tickwork.scheduler.poll;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.CustomJob.TriggerType;
import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.core.repository.StorageUnavailableException;
import com.tickwork.scheduler.config.CustomJobProperties;
import com.tickwork.scheduler.history.JobHistoryStore;
import com.tickwork.scheduler.metrics.JobMetrics;
import com.tickwork.scheduler.registry.JobNotFoundException;
import com.tickwork.scheduler.registry.JobRegistry;
import com.tickwork.scheduler.trigger.Evaluation;
import com.tickwork.scheduler.trigger.InvalidTriggerSpecException;
import com.tickwork.scheduler.trigger.TriggerEvaluator;
import com.tickwork.scheduler.trigger.TriggerOccurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds due occurrences and claims them.
 *
 * A job's cursor is read before evaluation and written only after every
 * occurrence of the evaluation has been claimed here or found claimed by
 * another instance, so the cursor never passes an unclaimed occurrence.
 */
@Component
public class TriggerPoller {

    private static final Logger log = LoggerFactory.getLogger(TriggerPoller.class);

    private final JobRegistry registry;
    private final TriggerEvaluator evaluator;
    private final TriggerClaimStore claimStore;
    private final JobHistoryStore historyStore;
    private final JobMetrics metrics;
    private final String instanceId;
    private final int claimLimit;

    public TriggerPoller(JobRegistry registry,
                         TriggerEvaluator evaluator,
                         TriggerClaimStore claimStore,
                         JobHistoryStore historyStore,
                         JobMetrics metrics,
                         CustomJobProperties properties) {
        this.registry = registry;
        this.evaluator = evaluator;
        this.claimStore = claimStore;
        this.historyStore = historyStore;
        this.metrics = metrics;
        this.instanceId = properties.getInstanceId();
        this.claimLimit = properties.getClaimLimit();
    }

    public List<ClaimedTrigger> pollScheduledJobs(Instant now) {
        return poll(TriggerType.SCHEDULE, now);
    }

    public List<ClaimedTrigger> pollEventJobs(Instant now) {
        return poll(TriggerType.EVENT, now);
    }

    /**
     * Polls every enabled job of one trigger type. A failure in one job is
     * logged and the remaining jobs are still polled, unless storage is
     * unavailable: that ends the poll.
     *
     * @throws StorageUnavailableException if the registry or claim table cannot be reached
     */
    public List<ClaimedTrigger> poll(TriggerType triggerType, Instant now) {
        List<CustomJob> jobs = registry.listEnabledJobs(triggerType);
        List<ClaimedTrigger> claimed = new ArrayList<>();
        for (CustomJob job : jobs) {
            try {
                pollJob(job, now, claimed);
            } catch (InvalidTriggerSpecException e) {
                log.warn("Skipping job {} ({}): {}", job.getId(), job.getName(), e.getMessage());
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Polling job {} ({}) failed: {}", job.getId(), job.getName(), e.getMessage());
            }
        }
        if (!claimed.isEmpty()) {
            log.info("Claimed {} {} occurrence(s) across {} job(s)", claimed.size(), triggerType, jobs.size());
        }
        return claimed;
    }

    private void pollJob(CustomJob job, Instant now, List<ClaimedTrigger> claimed) {
        Evaluation evaluation = evaluator.evaluate(job, now);
        TriggerOccurrence lastHandled = null;
        RuntimeException failure = null;
        int claimedForJob = 0;

        for (TriggerOccurrence occurrence : evaluation.occurrences()) {
            try {
                TriggerEvent event = claimStore.claim(occurrence, instanceId);
                claimed.add(new ClaimedTrigger(job, event));
                claimedForJob++;
                metrics.claim("claimed");
            } catch (ClaimConflictException e) {
                log.debug("Occurrence {} of job {} already claimed", occurrence.occurrenceKey(), job.getId());
                metrics.claim("conflict");
            } catch (RuntimeException e) {
                log.warn("Claiming occurrence {} of job {} failed, stopping at previous occurrence: {}",
                        occurrence.occurrenceKey(), job.getId(), e.getMessage());
                metrics.claim("failed");
                failure = e;
                break;
            }
            lastHandled = occurrence;
        }

        if (claimedForJob > 0) {
            registry.markTriggered(job.getId(), now);
        }
        if (failure == null) {
            if (job.isScheduled()) {
                registry.advanceScheduleCursor(job.getId(), evaluation.evaluatedThrough());
            } else {
                registry.advanceEventCursor(job.getId(), evaluation.eventCursor(), now);
            }
            if (evaluation.truncated()) {
                log.warn("Job {} has more than {} missed occurrences, catching up through {}",
                        job.getId(), evaluation.occurrences().size(), evaluation.evaluatedThrough());
            }
        } else if (job.isScheduled() && lastHandled != null) {
            registry.advanceScheduleCursor(job.getId(), lastHandled.scheduledFor());
        }
        // event cursors are opaque; a partial batch is re-read and deduplicated next tick
        if (failure instanceof StorageUnavailableException) {
            throw (StorageUnavailableException) failure;
        }
    }

    /**
     * Claims recorded events (pushed events and manual runs), oldest first,
     * up to the claim limit. Jobs with a concurrency cap are not given more
     * claims than they have free slots.
     */
    public List<ClaimedTrigger> claimRecordedEvents(Instant now) {
        List<TriggerEvent> pending = claimStore.findUnclaimed(claimLimit);
        List<ClaimedTrigger> claimed = new ArrayList<>();
        Map<UUID, Optional<CustomJob>> jobs = new HashMap<>();
        Map<UUID, Long> active = new HashMap<>();

        for (TriggerEvent event : pending) {
            Optional<CustomJob> job = jobs.computeIfAbsent(event.getJobId(), this::loadJob);
            if (job.isEmpty() || !job.get().isEnabled()) {
                continue;
            }
            Integer cap = job.get().getMaxConcurrentRuns();
            if (cap != null) {
                long running = active.computeIfAbsent(event.getJobId(), historyStore::countRunning);
                if (running >= cap) {
                    log.debug("Job {} at concurrency cap {}, leaving {} unclaimed",
                            event.getJobId(), cap, event.getOccurrenceKey());
                    continue;
                }
            }
            if (claimStore.claimRecorded(event, instanceId, now)) {
                event.markClaimed(instanceId, now);
                claimed.add(new ClaimedTrigger(job.get(), event));
                active.merge(event.getJobId(), 1L, Long::sum);
                registry.markTriggered(event.getJobId(), now);
                metrics.claim("claimed");
            } else {
                log.debug("Recorded occurrence {} of job {} claimed elsewhere",
                        event.getOccurrenceKey(), event.getJobId());
                metrics.claim("conflict");
            }
        }
        if (!claimed.isEmpty()) {
            log.info("Claimed {} recorded occurrence(s)", claimed.size());
        }
        return claimed;
    }

    private Optional<CustomJob> loadJob(UUID jobId) {
        try {
            return Optional.of(registry.getJob(jobId));
        } catch (JobNotFoundException e) {
            log.warn("Recorded occurrence references unknown job {}", jobId);
            return Optional.empty();
        }
    }
}
