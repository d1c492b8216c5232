package com.tickwork.scheduler.history;

import com.tickwork.core.domain.JobRun;
import com.tickwork.scheduler.alert.AlertType;
import com.tickwork.scheduler.alert.JobAlertPublisher;
import com.tickwork.scheduler.config.CustomJobProperties;
import com.tickwork.scheduler.registry.JobNotFoundException;
import com.tickwork.scheduler.registry.JobRegistry;
import com.tickwork.scheduler.run.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes runs left RUNNING by a crashed or stuck worker.
 *
 * A run is stale once it has been RUNNING longer than the stale timeout. It
 * is closed as a failure that is immediately retry eligible when the
 * occurrence has attempts left.
 */
@Component
public class StaleRunReconciler {

    private static final Logger log = LoggerFactory.getLogger(StaleRunReconciler.class);

    static final String STALE_SUMMARY = "Run marked failed after exceeding the stale timeout";

    private final JobHistoryStore historyStore;
    private final JobRegistry registry;
    private final RetryPolicy retryPolicy;
    private final JobAlertPublisher alerts;
    private final Duration staleRunTimeout;

    public StaleRunReconciler(JobHistoryStore historyStore,
                              JobRegistry registry,
                              RetryPolicy retryPolicy,
                              JobAlertPublisher alerts,
                              CustomJobProperties properties) {
        this.historyStore = historyStore;
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.alerts = alerts;
        this.staleRunTimeout = properties.getStaleRunTimeout();
    }

    /**
     * @return number of runs closed
     */
    public int reconcile(Instant now) {
        Instant cutoff = now.minus(staleRunTimeout);
        List<JobRun> stale = historyStore.findRunningStartedBefore(cutoff);
        int closed = 0;
        for (JobRun run : stale) {
            if (close(run, now)) {
                closed++;
            }
        }
        if (closed > 0) {
            log.warn("Reconciled {} stale run(s) started before {}", closed, cutoff);
        }
        return closed;
    }

    private boolean close(JobRun run, Instant now) {
        int ceiling;
        try {
            ceiling = retryPolicy.ceilingFor(registry.getJob(run.getJobId()));
        } catch (JobNotFoundException e) {
            ceiling = run.getAttemptNumber();
        }
        if (run.getAttemptNumber() < ceiling) {
            run.fail(now, STALE_SUMMARY, now);
        } else {
            run.exhaust(now, STALE_SUMMARY);
        }
        if (!historyStore.update(run)) {
            // finished between the read and the update
            return false;
        }
        alerts.publish(AlertType.STALE_RUNNING, run.getJobId(), run.getOccurrenceKey(), run.getAttemptNumber(),
                "Run " + run.getId() + " started at " + run.getStartedAt() + " was still RUNNING"
                        + (run.isAttemptsExhausted() ? ", no attempts left" : ", retry scheduled"),
                now);
        if (run.isAttemptsExhausted()) {
            log.error("Job {} occurrence {} went stale on attempt {} with no attempts left",
                    run.getJobId(), run.getOccurrenceKey(), run.getAttemptNumber());
            alerts.publish(AlertType.ATTEMPTS_EXHAUSTED, run.getJobId(), run.getOccurrenceKey(),
                    run.getAttemptNumber(), run.getErrorSummary(), now);
        }
        return true;
    }
}
