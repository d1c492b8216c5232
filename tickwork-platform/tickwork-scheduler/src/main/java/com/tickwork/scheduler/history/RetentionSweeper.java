package com.tickwork.scheduler.history;

import com.tickwork.core.domain.JobRun;
import com.tickwork.scheduler.alert.AlertType;
import com.tickwork.scheduler.alert.JobAlertPublisher;
import com.tickwork.scheduler.poll.TriggerClaimStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Deletes history older than the retention horizon. Runs still RUNNING past
 * the horizon are kept and raised as stale-run alerts.
 */
@Component
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final JobHistoryStore historyStore;
    private final TriggerClaimStore claimStore;
    private final RetentionPolicy policy;
    private final JobAlertPublisher alerts;

    public RetentionSweeper(JobHistoryStore historyStore, TriggerClaimStore claimStore, RetentionPolicy policy,
                            JobAlertPublisher alerts) {
        this.historyStore = historyStore;
        this.claimStore = claimStore;
        this.policy = policy;
        this.alerts = alerts;
    }

    public RetentionResult sweep(Instant now) {
        Instant cutoff = policy.cutoff(now);
        // events first: an event is only purgeable while its runs are still there
        int events = claimStore.purgeClaimedBefore(cutoff, policy.batchSize());
        int runs = historyStore.purgeOlderThan(cutoff, policy.batchSize());
        long stale = historyStore.countRunningStartedBefore(cutoff);
        if (stale > 0) {
            log.warn("{} job run(s) started before {} are still RUNNING and were kept", stale, cutoff);
            for (JobRun run : historyStore.findRunningStartedBefore(cutoff)) {
                alerts.publish(AlertType.STALE_RUNNING, run.getJobId(), run.getOccurrenceKey(),
                        run.getAttemptNumber(), "Run " + run.getId() + " started at " + run.getStartedAt()
                                + " is still RUNNING past the retention horizon", now);
            }
        }
        log.info("Retention sweep before {} deleted {} run(s) and {} trigger event(s)", cutoff, runs, events);
        return new RetentionResult(runs, events, stale);
    }
}
