package com.tickwork.scheduler.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler ticks. Each tick has its own interval and runs with a fixed
 * delay, so a slow tick never overlaps itself.
 */
@Component
@ConditionalOnProperty(prefix = "tickwork.jobs", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class CustomJobTasks {

    private static final Logger log = LoggerFactory.getLogger(CustomJobTasks.class);

    private final CustomJobDispatcher dispatcher;

    public CustomJobTasks(CustomJobDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        int closed = dispatcher.reconcileStaleRuns();
        log.info("Startup reconciliation closed {} stale run(s)", closed);
    }

    @Scheduled(fixedDelayString = "${tickwork.jobs.check-interval-ms:30000}")
    public void checkForCustomJobs() {
        dispatcher.checkForCustomJobs();
    }

    @Scheduled(fixedDelayString = "${tickwork.jobs.trigger-events-interval-ms:15000}")
    public void checkForCustomJobTriggerEvents() {
        dispatcher.checkForCustomJobTriggerEvents();
    }

    @Scheduled(fixedDelayString = "${tickwork.jobs.poll-triggers-interval-ms:60000}")
    public void pollCustomJobTriggers() {
        dispatcher.pollCustomJobTriggers();
    }

    @Scheduled(fixedDelayString = "${tickwork.jobs.cleanup-interval-ms:3600000}")
    public void cleanupCustomJobHistory() {
        dispatcher.cleanupCustomJobHistory();
    }
}
