package com.tickwork.scheduler.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fans alerts out to every registered {@link JobAlertSink}. A failing sink is
 * logged and does not affect the others or the caller.
 */
@Component
public class JobAlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(JobAlertPublisher.class);

    private final List<JobAlertSink> sinks;

    public JobAlertPublisher(List<JobAlertSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public void publish(AlertType type, UUID jobId, String occurrenceKey, int attempt,
                        String message, Instant raisedAt) {
        publish(new JobAlert(type, jobId, occurrenceKey, attempt, message, raisedAt));
    }

    public void publish(JobAlert alert) {
        for (JobAlertSink sink : sinks) {
            try {
                sink.raise(alert);
            } catch (Exception e) {
                log.warn("Alert sink {} failed for {} on job {}: {}",
                        sink.getClass().getSimpleName(), alert.type(), alert.jobId(), e.getMessage());
            }
        }
    }
}
