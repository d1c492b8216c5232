package com.tickwork.scheduler.alert;

import com.tickwork.scheduler.metrics.JobMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default alert sink: a log line plus a counter.
 */
@Component
public class LoggingJobAlertSink implements JobAlertSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobAlertSink.class);

    private final JobMetrics metrics;

    public LoggingJobAlertSink(JobMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void raise(JobAlert alert) {
        switch (alert.type()) {
            case ATTEMPTS_EXHAUSTED -> log.error("[{}] job={} occurrence={} attempt={}: {}",
                    alert.type(), alert.jobId(), alert.occurrenceKey(), alert.attempt(), alert.message());
            case STALE_RUNNING -> log.warn("[{}] job={} occurrence={} attempt={}: {}",
                    alert.type(), alert.jobId(), alert.occurrenceKey(), alert.attempt(), alert.message());
        }
        metrics.alert(alert.type().name());
    }
}
