package com.tickwork.scheduler.metrics;

import com.tickwork.core.domain.JobRun.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Scheduler meters.
 */
@Component
public class JobMetrics {

    public static final String RUNS = "tickwork.jobs.runs";
    public static final String RUN_DURATION = "tickwork.jobs.run.duration";
    public static final String CLAIMS = "tickwork.jobs.claims";
    public static final String ALERTS = "tickwork.jobs.alerts";

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void runFinished(String handlerKey, RunStatus status, Duration duration) {
        Counter.builder(RUNS)
                .description("Finished job run attempts")
                .tag("handler", handlerKey)
                .tag("status", status.name())
                .register(registry)
                .increment();
        Timer.builder(RUN_DURATION)
                .description("Wall time of job run attempts")
                .tag("handler", handlerKey)
                .register(registry)
                .record(duration);
    }

    /**
     * @param outcome claimed, conflict or failed
     */
    public void claim(String outcome) {
        Counter.builder(CLAIMS)
                .description("Trigger occurrence claim attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void alert(String type) {
        Counter.builder(ALERTS)
                .description("Job alerts raised")
                .tag("type", type)
                .register(registry)
                .increment();
    }
}
