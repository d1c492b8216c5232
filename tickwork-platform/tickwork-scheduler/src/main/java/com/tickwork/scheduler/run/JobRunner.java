package com.tickwork.scheduler.run;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.JobRun;
import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.scheduler.alert.AlertType;
import com.tickwork.scheduler.alert.JobAlertPublisher;
import com.tickwork.scheduler.config.CustomJobProperties;
import com.tickwork.scheduler.history.JobHistoryStore;
import com.tickwork.scheduler.metrics.JobMetrics;
import com.tickwork.scheduler.poll.ClaimConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes one attempt of one claimed occurrence.
 *
 * Per attempt the runner inserts one RUNNING row, invokes the handler once
 * and closes the row once. Closing is conditional on the row still being
 * RUNNING: a row already closed by reconciliation or cancellation keeps that
 * state.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final JobHandlerRegistry handlers;
    private final JobHistoryStore historyStore;
    private final RetryPolicy retryPolicy;
    private final JobAlertPublisher alerts;
    private final JobMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String instanceId;
    private final Duration runTimeout;

    private final Map<UUID, InFlightRun> inFlight = new ConcurrentHashMap<>();

    public JobRunner(JobHandlerRegistry handlers,
                     JobHistoryStore historyStore,
                     RetryPolicy retryPolicy,
                     JobAlertPublisher alerts,
                     JobMetrics metrics,
                     ObjectMapper objectMapper,
                     Clock clock,
                     CustomJobProperties properties) {
        this.handlers = handlers;
        this.historyStore = historyStore;
        this.retryPolicy = retryPolicy;
        this.alerts = alerts;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.instanceId = properties.getInstanceId();
        this.runTimeout = properties.getRunTimeout();
    }

    /**
     * Runs the next attempt of a claimed occurrence on the calling thread.
     *
     * @return The attempt as stored after completion
     * @throws AttemptsExhaustedException if no attempt is left
     * @throws com.tickwork.scheduler.poll.ClaimConflictException if another worker started this attempt
     */
    public JobRun run(CustomJob job, TriggerEvent event) {
        String occurrenceKey = event.getOccurrenceKey();
        int ceiling = retryPolicy.ceilingFor(job);
        Instant startedAt = clock.instant();
        int prior = 0;
        Optional<JobRun> latest = historyStore.findLatestAttempt(job.getId(), occurrenceKey);
        if (latest.isPresent()) {
            JobRun previous = latest.get();
            prior = previous.getAttemptNumber();
            if (previous.isAttemptsExhausted() || prior >= ceiling) {
                throw new AttemptsExhaustedException(job.getId(), occurrenceKey, prior);
            }
            if (!previous.isRetryPlanned() || previous.getRetryAt().isAfter(startedAt)) {
                throw new ClaimConflictException(job.getId(), occurrenceKey, "Attempt " + prior + " of "
                        + occurrenceKey + " is " + previous.getStatus() + " with no retry due");
            }
        }

        JobRun run = JobRun.start(job.getId(), occurrenceKey, prior + 1, startedAt, instanceId);
        historyStore.record(run);

        InFlightRun current = new InFlightRun(run, Thread.currentThread(), ceiling);
        inFlight.put(run.getId(), current);
        log.info("Starting job {} ({}) occurrence {} attempt {}/{}",
                job.getId(), job.getName(), occurrenceKey, run.getAttemptNumber(), ceiling);
        try {
            execute(job, event, current, ceiling);
        } finally {
            inFlight.remove(run.getId());
        }
        metrics.runFinished(job.getHandlerKey(), run.getStatus(),
                Duration.between(startedAt, run.getFinishedAt() != null ? run.getFinishedAt() : clock.instant()));
        return run;
    }

    private void execute(CustomJob job, TriggerEvent event, InFlightRun current, int ceiling) {
        JobRun run = current.run;
        Optional<JobHandler> handler = handlers.find(job.getHandlerKey());
        if (handler.isEmpty()) {
            close(job, current, ceiling, new NonRetryableJobException(
                    "Unknown handler key '" + job.getHandlerKey() + "'"), false);
            return;
        }
        try {
            Map<String, Object> config = parseObject(job.getConfigJson(), "job configuration");
            TriggerContext context = new TriggerContext(job.getId(), run.getId(), run.getOccurrenceKey(),
                    event.getSource(), event.getScheduledFor(), parseObject(event.getPayloadJson(), "payload"),
                    run.getAttemptNumber(), run.getStartedAt().plus(runTimeout));
            JobOutcome outcome = handler.get().invoke(config, context);
            closeNormally(job, current, outcome);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close(job, current, ceiling, e, true);
        } catch (Exception e) {
            close(job, current, ceiling, e, !(e instanceof NonRetryableJobException));
        }
    }

    private void closeNormally(CustomJob job, InFlightRun current, JobOutcome outcome) {
        synchronized (current) {
            if (current.closed) {
                log.warn("Job {} occurrence {} attempt {} returned after it was cancelled",
                        job.getId(), current.run.getOccurrenceKey(), current.run.getAttemptNumber());
                return;
            }
            Instant now = clock.instant();
            if (outcome != null && outcome.skipped()) {
                current.run.skip(now, outcome.reason());
            } else {
                current.run.succeed(now);
            }
            store(current);
        }
        log.info("Job {} occurrence {} attempt {} finished with {}",
                job.getId(), current.run.getOccurrenceKey(), current.run.getAttemptNumber(), current.run.getStatus());
    }

    private void close(CustomJob job, InFlightRun current, int ceiling, Exception cause, boolean retryable) {
        JobRun run = current.run;
        boolean stored;
        synchronized (current) {
            if (current.closed) {
                log.warn("Job {} occurrence {} attempt {} failed after it was cancelled: {}",
                        job.getId(), run.getOccurrenceKey(), run.getAttemptNumber(), cause.getMessage());
                return;
            }
            Instant now = clock.instant();
            String summary = cause instanceof InterruptedException
                    ? "Cancelled: worker thread interrupted"
                    : summarize(cause);
            failOrExhaust(run, now, summary, retryable, ceiling);
            stored = store(current);
        }
        if (!stored) {
            return;
        }
        if (run.isAttemptsExhausted()) {
            alertExhausted(run);
        } else {
            log.warn("Job {} occurrence {} attempt {} failed, retry at {}: {}",
                    job.getId(), run.getOccurrenceKey(), run.getAttemptNumber(), run.getRetryAt(),
                    run.getErrorSummary());
        }
    }

    private void failOrExhaust(JobRun run, Instant now, String summary, boolean retryable, int ceiling) {
        if (retryable && run.getAttemptNumber() < ceiling) {
            run.fail(now, summary, now.plus(retryPolicy.backoff(run.getAttemptNumber())));
        } else {
            run.exhaust(now, summary);
        }
    }

    private boolean store(InFlightRun current) {
        current.closed = true;
        if (!historyStore.update(current.run)) {
            log.warn("Run {} of job {} was closed elsewhere before completion, keeping stored state",
                    current.run.getId(), current.run.getJobId());
            return false;
        }
        return true;
    }

    private void alertExhausted(JobRun run) {
        log.error("Job {} occurrence {} failed on attempt {} with no attempts left: {}",
                run.getJobId(), run.getOccurrenceKey(), run.getAttemptNumber(), run.getErrorSummary());
        alerts.publish(AlertType.ATTEMPTS_EXHAUSTED, run.getJobId(), run.getOccurrenceKey(),
                run.getAttemptNumber(), run.getErrorSummary(), run.getFinishedAt());
    }

    /**
     * Closes every attempt this instance is executing as a retry-eligible
     * failure and interrupts the worker threads.
     *
     * @return number of attempts cancelled
     */
    public int cancelInFlight(String reason) {
        int cancelled = 0;
        for (InFlightRun current : new ArrayList<>(inFlight.values())) {
            boolean stored;
            synchronized (current) {
                if (current.closed) {
                    continue;
                }
                failOrExhaust(current.run, clock.instant(), "Cancelled: " + reason, true, current.ceiling);
                stored = store(current);
            }
            current.thread.interrupt();
            cancelled++;
            log.warn("Cancelled job {} occurrence {} attempt {}: {}", current.run.getJobId(),
                    current.run.getOccurrenceKey(), current.run.getAttemptNumber(), reason);
            if (stored && current.run.isAttemptsExhausted()) {
                alertExhausted(current.run);
            }
        }
        return cancelled;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private Map<String, Object> parseObject(String json, String what) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, JSON_OBJECT);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new NonRetryableJobException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String summarize(Exception e) {
        if (e instanceof HandlerFailureException || e instanceof NonRetryableJobException) {
            return e.getMessage();
        }
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private static final class InFlightRun {
        private final JobRun run;
        private final Thread thread;
        private final int ceiling;
        private boolean closed;

        private InFlightRun(JobRun run, Thread thread, int ceiling) {
            this.run = run;
            this.thread = thread;
            this.ceiling = ceiling;
        }
    }
}
