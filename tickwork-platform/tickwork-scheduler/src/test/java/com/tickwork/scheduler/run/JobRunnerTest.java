package com.tickwork.scheduler.run;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.JobRun;
import com.tickwork.core.domain.JobRun.RunStatus;
import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.core.domain.TriggerEvent.TriggerSource;
import com.tickwork.scheduler.alert.AlertType;
import com.tickwork.scheduler.metrics.JobMetrics;
import com.tickwork.scheduler.poll.ClaimConflictException;
import com.tickwork.scheduler.registry.JobDefinition;
import com.tickwork.scheduler.support.Handlers;
import com.tickwork.scheduler.support.ScriptedHandler;
import com.tickwork.scheduler.support.SchedulerFixture;
import com.tickwork.scheduler.trigger.TriggerOccurrence;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class JobRunnerTest {

    private static final Instant NOW = Instant.parse("2024-04-02T12:00:00Z");

    @Test
    void successfulAttemptIsRecordedWithContext() {
        ScriptedHandler handler = ScriptedHandler.succeeding("sync");
        SchedulerFixture fixture = SchedulerFixture.create(NOW, handler);
        CustomJob job = fixture.registry.register(
                JobDefinition.eventDriven("sync", "sync", "push", "*").withConfig("{\"region\":\"eu\"}"));
        TriggerEvent event = claimPushedEvent(fixture, job, "{\"invoice\":42}");

        JobRun run = fixture.runner.run(job, event);

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(run.getFinishedAt()).isEqualTo(NOW);
        assertThat(run.getWorkerId()).isEqualTo(SchedulerFixture.INSTANCE_ID);
        assertThat(handler.configs()).singleElement().isEqualTo(Map.of("region", "eu"));
        assertThat(handler.contexts()).singleElement().satisfies(context -> {
            assertThat(context.jobId()).isEqualTo(job.getId());
            assertThat(context.runId()).isEqualTo(run.getId());
            assertThat(context.occurrenceKey()).isEqualTo("event:e1");
            assertThat(context.source()).isEqualTo(TriggerSource.EVENT);
            assertThat(context.payload()).containsEntry("invoice", 42);
            assertThat(context.attempt()).isEqualTo(1);
            assertThat(context.deadline()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        });
        assertThat(fixture.history.findLatestAttempt(job.getId(), "event:e1"))
                .hasValueSatisfying(stored -> assertThat(stored.getStatus()).isEqualTo(RunStatus.SUCCESS));
        assertThat(fixture.meters.counter(JobMetrics.RUNS, "handler", "sync", "status", "SUCCESS").count())
                .isEqualTo(1.0);
    }

    @Test
    void skippedOutcomeKeepsReason() {
        SchedulerFixture fixture = SchedulerFixture.create(NOW,
                Handlers.of("quiet", (config, context) -> JobOutcome.skipped("nothing to do")));
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("quiet", "quiet", "push", "*"));

        JobRun run = fixture.runner.run(job, claimPushedEvent(fixture, job, null));

        assertThat(run.getStatus()).isEqualTo(RunStatus.SKIPPED);
        assertThat(run.getErrorSummary()).isEqualTo("nothing to do");
    }

    @Test
    void unknownHandlerFailsWithoutRetry() {
        SchedulerFixture fixture = SchedulerFixture.create(NOW);
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("orphan", "missing", "push", "*"));

        JobRun run = fixture.runner.run(job, claimPushedEvent(fixture, job, null));

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILURE);
        assertThat(run.isAttemptsExhausted()).isTrue();
        assertThat(run.getErrorSummary()).isEqualTo("Unknown handler key 'missing'");
        assertThat(fixture.alertSink.ofType(AlertType.ATTEMPTS_EXHAUSTED)).singleElement()
                .satisfies(alert -> assertThat(alert.occurrenceKey()).isEqualTo("event:e1"));
    }

    @Test
    void nonRetryableFailureExhaustsOnFirstAttempt() {
        SchedulerFixture fixture = SchedulerFixture.create(NOW, Handlers.of("strict", (config, context) -> {
            throw new NonRetryableJobException("config missing 'target'");
        }));
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("strict", "strict", "push", "*"));
        TriggerEvent event = claimPushedEvent(fixture, job, null);

        JobRun run = fixture.runner.run(job, event);

        assertThat(run.isAttemptsExhausted()).isTrue();
        assertThat(run.getErrorSummary()).isEqualTo("config missing 'target'");
        assertThatThrownBy(() -> fixture.runner.run(job, event))
                .isInstanceOf(AttemptsExhaustedException.class);
    }

    @Test
    void invalidConfigJsonIsNotRetried() {
        ScriptedHandler handler = ScriptedHandler.succeeding("sync");
        SchedulerFixture fixture = SchedulerFixture.create(NOW, handler);
        CustomJob job = fixture.registry.register(
                JobDefinition.eventDriven("sync", "sync", "push", "*").withConfig("{not json"));

        JobRun run = fixture.runner.run(job, claimPushedEvent(fixture, job, null));

        assertThat(run.isAttemptsExhausted()).isTrue();
        assertThat(run.getErrorSummary()).startsWith("Invalid job configuration JSON");
        assertThat(handler.invocations()).isZero();
    }

    @Test
    void retryWaitsForBackoff() {
        ScriptedHandler handler = new ScriptedHandler("flaky", 1);
        SchedulerFixture fixture = SchedulerFixture.create(NOW, handler);
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("flaky", "flaky", "push", "*"));
        TriggerEvent event = claimPushedEvent(fixture, job, null);

        JobRun first = fixture.runner.run(job, event);

        assertThat(first.getStatus()).isEqualTo(RunStatus.FAILURE);
        assertThat(first.getErrorSummary()).isEqualTo("scripted failure 1");
        assertThat(first.getRetryAt()).isEqualTo(NOW.plusSeconds(1));
        assertThatThrownBy(() -> fixture.runner.run(job, event)).isInstanceOf(ClaimConflictException.class);

        fixture.clock.advance(Duration.ofSeconds(1));
        JobRun second = fixture.runner.run(job, event);

        assertThat(second.getAttemptNumber()).isEqualTo(2);
        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(fixture.history.countAttempts(job.getId(), "event:e1")).isEqualTo(2);
    }

    @Test
    void runningAttemptBlocksAnotherStart() {
        SchedulerFixture fixture = SchedulerFixture.create(NOW, ScriptedHandler.succeeding("sync"));
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("sync", "sync", "push", "*"));
        TriggerEvent event = claimPushedEvent(fixture, job, null);
        fixture.history.put(JobRun.start(job.getId(), "event:e1", 1, NOW, "elsewhere"));

        assertThatThrownBy(() -> fixture.runner.run(job, event))
                .isInstanceOf(ClaimConflictException.class)
                .hasMessageContaining("RUNNING");
    }

    @Test
    void cancellationClosesRunAsRetryableFailure() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        SchedulerFixture fixture = SchedulerFixture.create(NOW, Handlers.of("slow", (config, context) -> {
            started.countDown();
            new CountDownLatch(1).await();
            return JobOutcome.success();
        }));
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("slow", "slow", "push", "*"));
        TriggerEvent event = claimPushedEvent(fixture, job, null);

        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            Future<JobRun> result = worker.submit(() -> fixture.runner.run(job, event));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(fixture.runner.cancelInFlight("scheduler shutting down")).isEqualTo(1);
            result.get(5, TimeUnit.SECONDS);
        } finally {
            worker.shutdownNow();
        }

        JobRun stored = fixture.history.findLatestAttempt(job.getId(), "event:e1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(RunStatus.FAILURE);
        assertThat(stored.getErrorSummary()).isEqualTo("Cancelled: scheduler shutting down");
        assertThat(stored.isRetryPlanned()).isTrue();
        assertThat(fixture.runner.inFlightCount()).isZero();
    }

    @Test
    void cancellingTheLastAttemptRaisesExhaustedAlert() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        SchedulerFixture fixture = SchedulerFixture.create(NOW, Handlers.of("slow", (config, context) -> {
            started.countDown();
            new CountDownLatch(1).await();
            return JobOutcome.success();
        }));
        CustomJob job = fixture.registry.register(
                JobDefinition.eventDriven("slow", "slow", "push", "*").withLimits(1, null));
        TriggerEvent event = claimPushedEvent(fixture, job, null);

        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            Future<JobRun> result = worker.submit(() -> fixture.runner.run(job, event));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(fixture.runner.cancelInFlight("scheduler shutting down")).isEqualTo(1);
            result.get(5, TimeUnit.SECONDS);
        } finally {
            worker.shutdownNow();
        }

        JobRun stored = fixture.history.findLatestAttempt(job.getId(), "event:e1").orElseThrow();
        assertThat(stored.isAttemptsExhausted()).isTrue();
        assertThat(fixture.alertSink.ofType(AlertType.ATTEMPTS_EXHAUSTED)).singleElement()
                .satisfies(alert -> assertThat(alert.occurrenceKey()).isEqualTo("event:e1"));
    }

    @Test
    void lateCompletionDoesNotOverwriteReconciledRun() {
        AtomicReference<SchedulerFixture> holder = new AtomicReference<>();
        SchedulerFixture fixture = SchedulerFixture.create(NOW, Handlers.of("stuck", (config, context) -> {
            SchedulerFixture f = holder.get();
            f.clock.advance(Duration.ofHours(3));
            f.reconciler.reconcile(f.clock.instant());
            return JobOutcome.success();
        }));
        holder.set(fixture);
        CustomJob job = fixture.registry.register(JobDefinition.eventDriven("stuck", "stuck", "push", "*"));

        fixture.runner.run(job, claimPushedEvent(fixture, job, null));

        JobRun stored = fixture.history.findLatestAttempt(job.getId(), "event:e1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(RunStatus.FAILURE);
        assertThat(stored.getErrorSummary()).contains("stale timeout");
        assertThat(fixture.alertSink.ofType(AlertType.STALE_RUNNING)).hasSize(1);
        assertThat(fixture.alertSink.ofType(AlertType.ATTEMPTS_EXHAUSTED)).isEmpty();
    }

    private static TriggerEvent claimPushedEvent(SchedulerFixture fixture, CustomJob job, String payload) {
        return fixture.claims.claim(TriggerOccurrence.pushedEvent(job.getId(), "e1", payload,
                fixture.clock.instant()), SchedulerFixture.INSTANCE_ID);
    }
}
