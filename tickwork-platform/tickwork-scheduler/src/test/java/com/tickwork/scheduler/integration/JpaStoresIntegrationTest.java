package com.tickwork.scheduler.integration;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.JobRun;
import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.scheduler.TickworkSchedulerApplication;
import com.tickwork.scheduler.history.JobHistoryStore;
import com.tickwork.scheduler.poll.ClaimConflictException;
import com.tickwork.scheduler.poll.TriggerClaimStore;
import com.tickwork.scheduler.registry.JobDefinition;
import com.tickwork.scheduler.registry.JobRegistry;
import com.tickwork.scheduler.registry.TriggerDefinition;
import com.tickwork.scheduler.run.NoOpJobHandler;
import com.tickwork.scheduler.trigger.InvalidTriggerSpecException;
import com.tickwork.scheduler.trigger.TriggerOccurrence;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * JPA-backed registry, claim table and history against an in-memory
 * database.
 */
@SpringBootTest(classes = TickworkSchedulerApplication.class)
@ActiveProfiles("test")
class JpaStoresIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    // far enough back that no other test's rows fall before it
    private static final Instant ANCIENT = Instant.parse("1999-06-01T00:00:00Z");

    @Autowired
    private JobRegistry registry;

    @Autowired
    private TriggerClaimStore claimStore;

    @Autowired
    private JobHistoryStore historyStore;

    @Autowired
    private Flyway flyway;

    /**
     * Two replicas claiming the same occurrence at the same moment: exactly
     * one wins, the other sees a claim conflict.
     */
    @Test
    void concurrentClaimSucceedsExactlyOnce() throws Exception {
        CustomJob job = registry.register(JobDefinition.scheduled("race", NoOpJobHandler.KEY, "@hourly", "UTC"));
        ExecutorService replicas = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 20; i++) {
                TriggerOccurrence occurrence =
                        TriggerOccurrence.scheduled(job.getId(), T0.plus(Duration.ofHours(i)), T0);
                CountDownLatch go = new CountDownLatch(1);
                List<Future<Boolean>> results = new ArrayList<>();
                for (String replica : List.of("replica-a", "replica-b")) {
                    results.add(replicas.submit(() -> {
                        go.await();
                        try {
                            claimStore.claim(occurrence, replica);
                            return true;
                        } catch (ClaimConflictException e) {
                            return false;
                        }
                    }));
                }
                go.countDown();

                int wins = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        wins++;
                    }
                }
                assertThat(wins).as("winners for %s", occurrence.occurrenceKey()).isEqualTo(1);
            }
        } finally {
            replicas.shutdownNow();
        }
        assertThat(claimStore.find(job.getId(), T0.toString())).isPresent();
    }

    @Test
    void recordedEventIsClaimedOnce() {
        CustomJob job = registry.register(JobDefinition.eventDriven("hook", NoOpJobHandler.KEY, "push", "*"));
        TriggerOccurrence occurrence = TriggerOccurrence.pushedEvent(job.getId(), "evt-1", "{}", T0);

        assertThat(claimStore.record(occurrence)).isTrue();
        assertThat(claimStore.record(occurrence)).isFalse();

        TriggerEvent pending = claimStore.findUnclaimed(1000).stream()
                .filter(e -> e.getJobId().equals(job.getId()))
                .findFirst()
                .orElseThrow();
        assertThat(claimStore.claimRecorded(pending, "replica-a", T0)).isTrue();
        assertThat(claimStore.claimRecorded(pending, "replica-b", T0)).isFalse();
        assertThat(claimStore.find(job.getId(), "event:evt-1")).hasValueSatisfying(event -> {
            assertThat(event.isClaimed()).isTrue();
            assertThat(event.getClaimedBy()).isEqualTo("replica-a");
        });
    }

    @Test
    void unclaimedEventsOfDisabledJobsAreNotOffered() {
        CustomJob job = registry.register(
                JobDefinition.eventDriven("off", NoOpJobHandler.KEY, "push", "*").disabled());
        claimStore.record(TriggerOccurrence.manual(job.getId(), "k", null, T0));

        assertThat(claimStore.findUnclaimed(1000)).noneMatch(e -> e.getJobId().equals(job.getId()));
    }

    @Test
    void attemptNumbersAreUniquePerOccurrence() {
        UUID jobId = registerJob("attempts");
        historyStore.record(JobRun.start(jobId, "occ", 1, T0, "replica-a"));

        assertThatThrownBy(() -> historyStore.record(JobRun.start(jobId, "occ", 1, T0, "replica-b")))
                .isInstanceOf(ClaimConflictException.class);
        assertThat(historyStore.countAttempts(jobId, "occ")).isEqualTo(1);
    }

    @Test
    void closingARunIsConditional() {
        UUID jobId = registerJob("closing");
        JobRun run = JobRun.start(jobId, "occ", 1, T0, "replica-a");
        historyStore.record(run);
        assertThat(historyStore.countRunning(jobId)).isEqualTo(1);

        run.fail(T0.plusSeconds(5), "boom", T0.plusSeconds(35));
        assertThat(historyStore.update(run)).isTrue();
        assertThat(historyStore.update(run)).isFalse();

        JobRun stored = historyStore.findLatestAttempt(jobId, "occ").orElseThrow();
        assertThat(stored.getErrorSummary()).isEqualTo("boom");
        assertThat(stored.getRetryAt()).isEqualTo(T0.plusSeconds(35));
        assertThat(historyStore.countRunning(jobId)).isZero();
    }

    @Test
    void dueRetriesDisappearOnceTheNextAttemptStarts() {
        UUID jobId = registerJob("retries");
        JobRun first = JobRun.start(jobId, "occ", 1, T0, "replica-a");
        historyStore.record(first);
        first.fail(T0.plusSeconds(1), "boom", T0.plusSeconds(31));
        historyStore.update(first);

        assertThat(historyStore.findRetriesDue(T0.plusSeconds(30), 1000))
                .noneMatch(r -> r.getJobId().equals(jobId));
        assertThat(historyStore.findRetriesDue(T0.plusSeconds(31), 1000))
                .anyMatch(r -> r.getJobId().equals(jobId));

        historyStore.record(JobRun.start(jobId, "occ", 2, T0.plusSeconds(32), "replica-a"));
        assertThat(historyStore.findRetriesDue(T0.plusSeconds(40), 1000))
                .noneMatch(r -> r.getJobId().equals(jobId));
    }

    @Test
    void purgeKeepsRunningRowsAndTheirEvents() {
        CustomJob job = registry.register(JobDefinition.eventDriven("purge", NoOpJobHandler.KEY, "push", "*"));
        for (int i = 0; i < 5; i++) {
            JobRun done = JobRun.start(job.getId(), "event:done-" + i, 1, ANCIENT, "w");
            historyStore.record(done);
            done.succeed(ANCIENT.plusSeconds(i));
            historyStore.update(done);
            claimStore.claim(TriggerOccurrence.pushedEvent(job.getId(), "done-" + i, null, ANCIENT), "w");
        }
        historyStore.record(JobRun.start(job.getId(), "event:stuck", 1, ANCIENT, "w"));
        claimStore.claim(TriggerOccurrence.pushedEvent(job.getId(), "stuck", null, ANCIENT), "w");
        Instant cutoff = ANCIENT.plus(Duration.ofDays(1));

        assertThat(claimStore.purgeClaimedBefore(cutoff, 2)).isEqualTo(5);
        assertThat(historyStore.purgeOlderThan(cutoff, 2)).isEqualTo(5);

        assertThat(historyStore.listRuns(job.getId(), 10)).extracting(JobRun::getOccurrenceKey)
                .containsExactly("event:stuck");
        assertThat(claimStore.find(job.getId(), "event:stuck")).isPresent();
        assertThat(historyStore.countRunningStartedBefore(cutoff)).isGreaterThanOrEqualTo(1);
    }

    /**
     * Claimed work that has not settled survives the purge: an occurrence with
     * no run yet and one whose latest attempt is waiting for a retry.
     */
    @Test
    void purgeKeepsClaimedWorkThatHasNotSettled() {
        CustomJob job = registry.register(JobDefinition.eventDriven("unsettled", NoOpJobHandler.KEY, "push", "*"));
        Instant claimedAt = ANCIENT.plus(Duration.ofDays(10));
        for (String id : List.of("queued", "retry", "exhausted")) {
            claimStore.claim(TriggerOccurrence.pushedEvent(job.getId(), id, null, claimedAt), "w");
        }
        JobRun retry = JobRun.start(job.getId(), "event:retry", 1, claimedAt, "w");
        historyStore.record(retry);
        retry.fail(claimedAt.plusSeconds(1), "boom", claimedAt.plusSeconds(30));
        historyStore.update(retry);
        JobRun exhausted = JobRun.start(job.getId(), "event:exhausted", 1, claimedAt, "w");
        historyStore.record(exhausted);
        exhausted.exhaust(claimedAt.plusSeconds(1), "boom");
        historyStore.update(exhausted);

        claimStore.purgeClaimedBefore(claimedAt.plusSeconds(60), 10);

        assertThat(claimStore.find(job.getId(), "event:queued")).isPresent();
        assertThat(claimStore.find(job.getId(), "event:retry")).isPresent();
        assertThat(claimStore.find(job.getId(), "event:exhausted")).isEmpty();
    }

    @Test
    void scheduleCursorNeverMovesBackwards() {
        CustomJob job = registry.register(JobDefinition.scheduled("cursor", NoOpJobHandler.KEY, "@hourly", "UTC"));
        Instant later = job.getLastEvaluatedAt().truncatedTo(ChronoUnit.SECONDS).plus(Duration.ofHours(2));

        registry.advanceScheduleCursor(job.getId(), later);
        registry.advanceScheduleCursor(job.getId(), later.minus(Duration.ofHours(1)));

        assertThat(registry.getJob(job.getId()).getLastEvaluatedAt()).isEqualTo(later);
    }

    @Test
    void invalidTriggerCannotBeEnabled() {
        CustomJob job = registry.register(
                JobDefinition.scheduled("broken", NoOpJobHandler.KEY, "not a cron", "UTC").disabled());

        assertThatThrownBy(() -> registry.enable(job.getId())).isInstanceOf(InvalidTriggerSpecException.class);
        assertThat(registry.getJob(job.getId()).isEnabled()).isFalse();
        assertThatThrownBy(() -> registry.register(
                JobDefinition.scheduled("broken", NoOpJobHandler.KEY, "0 0 9 * * *", "Nowhere/City")))
                .isInstanceOf(InvalidTriggerSpecException.class);
    }

    @Test
    void rescheduleRestartsTheCursor() {
        CustomJob job = registry.register(JobDefinition.scheduled("moving", NoOpJobHandler.KEY, "@hourly", "UTC"));
        registry.advanceScheduleCursor(job.getId(), Instant.now().plus(Duration.ofDays(3)));

        CustomJob updated = registry.updateTrigger(job.getId(), TriggerDefinition.schedule("@daily", "Europe/Paris"));

        assertThat(updated.getScheduleExpression()).isEqualTo("@daily");
        assertThat(updated.getTimezone()).isEqualTo("Europe/Paris");
        assertThat(registry.getJob(job.getId()).getLastEvaluatedAt()).isBefore(Instant.now().plusSeconds(1));
        assertThatThrownBy(() -> registry.updateTrigger(job.getId(), TriggerDefinition.event("push", "*")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void schemaComesFromTheMigrations() {
        MigrationInfo current = flyway.info().current();

        assertThat(current).isNotNull();
        assertThat(current.getVersion().getVersion()).isEqualTo("1");
        assertThat(current.getState().isApplied()).isTrue();
    }

    private UUID registerJob(String name) {
        // runs reference their job
        return registry.register(JobDefinition.eventDriven(name, NoOpJobHandler.KEY, "push", "*").disabled()).getId();
    }
}
