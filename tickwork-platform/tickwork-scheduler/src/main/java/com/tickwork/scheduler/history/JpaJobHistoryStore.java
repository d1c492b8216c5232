package com.tickwork.scheduler.history;

import com.tickwork.core.domain.JobRun;
import com.tickwork.core.domain.JobRun.RunStatus;
import com.tickwork.core.repository.JobRunRepository;
import com.tickwork.core.repository.StorageUnavailableException;
import com.tickwork.scheduler.poll.ClaimConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Job history backed by the {@code custom_job_run} table. Every write runs in
 * its own transaction so that a failing handler never rolls back the record
 * of its own attempt.
 */
@Service
public class JpaJobHistoryStore implements JobHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobHistoryStore.class);

    private final JobRunRepository runRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaJobHistoryStore(JobRunRepository runRepository, PlatformTransactionManager transactionManager) {
        this.runRepository = runRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public JobRun record(JobRun run) {
        try {
            return transactionTemplate.execute(status -> runRepository.saveAndFlush(run));
        } catch (DataIntegrityViolationException e) {
            throw new ClaimConflictException(run.getJobId(), run.getOccurrenceKey(),
                    "Attempt " + run.getAttemptNumber() + " of " + run.getOccurrenceKey() + " already exists", e);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("History store unavailable during record run", e);
        }
    }

    @Override
    public boolean update(JobRun run) {
        if (run.isRunning()) {
            throw new IllegalArgumentException("Run " + run.getId() + " has not finished");
        }
        int updated = inTransaction("update run", () -> runRepository.finishRunning(
                run.getId(), run.getStatus(), run.getFinishedAt(), run.getErrorSummary(),
                run.getRetryAt(), run.isAttemptsExhausted()));
        return updated == 1;
    }

    @Override
    public int countAttempts(UUID jobId, String occurrenceKey) {
        return Math.toIntExact(
                call("count attempts", () -> runRepository.countByJobIdAndOccurrenceKey(jobId, occurrenceKey)));
    }

    @Override
    public Optional<JobRun> findLatestAttempt(UUID jobId, String occurrenceKey) {
        return call("find latest attempt",
                () -> runRepository.findTopByJobIdAndOccurrenceKeyOrderByAttemptNumberDesc(jobId, occurrenceKey));
    }

    @Override
    public List<JobRun> listAttempts(UUID jobId, String occurrenceKey) {
        return call("list attempts",
                () -> runRepository.findByJobIdAndOccurrenceKeyOrderByAttemptNumberAsc(jobId, occurrenceKey));
    }

    @Override
    public List<JobRun> listRuns(UUID jobId, int limit) {
        return call("list runs", () -> runRepository.findByJobIdOrderByStartedAtDesc(jobId, PageRequest.of(0, limit)));
    }

    @Override
    public long countRunning(UUID jobId) {
        return call("count running", () -> runRepository.countByJobIdAndStatus(jobId, RunStatus.RUNNING));
    }

    @Override
    public List<JobRun> findRunningStartedBefore(Instant cutoff) {
        return call("find stale runs", () -> runRepository.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff));
    }

    @Override
    public long countRunningStartedBefore(Instant cutoff) {
        return call("count stale runs",
                () -> runRepository.countByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff));
    }

    @Override
    public List<JobRun> findRetriesDue(Instant now, int limit) {
        return call("find due retries", () -> runRepository.findRetriesDue(now, PageRequest.of(0, limit)));
    }

    @Override
    public int purgeOlderThan(Instant cutoff, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        int deleted = 0;
        while (true) {
            int batch = inTransaction("purge runs", () -> {
                List<UUID> ids = runRepository.findPurgeableIds(cutoff, PageRequest.of(0, batchSize));
                if (!ids.isEmpty()) {
                    runRepository.deleteAllByIdInBatch(ids);
                }
                return ids.size();
            });
            deleted += batch;
            if (batch < batchSize) {
                break;
            }
        }
        if (deleted > 0) {
            log.debug("Purged {} job runs finished before {}", deleted, cutoff);
        }
        return deleted;
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        return call(operation, () -> transactionTemplate.execute(status -> work.get()));
    }

    private <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("History store unavailable during " + operation, e);
        }
    }
}
