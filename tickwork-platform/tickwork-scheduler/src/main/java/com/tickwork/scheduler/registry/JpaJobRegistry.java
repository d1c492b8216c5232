package com.tickwork.scheduler.registry;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.CustomJob.TriggerType;
import com.tickwork.core.repository.CustomJobRepository;
import com.tickwork.core.repository.StorageUnavailableException;
import com.tickwork.scheduler.trigger.TriggerSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Job registry backed by the {@code custom_job} table.
 */
@Service
public class JpaJobRegistry implements JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JpaJobRegistry.class);

    private final CustomJobRepository jobRepository;
    private final TriggerSpecParser parser;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaJobRegistry(CustomJobRepository jobRepository,
                          TriggerSpecParser parser,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.jobRepository = jobRepository;
        this.parser = parser;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public List<CustomJob> listEnabledJobs() {
        return call("list enabled jobs", jobRepository::findByEnabledTrueOrderByCreatedAtAsc);
    }

    @Override
    public List<CustomJob> listEnabledJobs(TriggerType triggerType) {
        return call("list enabled jobs",
                () -> jobRepository.findByEnabledTrueAndTriggerTypeOrderByCreatedAtAsc(triggerType));
    }

    @Override
    public CustomJob getJob(UUID jobId) {
        return call("load job", () -> jobRepository.findById(jobId))
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public CustomJob register(JobDefinition definition) {
        Instant now = clock.instant();
        CustomJob job = definition.toJob(now);
        if (definition.enabled()) {
            parser.parse(job);
            job.enable(now);
        }
        CustomJob saved = inTransaction("register job", () -> jobRepository.save(job));
        log.info("Registered custom job {} ({}) handler={} enabled={}",
                saved.getId(), saved.getName(), saved.getHandlerKey(), saved.isEnabled());
        return saved;
    }

    @Override
    public CustomJob enable(UUID jobId) {
        CustomJob job = inTransaction("enable job", () -> {
            CustomJob current = load(jobId);
            parser.parse(current);
            current.enable(clock.instant());
            return jobRepository.save(current);
        });
        log.info("Enabled custom job {}", jobId);
        return job;
    }

    @Override
    public CustomJob disable(UUID jobId) {
        CustomJob job = inTransaction("disable job", () -> {
            CustomJob current = load(jobId);
            current.disable(clock.instant());
            return jobRepository.save(current);
        });
        log.info("Disabled custom job {}", jobId);
        return job;
    }

    @Override
    public CustomJob updateTrigger(UUID jobId, TriggerDefinition trigger) {
        return inTransaction("update job trigger", () -> {
            CustomJob current = load(jobId);
            trigger.applyTo(current, clock.instant());
            if (current.isEnabled()) {
                parser.parse(current);
            }
            return jobRepository.save(current);
        });
    }

    @Override
    public void advanceScheduleCursor(UUID jobId, Instant evaluatedThrough) {
        inTransaction("advance schedule cursor",
                () -> jobRepository.advanceScheduleCursor(jobId, evaluatedThrough));
    }

    @Override
    public void advanceEventCursor(UUID jobId, String cursor, Instant evaluatedAt) {
        inTransaction("advance event cursor",
                () -> jobRepository.advanceEventCursor(jobId, cursor, evaluatedAt));
    }

    @Override
    public void markTriggered(UUID jobId, Instant triggeredAt) {
        inTransaction("mark job triggered", () -> jobRepository.markTriggered(jobId, triggeredAt));
    }

    private CustomJob load(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        return call(operation, () -> transactionTemplate.execute(status -> work.get()));
    }

    private <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Job store unavailable during " + operation, e);
        }
    }
}
