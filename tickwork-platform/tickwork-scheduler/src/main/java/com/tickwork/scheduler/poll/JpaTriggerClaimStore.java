package com.tickwork.scheduler.poll;

import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.core.repository.StorageUnavailableException;
import com.tickwork.core.repository.TriggerEventRepository;
import com.tickwork.scheduler.trigger.TriggerOccurrence;
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
 * Claim table backed by {@code custom_job_trigger_event}. The unique
 * constraint on (job_id, occurrence_key) decides every race.
 */
@Service
public class JpaTriggerClaimStore implements TriggerClaimStore {

    private final TriggerEventRepository eventRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaTriggerClaimStore(TriggerEventRepository eventRepository, PlatformTransactionManager transactionManager) {
        this.eventRepository = eventRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public TriggerEvent claim(TriggerOccurrence occurrence, String claimedBy) {
        TriggerEvent event = TriggerEvent.claimed(occurrence.jobId(), occurrence.occurrenceKey(),
                occurrence.source(), occurrence.scheduledFor(), occurrence.detectedAt(),
                occurrence.payloadJson(), claimedBy);
        try {
            return transactionTemplate.execute(status -> eventRepository.saveAndFlush(event));
        } catch (DataIntegrityViolationException e) {
            throw new ClaimConflictException(occurrence.jobId(), occurrence.occurrenceKey(),
                    "Occurrence " + occurrence.occurrenceKey() + " is already claimed", e);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Claim store unavailable during claim", e);
        }
    }

    @Override
    public boolean record(TriggerOccurrence occurrence) {
        TriggerEvent event = TriggerEvent.unclaimed(occurrence.jobId(), occurrence.occurrenceKey(),
                occurrence.source(), occurrence.detectedAt(), occurrence.payloadJson());
        try {
            transactionTemplate.execute(status -> eventRepository.saveAndFlush(event));
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Claim store unavailable during record", e);
        }
    }

    @Override
    public boolean claimRecorded(TriggerEvent event, String claimedBy, Instant claimedAt) {
        int updated = inTransaction("claim recorded event",
                () -> eventRepository.claimRecorded(event.getId(), claimedBy, claimedAt));
        return updated == 1;
    }

    @Override
    public List<TriggerEvent> findUnclaimed(int limit) {
        return call("find unclaimed events", () -> eventRepository.findUnclaimed(PageRequest.of(0, limit)));
    }

    @Override
    public Optional<TriggerEvent> find(UUID jobId, String occurrenceKey) {
        return call("find event", () -> eventRepository.findByJobIdAndOccurrenceKey(jobId, occurrenceKey));
    }

    @Override
    public Optional<TriggerEvent> findLatest(UUID jobId) {
        return call("find latest event", () -> eventRepository.findTopByJobIdOrderByDetectedAtDesc(jobId));
    }

    @Override
    public List<TriggerEvent> findClaimedWithoutRun(Instant claimedBefore, int limit) {
        return call("find orphaned claims",
                () -> eventRepository.findClaimedWithoutRun(claimedBefore, PageRequest.of(0, limit)));
    }

    @Override
    public int purgeClaimedBefore(Instant cutoff, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        int deleted = 0;
        while (true) {
            int batch = inTransaction("purge events", () -> {
                List<UUID> ids = eventRepository.findPurgeableIds(cutoff, PageRequest.of(0, batchSize));
                if (!ids.isEmpty()) {
                    eventRepository.deleteAllByIdInBatch(ids);
                }
                return ids.size();
            });
            deleted += batch;
            if (batch < batchSize) {
                return deleted;
            }
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        return call(operation, () -> transactionTemplate.execute(status -> work.get()));
    }

    private <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Claim store unavailable during " + operation, e);
        }
    }
}
