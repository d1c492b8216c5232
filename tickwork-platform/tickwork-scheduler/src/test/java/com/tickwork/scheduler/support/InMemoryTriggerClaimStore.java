package com.tickwork.scheduler.support;

import com.tickwork.core.domain.TriggerEvent;
import com.tickwork.core.repository.StorageUnavailableException;
import com.tickwork.scheduler.poll.ClaimConflictException;
import com.tickwork.scheduler.poll.TriggerClaimStore;
import com.tickwork.scheduler.trigger.TriggerOccurrence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Claim table kept in a map keyed by (job id, occurrence key).
 */
public class InMemoryTriggerClaimStore implements TriggerClaimStore {

    private final Map<String, TriggerEvent> events = new LinkedHashMap<>();
    private final InMemoryJobHistoryStore history;
    private Predicate<TriggerOccurrence> failingClaims = occurrence -> false;

    public InMemoryTriggerClaimStore(InMemoryJobHistoryStore history) {
        this.history = history;
    }

    /**
     * Claims of matching occurrences fail as if the store were down.
     */
    public synchronized void failClaimsMatching(Predicate<TriggerOccurrence> predicate) {
        this.failingClaims = predicate;
    }

    public synchronized List<TriggerEvent> all() {
        return events.values().stream().map(Copies::of).collect(Collectors.toList());
    }

    public synchronized List<String> keysOf(UUID jobId) {
        return events.values().stream()
                .filter(e -> e.getJobId().equals(jobId))
                .map(TriggerEvent::getOccurrenceKey)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized TriggerEvent claim(TriggerOccurrence occurrence, String claimedBy) {
        if (failingClaims.test(occurrence)) {
            throw new StorageUnavailableException("claim store down", null);
        }
        String key = key(occurrence.jobId(), occurrence.occurrenceKey());
        if (events.containsKey(key)) {
            throw new ClaimConflictException(occurrence.jobId(), occurrence.occurrenceKey(), "already claimed");
        }
        TriggerEvent event = TriggerEvent.claimed(occurrence.jobId(), occurrence.occurrenceKey(),
                occurrence.source(), occurrence.scheduledFor(), occurrence.detectedAt(),
                occurrence.payloadJson(), claimedBy);
        events.put(key, event);
        return Copies.of(event);
    }

    @Override
    public synchronized boolean record(TriggerOccurrence occurrence) {
        String key = key(occurrence.jobId(), occurrence.occurrenceKey());
        if (events.containsKey(key)) {
            return false;
        }
        events.put(key, TriggerEvent.unclaimed(occurrence.jobId(), occurrence.occurrenceKey(),
                occurrence.source(), occurrence.detectedAt(), occurrence.payloadJson()));
        return true;
    }

    @Override
    public synchronized boolean claimRecorded(TriggerEvent event, String claimedBy, Instant claimedAt) {
        TriggerEvent stored = events.get(key(event.getJobId(), event.getOccurrenceKey()));
        if (stored == null || stored.isClaimed()) {
            return false;
        }
        stored.markClaimed(claimedBy, claimedAt);
        return true;
    }

    @Override
    public synchronized List<TriggerEvent> findUnclaimed(int limit) {
        return events.values().stream()
                .filter(e -> !e.isClaimed())
                .sorted(Comparator.comparing(TriggerEvent::getDetectedAt))
                .limit(limit)
                .map(Copies::of)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<TriggerEvent> find(UUID jobId, String occurrenceKey) {
        return Optional.ofNullable(events.get(key(jobId, occurrenceKey))).map(Copies::of);
    }

    @Override
    public synchronized Optional<TriggerEvent> findLatest(UUID jobId) {
        return events.values().stream()
                .filter(e -> e.getJobId().equals(jobId))
                .max(Comparator.comparing(TriggerEvent::getDetectedAt))
                .map(Copies::of);
    }

    @Override
    public synchronized List<TriggerEvent> findClaimedWithoutRun(Instant claimedBefore, int limit) {
        return events.values().stream()
                .filter(e -> e.isClaimed() && e.getClaimedAt().isBefore(claimedBefore))
                .filter(e -> !history.hasAnyRun(e.getJobId(), e.getOccurrenceKey()))
                .limit(limit)
                .map(Copies::of)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int purgeClaimedBefore(Instant cutoff, int batchSize) {
        List<String> doomed = new ArrayList<>();
        for (Map.Entry<String, TriggerEvent> entry : events.entrySet()) {
            TriggerEvent e = entry.getValue();
            if (e.isClaimed() && e.getClaimedAt().isBefore(cutoff)
                    && history.isSettled(e.getJobId(), e.getOccurrenceKey())) {
                doomed.add(entry.getKey());
            }
        }
        doomed.forEach(events::remove);
        return doomed.size();
    }

    private static String key(UUID jobId, String occurrenceKey) {
        return jobId + "|" + occurrenceKey;
    }
}
