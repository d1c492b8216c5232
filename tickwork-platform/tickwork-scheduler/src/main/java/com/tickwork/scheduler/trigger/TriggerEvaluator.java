package com.tickwork.scheduler.trigger;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.scheduler.config.CustomJobProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which occurrences of a job's trigger are due at a reference time.
 *
 * Evaluation has no side effects beyond reading an event feed. Persisting
 * the returned cursor is the poller's job, after every occurrence has been
 * claimed.
 */
@Component
public class TriggerEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TriggerEvaluator.class);

    private final TriggerSpecParser parser;
    private final EventFeedRegistry feeds;
    private final int maxCatchUpOccurrences;
    private final int eventBatchSize;

    @Autowired
    public TriggerEvaluator(TriggerSpecParser parser, EventFeedRegistry feeds, CustomJobProperties properties) {
        this(parser, feeds, properties.getMaxCatchUpOccurrences(), properties.getEventBatchSize());
    }

    public TriggerEvaluator(TriggerSpecParser parser, EventFeedRegistry feeds,
                            int maxCatchUpOccurrences, int eventBatchSize) {
        if (maxCatchUpOccurrences < 1) {
            throw new IllegalArgumentException("Catch-up limit must be at least 1");
        }
        if (eventBatchSize < 1) {
            throw new IllegalArgumentException("Event batch size must be at least 1");
        }
        this.parser = parser;
        this.feeds = feeds;
        this.maxCatchUpOccurrences = maxCatchUpOccurrences;
        this.eventBatchSize = eventBatchSize;
    }

    /**
     * Evaluates a job.
     *
     * @throws InvalidTriggerSpecException if the trigger cannot be parsed or its feed is unknown
     */
    public Evaluation evaluate(CustomJob job, Instant reference) {
        TriggerSpec spec = parser.parse(job);
        if (spec instanceof ScheduleTrigger schedule) {
            return evaluateSchedule(job, schedule, reference);
        }
        return evaluateEvents(job, (EventTrigger) spec, reference);
    }

    private Evaluation evaluateSchedule(CustomJob job, ScheduleTrigger schedule, Instant reference) {
        Instant cursor = job.scheduleCursor();
        // one extra to detect truncation
        List<Instant> fireTimes = schedule.occurrencesBetween(cursor, reference, maxCatchUpOccurrences + 1);
        boolean truncated = fireTimes.size() > maxCatchUpOccurrences;
        if (truncated) {
            fireTimes = fireTimes.subList(0, maxCatchUpOccurrences);
        }
        List<TriggerOccurrence> occurrences = new ArrayList<>(fireTimes.size());
        for (Instant fireTime : fireTimes) {
            occurrences.add(TriggerOccurrence.scheduled(job.getId(), fireTime, reference));
        }
        Instant evaluatedThrough = truncated ? fireTimes.get(fireTimes.size() - 1) : laterOf(cursor, reference);
        return new Evaluation(occurrences, evaluatedThrough, null, truncated);
    }

    private Evaluation evaluateEvents(CustomJob job, EventTrigger trigger, Instant reference) {
        EventFeed feed = feeds.find(trigger.source())
                .orElseThrow(() -> new InvalidTriggerSpecException(
                        "No event feed registered for source '" + trigger.source() + "'"));
        EventBatch batch = feed.fetch(job.getEventCursor(), eventBatchSize);
        List<TriggerOccurrence> occurrences = new ArrayList<>();
        for (ExternalEvent event : batch.events()) {
            if (!trigger.matches(event.eventType())) {
                continue;
            }
            try {
                occurrences.add(TriggerOccurrence.event(job.getId(), event, reference));
            } catch (IllegalArgumentException e) {
                // cannot be stored; skipping keeps it from blocking the feed
                log.warn("Skipping event from '{}' for job {}: {}", trigger.source(), job.getId(), e.getMessage());
            }
        }
        String nextCursor = batch.nextCursor() != null ? batch.nextCursor() : job.getEventCursor();
        return new Evaluation(occurrences, reference, nextCursor, false);
    }

    private static Instant laterOf(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
