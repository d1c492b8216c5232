package com.tickwork.scheduler.trigger;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron schedule evaluated in a fixed time zone.
 *
 * Fire times falling into a DST gap or overlap are resolved by
 * {@link CronExpression} on the zoned calendar.
 */
public record ScheduleTrigger(String expression, CronExpression cron, ZoneId zone) implements TriggerSpec {

    /**
     * Fire times in {@code (after, upTo]}, ascending, at most {@code limit} of them.
     */
    public List<Instant> occurrencesBetween(Instant after, Instant upTo, int limit) {
        List<Instant> occurrences = new ArrayList<>();
        if (!upTo.isAfter(after)) {
            return occurrences;
        }
        ZonedDateTime cursor = after.atZone(zone);
        while (occurrences.size() < limit) {
            ZonedDateTime next = cron.next(cursor);
            if (next == null || next.toInstant().isAfter(upTo)) {
                break;
            }
            occurrences.add(next.toInstant());
            cursor = next;
        }
        return occurrences;
    }

    /**
     * First fire time strictly after {@code after}, or null if the expression
     * never fires again.
     */
    public Instant nextAfter(Instant after) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public String describe() {
        return "cron[" + expression + " @ " + zone.getId() + "]";
    }
}
