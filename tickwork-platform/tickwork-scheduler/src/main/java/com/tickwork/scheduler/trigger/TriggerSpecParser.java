package com.tickwork.scheduler.trigger;

import com.tickwork.core.domain.CustomJob;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Parses the trigger columns of a job into a {@link TriggerSpec}.
 *
 * Schedule expressions use Spring's cron syntax: six fields
 * (second minute hour day-of-month month day-of-week) or one of the macros
 * {@code @yearly}, {@code @monthly}, {@code @weekly}, {@code @daily},
 * {@code @hourly}.
 */
@Component
public class TriggerSpecParser {

    public TriggerSpec parse(CustomJob job) {
        if (job.getTriggerType() == null) {
            throw new InvalidTriggerSpecException("Job " + job.getId() + " has no trigger type");
        }
        return switch (job.getTriggerType()) {
            case SCHEDULE -> parseSchedule(job.getScheduleExpression(), job.getTimezone());
            case EVENT -> parseEvent(job.getEventSource(), job.getEventPattern());
        };
    }

    public ScheduleTrigger parseSchedule(String expression, String timezone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidTriggerSpecException("Schedule expression is required");
        }
        CronExpression cron;
        try {
            cron = CronExpression.parse(expression.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidTriggerSpecException("Invalid schedule expression '" + expression + "': "
                    + e.getMessage(), e);
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidTriggerSpecException("Invalid time zone '" + timezone + "'", e);
        }
        return new ScheduleTrigger(expression.trim(), cron, zone);
    }

    public EventTrigger parseEvent(String source, String glob) {
        if (source == null || source.isBlank()) {
            throw new InvalidTriggerSpecException("Event source is required");
        }
        String effectiveGlob = glob == null || glob.isBlank() ? "*" : glob.trim();
        return new EventTrigger(source.trim(), effectiveGlob, EventTrigger.compileGlob(effectiveGlob));
    }
}
