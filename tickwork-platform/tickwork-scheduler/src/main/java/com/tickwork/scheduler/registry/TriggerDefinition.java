package com.tickwork.scheduler.registry;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.CustomJob.TriggerType;

import java.time.Instant;

/**
 * Trigger columns of a job as supplied by administrative configuration.
 */
public record TriggerDefinition(TriggerType type, String scheduleExpression, String timezone,
                                String eventSource, String eventPattern) {

    public TriggerDefinition {
        if (type == null) {
            throw new IllegalArgumentException("Trigger type cannot be null");
        }
    }

    public static TriggerDefinition schedule(String expression, String timezone) {
        return new TriggerDefinition(TriggerType.SCHEDULE, expression, timezone, null, null);
    }

    public static TriggerDefinition event(String source, String pattern) {
        return new TriggerDefinition(TriggerType.EVENT, null, null, source, pattern);
    }

    /**
     * Writes this trigger onto a job of the same trigger type.
     */
    public void applyTo(CustomJob job, Instant now) {
        if (type != job.getTriggerType()) {
            throw new IllegalArgumentException("Job " + job.getId() + " is " + job.getTriggerType()
                    + "-triggered, cannot switch to " + type);
        }
        if (type == TriggerType.SCHEDULE) {
            job.reschedule(scheduleExpression, timezone, now);
        } else {
            job.retarget(eventSource, eventPattern, now);
        }
    }
}
