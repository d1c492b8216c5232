package com.tickwork.scheduler.poll;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.core.domain.TriggerEvent;

/**
 * An occurrence this instance owns and must hand to the worker pool.
 */
public record ClaimedTrigger(CustomJob job, TriggerEvent event) {

    public String occurrenceKey() {
        return event.getOccurrenceKey();
    }
}
