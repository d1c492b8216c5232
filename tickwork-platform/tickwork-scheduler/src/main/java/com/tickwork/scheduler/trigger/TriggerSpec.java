package com.tickwork.scheduler.trigger;

/**
 * Parsed trigger specification of a job.
 */
public interface TriggerSpec {

    /**
     * Canonical text form, used in log lines.
     */
    String describe();
}
