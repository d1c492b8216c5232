package com.tickwork.scheduler.run;

import java.util.Map;

/**
 * A unit of work a custom job can run. Spring beans implementing this
 * interface are picked up by {@link JobHandlerRegistry} at startup.
 */
public interface JobHandler {

    /**
     * Stable key that jobs reference in their handler column.
     */
    String key();

    /**
     * Runs one attempt.
     *
     * Throwing marks the attempt failed. {@link NonRetryableJobException}
     * fails the occurrence for good; anything else is retried while attempts
     * remain. Handlers should honour thread interruption and the context
     * deadline.
     *
     * @param config Job configuration
     * @param context What triggered this attempt
     * @return Outcome, {@link JobOutcome#success()} in the common case
     */
    JobOutcome invoke(Map<String, Object> config, TriggerContext context) throws Exception;
}
