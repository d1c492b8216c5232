package com.tickwork.scheduler.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Built-in handler that does nothing. Useful for wiring checks and tests.
 */
@Component
public class NoOpJobHandler implements JobHandler {

    public static final String KEY = "noop";

    private static final Logger log = LoggerFactory.getLogger(NoOpJobHandler.class);

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public JobOutcome invoke(Map<String, Object> config, TriggerContext context) {
        log.debug("No-op run of job {} for {}", context.jobId(), context.occurrenceKey());
        return JobOutcome.success();
    }
}
