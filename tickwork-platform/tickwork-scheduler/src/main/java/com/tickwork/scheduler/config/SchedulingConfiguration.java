package com.tickwork.scheduler.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the scheduler ticks. Disabled with
 * {@code tickwork.jobs.scheduling-enabled=false}, for example in tests that
 * drive the dispatcher directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "tickwork.jobs", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfiguration {
}
