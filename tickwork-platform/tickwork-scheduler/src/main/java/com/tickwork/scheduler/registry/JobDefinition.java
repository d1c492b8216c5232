package com.tickwork.scheduler.registry;

import com.tickwork.core.domain.CustomJob;

import java.time.Instant;

/**
 * Everything needed to register a job.
 *
 * @param name Display name
 * @param handlerKey Handler registry key
 * @param trigger Trigger specification
 * @param configJson Handler configuration, a JSON object; null means {@code {}}
 * @param maxAttempts Attempt ceiling override, null for the configured default
 * @param maxConcurrentRuns Concurrency cap for recorded events, null for unlimited
 * @param enabled Whether to enable the job right away
 */
public record JobDefinition(String name, String handlerKey, TriggerDefinition trigger, String configJson,
                            Integer maxAttempts, Integer maxConcurrentRuns, boolean enabled) {

    public static JobDefinition scheduled(String name, String handlerKey, String expression, String timezone) {
        return new JobDefinition(name, handlerKey, TriggerDefinition.schedule(expression, timezone),
                null, null, null, true);
    }

    public static JobDefinition eventDriven(String name, String handlerKey, String source, String pattern) {
        return new JobDefinition(name, handlerKey, TriggerDefinition.event(source, pattern),
                null, null, null, true);
    }

    public JobDefinition withConfig(String json) {
        return new JobDefinition(name, handlerKey, trigger, json, maxAttempts, maxConcurrentRuns, enabled);
    }

    public JobDefinition withLimits(Integer attempts, Integer concurrentRuns) {
        return new JobDefinition(name, handlerKey, trigger, configJson, attempts, concurrentRuns, enabled);
    }

    public JobDefinition disabled() {
        return new JobDefinition(name, handlerKey, trigger, configJson, maxAttempts, maxConcurrentRuns, false);
    }

    /**
     * Builds the disabled entity for this definition.
     */
    public CustomJob toJob(Instant createdAt) {
        if (trigger == null) {
            throw new IllegalArgumentException("Trigger cannot be null");
        }
        CustomJob job = switch (trigger.type()) {
            case SCHEDULE -> CustomJob.scheduled(name, handlerKey, trigger.scheduleExpression(),
                    trigger.timezone(), configJson, createdAt);
            case EVENT -> CustomJob.eventDriven(name, handlerKey, trigger.eventSource(),
                    trigger.eventPattern(), configJson, createdAt);
        };
        job.setLimits(maxAttempts, maxConcurrentRuns);
        return job;
    }
}
