package com.tickwork.core.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Custom Job - definitional metadata for one schedulable unit of work.
 *
 * The handler key is an opaque reference resolved by the scheduler's handler
 * registry. Trigger specification is either a schedule expression evaluated in
 * a time zone, or an event source plus an event-type pattern.
 *
 * The id never changes once created. Cursor columns are owned by the poller;
 * everything else is administrative.
 */
@Entity
@Table(name = "custom_job", indexes = {
    @Index(name = "idx_custom_job_enabled_trigger", columnList = "enabled, trigger_type")
})
public class CustomJob {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "handler_key", nullable = false, length = 128)
    private String handlerKey;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 32)
    private TriggerType triggerType;

    @Column(name = "schedule_expression", length = 128)
    private String scheduleExpression;

    @Column(name = "timezone", length = 64)
    private String timezone;

    @Column(name = "event_source", length = 128)
    private String eventSource;

    @Column(name = "event_pattern", length = 255)
    private String eventPattern;

    /**
     * JSON object handed to the handler on every invocation.
     */
    @Column(name = "config_json", nullable = false, columnDefinition = "TEXT")
    private String configJson;

    @Column(name = "max_attempts")
    private Integer maxAttempts;

    @Column(name = "max_concurrent_runs")
    private Integer maxConcurrentRuns;

    @Column(name = "last_evaluated_at")
    private Instant lastEvaluatedAt;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "event_cursor", length = 512)
    private String eventCursor;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum TriggerType {
        SCHEDULE, // Cron expression in a time zone
        EVENT     // Events from an external feed matching a pattern
    }

    protected CustomJob() {}

    /**
     * Creates a schedule-triggered job. The job starts disabled.
     *
     * @param name Display name
     * @param handlerKey Handler registry key
     * @param scheduleExpression Cron expression
     * @param timezone IANA zone the expression is evaluated in
     * @param configJson Handler configuration as a JSON object
     * @param createdAt Creation time, also the initial schedule cursor
     */
    public static CustomJob scheduled(String name, String handlerKey, String scheduleExpression,
                                      String timezone, String configJson, Instant createdAt) {
        if (scheduleExpression == null || scheduleExpression.isBlank()) {
            throw new IllegalArgumentException("Schedule expression cannot be null or blank");
        }
        CustomJob job = base(name, handlerKey, configJson, createdAt);
        job.triggerType = TriggerType.SCHEDULE;
        job.scheduleExpression = scheduleExpression.trim();
        job.timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        return job;
    }

    /**
     * Creates an event-triggered job. The job starts disabled.
     *
     * @param name Display name
     * @param handlerKey Handler registry key
     * @param eventSource Source type of the feed to poll
     * @param eventPattern Glob matched against event types
     * @param configJson Handler configuration as a JSON object
     * @param createdAt Creation time
     */
    public static CustomJob eventDriven(String name, String handlerKey, String eventSource,
                                        String eventPattern, String configJson, Instant createdAt) {
        if (eventSource == null || eventSource.isBlank()) {
            throw new IllegalArgumentException("Event source cannot be null or blank");
        }
        CustomJob job = base(name, handlerKey, configJson, createdAt);
        job.triggerType = TriggerType.EVENT;
        job.eventSource = eventSource.trim();
        job.eventPattern = eventPattern == null || eventPattern.isBlank() ? "*" : eventPattern.trim();
        return job;
    }

    private static CustomJob base(String name, String handlerKey, String configJson, Instant createdAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name cannot be null or blank");
        }
        if (handlerKey == null || handlerKey.isBlank()) {
            throw new IllegalArgumentException("Handler key cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        CustomJob job = new CustomJob();
        job.id = UUID.randomUUID();
        job.name = name.trim();
        job.handlerKey = handlerKey.trim();
        job.configJson = configJson == null || configJson.isBlank() ? "{}" : configJson;
        job.enabled = false;
        job.createdAt = createdAt;
        job.updatedAt = createdAt;
        return job;
    }

    /**
     * Enables the job. Callers validate the trigger specification first.
     * Occurrences missed while the job was disabled are not replayed: the
     * schedule cursor restarts at {@code now}.
     */
    public void enable(Instant now) {
        if (!enabled) {
            this.lastEvaluatedAt = now;
        }
        this.enabled = true;
        this.updatedAt = now;
    }

    public void disable(Instant now) {
        this.enabled = false;
        this.updatedAt = now;
    }

    /**
     * Replaces the schedule of a schedule-triggered job. The new schedule is
     * evaluated from {@code now} on.
     */
    public void reschedule(String scheduleExpression, String timezone, Instant now) {
        if (triggerType != TriggerType.SCHEDULE) {
            throw new IllegalStateException("Job " + id + " is not schedule-triggered");
        }
        if (scheduleExpression == null || scheduleExpression.isBlank()) {
            throw new IllegalArgumentException("Schedule expression cannot be null or blank");
        }
        this.scheduleExpression = scheduleExpression.trim();
        this.timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        this.lastEvaluatedAt = now;
        this.updatedAt = now;
    }

    /**
     * Replaces the event pattern of an event-triggered job.
     */
    public void retarget(String eventSource, String eventPattern, Instant now) {
        if (triggerType != TriggerType.EVENT) {
            throw new IllegalStateException("Job " + id + " is not event-triggered");
        }
        if (eventSource == null || eventSource.isBlank()) {
            throw new IllegalArgumentException("Event source cannot be null or blank");
        }
        if (!eventSource.trim().equals(this.eventSource)) {
            // cursor belongs to the old feed
            this.eventCursor = null;
        }
        this.eventSource = eventSource.trim();
        this.eventPattern = eventPattern == null || eventPattern.isBlank() ? "*" : eventPattern.trim();
        this.updatedAt = now;
    }

    public void setLimits(Integer maxAttempts, Integer maxConcurrentRuns) {
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (maxConcurrentRuns != null && maxConcurrentRuns < 1) {
            throw new IllegalArgumentException("Max concurrent runs must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.maxConcurrentRuns = maxConcurrentRuns;
    }

    /**
     * Moves the schedule cursor forward. Never moves it backwards.
     */
    public void advanceScheduleCursor(Instant evaluatedThrough) {
        if (lastEvaluatedAt == null || evaluatedThrough.isAfter(lastEvaluatedAt)) {
            this.lastEvaluatedAt = evaluatedThrough;
        }
    }

    public void advanceEventCursor(String cursor, Instant evaluatedAt) {
        this.eventCursor = cursor;
        advanceScheduleCursor(evaluatedAt);
    }

    public void markTriggered(Instant triggeredAt) {
        if (lastTriggeredAt == null || triggeredAt.isAfter(lastTriggeredAt)) {
            this.lastTriggeredAt = triggeredAt;
        }
    }

    /**
     * Lower bound for the next schedule evaluation (exclusive).
     */
    public Instant scheduleCursor() {
        return lastEvaluatedAt != null ? lastEvaluatedAt : createdAt;
    }

    public boolean isScheduled() {
        return triggerType == TriggerType.SCHEDULE;
    }

    // Getters
    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getHandlerKey() { return handlerKey; }
    public boolean isEnabled() { return enabled; }
    public TriggerType getTriggerType() { return triggerType; }
    public String getScheduleExpression() { return scheduleExpression; }
    public String getTimezone() { return timezone; }
    public String getEventSource() { return eventSource; }
    public String getEventPattern() { return eventPattern; }
    public String getConfigJson() { return configJson; }
    public Integer getMaxAttempts() { return maxAttempts; }
    public Integer getMaxConcurrentRuns() { return maxConcurrentRuns; }
    public Instant getLastEvaluatedAt() { return lastEvaluatedAt; }
    public Instant getLastTriggeredAt() { return lastTriggeredAt; }
    public String getEventCursor() { return eventCursor; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
