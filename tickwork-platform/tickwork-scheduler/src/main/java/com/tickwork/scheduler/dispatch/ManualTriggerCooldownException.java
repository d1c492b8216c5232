package com.tickwork.scheduler.dispatch;

import java.time.Duration;
import java.util.UUID;

/**
 * Thrown when a manual run is requested too soon after the job last triggered.
 */
public class ManualTriggerCooldownException extends RuntimeException {

    private final UUID jobId;
    private final Duration cooldown;

    public ManualTriggerCooldownException(UUID jobId, Duration cooldown) {
        super("Manual trigger cooldown active for job " + jobId + " (" + cooldown.toSeconds() + "s). Try again later.");
        this.jobId = jobId;
        this.cooldown = cooldown;
    }

    public UUID getJobId() { return jobId; }
    public Duration getCooldown() { return cooldown; }
}
