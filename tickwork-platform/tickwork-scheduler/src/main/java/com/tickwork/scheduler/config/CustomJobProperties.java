package com.tickwork.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.UUID;

/**
 * Configuration for the custom job scheduler.
 */
@Configuration
@ConfigurationProperties(prefix = "tickwork.jobs")
public class CustomJobProperties {

    private boolean enabled = true;
    private boolean schedulingEnabled = true;
    private String instanceId;
    private int claimLimit = 50;
    private int maxCatchUpOccurrences = 100;
    private int eventBatchSize = 100;
    private Duration runTimeout = Duration.ofHours(1);
    private Duration staleRunTimeout = Duration.ofHours(2);
    private Duration manualTriggerCooldown = Duration.ofSeconds(60);
    private Duration orphanClaimGrace = Duration.ofMinutes(10);
    private final Retry retry = new Retry();
    private final Retention retention = new Retention();
    private final Worker worker = new Worker();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isSchedulingEnabled() { return schedulingEnabled; }
    public void setSchedulingEnabled(boolean schedulingEnabled) { this.schedulingEnabled = schedulingEnabled; }
    public int getClaimLimit() { return claimLimit; }
    public void setClaimLimit(int claimLimit) { this.claimLimit = claimLimit; }
    public int getMaxCatchUpOccurrences() { return maxCatchUpOccurrences; }
    public void setMaxCatchUpOccurrences(int max) { this.maxCatchUpOccurrences = max; }
    public int getEventBatchSize() { return eventBatchSize; }
    public void setEventBatchSize(int eventBatchSize) { this.eventBatchSize = eventBatchSize; }
    public Duration getRunTimeout() { return runTimeout; }
    public void setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; }
    public Duration getStaleRunTimeout() { return staleRunTimeout; }
    public void setStaleRunTimeout(Duration staleRunTimeout) { this.staleRunTimeout = staleRunTimeout; }
    public Duration getManualTriggerCooldown() { return manualTriggerCooldown; }
    public void setManualTriggerCooldown(Duration cooldown) { this.manualTriggerCooldown = cooldown; }
    public Duration getOrphanClaimGrace() { return orphanClaimGrace; }
    public void setOrphanClaimGrace(Duration orphanClaimGrace) { this.orphanClaimGrace = orphanClaimGrace; }
    public Retry getRetry() { return retry; }
    public Retention getRetention() { return retention; }
    public Worker getWorker() { return worker; }

    /**
     * Identity recorded on claims and runs. Defaults to the host name plus a
     * random suffix so that two replicas on one host stay distinguishable.
     */
    public String getInstanceId() {
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = defaultInstanceId();
        }
        return instanceId;
    }

    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }

    private static String defaultInstanceId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofMinutes(10);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Retention {
        private Duration maxAge = Duration.ofDays(90);
        private int batchSize = 500;

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Worker {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 100;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
