package com.tickwork.scheduler.history;

import com.tickwork.scheduler.config.CustomJobProperties;
import com.tickwork.scheduler.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Maximum age of finished job runs. The key-value store can override the
 * configured value at runtime.
 */
@Component
public class RetentionPolicy {

    public static final String MAX_AGE_KEY = "custom-jobs.retention.max-age";

    private static final Logger log = LoggerFactory.getLogger(RetentionPolicy.class);

    private final KeyValueStore keyValueStore;
    private final Duration defaultMaxAge;
    private final int batchSize;

    public RetentionPolicy(KeyValueStore keyValueStore, CustomJobProperties properties) {
        if (properties.getRetention().getMaxAge().isNegative()) {
            throw new IllegalArgumentException("Retention max age cannot be negative");
        }
        if (properties.getRetention().getBatchSize() < 1) {
            throw new IllegalArgumentException("Retention batch size must be at least 1");
        }
        this.keyValueStore = keyValueStore;
        this.defaultMaxAge = properties.getRetention().getMaxAge();
        this.batchSize = properties.getRetention().getBatchSize();
    }

    public Duration maxAge() {
        Optional<String> override = keyValueStore.get(MAX_AGE_KEY);
        if (override.isEmpty()) {
            return defaultMaxAge;
        }
        try {
            Duration parsed = Duration.parse(override.get());
            if (parsed.isNegative()) {
                log.warn("Ignoring negative {} override {}", MAX_AGE_KEY, override.get());
                return defaultMaxAge;
            }
            return parsed;
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable {} override '{}'", MAX_AGE_KEY, override.get());
            return defaultMaxAge;
        }
    }

    /**
     * Finished runs strictly older than this are deleted.
     */
    public Instant cutoff(Instant now) {
        return now.minus(maxAge());
    }

    public int batchSize() {
        return batchSize;
    }
}
