package com.tickwork.scheduler.run;

import com.tickwork.core.domain.CustomJob;
import com.tickwork.scheduler.config.CustomJobProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Attempt ceiling and exponential backoff between attempts.
 */
@Component
public class RetryPolicy {

    private final int defaultMaxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    @Autowired
    public RetryPolicy(CustomJobProperties properties) {
        this(properties.getRetry().getMaxAttempts(),
                properties.getRetry().getInitialBackoff(),
                properties.getRetry().getMultiplier(),
                properties.getRetry().getMaxBackoff());
    }

    public RetryPolicy(int defaultMaxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (defaultMaxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff cannot be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1");
        }
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Attempts allowed per occurrence of the job.
     */
    public int ceilingFor(CustomJob job) {
        Integer override = job.getMaxAttempts();
        return override != null ? override : defaultMaxAttempts;
    }

    /**
     * Delay before the attempt following {@code attempt}:
     * {@code initialBackoff * multiplier^(attempt - 1)}, capped at the maximum.
     */
    public Duration backoff(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be at least 1");
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
