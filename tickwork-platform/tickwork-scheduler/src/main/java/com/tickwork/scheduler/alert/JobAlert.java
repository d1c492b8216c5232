package com.tickwork.scheduler.alert;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator-facing finding about a job occurrence.
 */
public record JobAlert(AlertType type, UUID jobId, String occurrenceKey, int attempt,
                       String message, Instant raisedAt) {
}
