package com.tickwork.scheduler.run;

import com.tickwork.core.domain.TriggerEvent.TriggerSource;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Per-attempt context handed to a {@link JobHandler}.
 *
 * @param jobId Job being run
 * @param runId Id of the JobRun row of this attempt
 * @param occurrenceKey Trigger occurrence
 * @param source What produced the occurrence
 * @param scheduledFor Fire time for schedule occurrences, null otherwise
 * @param payload Event or manual payload, empty for schedule occurrences
 * @param attempt 1-based attempt number
 * @param deadline Time by which the handler should have returned
 */
public record TriggerContext(UUID jobId, UUID runId, String occurrenceKey, TriggerSource source,
                             Instant scheduledFor, Map<String, Object> payload, int attempt,
                             Instant deadline) {
}
