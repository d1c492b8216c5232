package com.tickwork.scheduler.dispatch;

import com.tickwork.core.domain.TriggerEvent;

/**
 * Result of a manual run request.
 *
 * @param event The manual occurrence
 * @param created false when the idempotency key matched an earlier request
 */
public record ManualRunRequest(TriggerEvent event, boolean created) {
}
