package com.tickwork.scheduler.history;

/**
 * Outcome of one retention sweep.
 *
 * @param runsDeleted Finished runs deleted
 * @param eventsDeleted Claimed trigger events deleted
 * @param staleRunning Runs still RUNNING that started before the cutoff
 */
public record RetentionResult(int runsDeleted, int eventsDeleted, long staleRunning) {

    public int deleted() {
        return runsDeleted + eventsDeleted;
    }
}
