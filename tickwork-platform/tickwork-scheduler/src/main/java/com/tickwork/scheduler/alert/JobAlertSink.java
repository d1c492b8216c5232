package com.tickwork.scheduler.alert;

/**
 * Receives job alerts. Implementations must not throw.
 */
public interface JobAlertSink {

    void raise(JobAlert alert);
}
