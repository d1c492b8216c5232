package com.tickwork.scheduler.alert;

public enum AlertType {
    ATTEMPTS_EXHAUSTED, // Occurrence failed on its last allowed attempt
    STALE_RUNNING       // Run stayed RUNNING past the stale timeout
}
