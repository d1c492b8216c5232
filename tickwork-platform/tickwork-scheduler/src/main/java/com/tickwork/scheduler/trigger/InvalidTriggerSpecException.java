package com.tickwork.scheduler.trigger;

/**
 * Thrown when a job's trigger specification cannot be parsed. The job is
 * treated as never due until its specification is corrected.
 */
public class InvalidTriggerSpecException extends RuntimeException {

    public InvalidTriggerSpecException(String message) {
        super(message);
    }

    public InvalidTriggerSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
