package com.tickwork.scheduler.run;

/**
 * Failure reported by a handler. The message becomes the run's error
 * summary as is, without the exception class name.
 */
public class HandlerFailureException extends RuntimeException {

    public HandlerFailureException(String message) {
        super(message);
    }

    public HandlerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
