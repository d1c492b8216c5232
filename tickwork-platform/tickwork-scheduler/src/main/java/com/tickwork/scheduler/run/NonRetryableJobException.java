package com.tickwork.scheduler.run;

/**
 * Thrown by a handler when retrying cannot help, for example on invalid
 * configuration.
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
