package com.tickwork.core.repository;

/**
 * Thrown when the job store cannot be reached. Callers treat it as transient:
 * the current tick is abandoned and the next scheduled tick tries again.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
