package com.opsbot.core;

/**
 * Thrown when the job catalog file cannot be read or describes an invalid job.
 */
public class JobCatalogException extends RuntimeException {

    public JobCatalogException(String message) {
        super(message);
    }

    public JobCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
