package com.opsbot.core;

/**
 * Thrown by the scheduler façade when the job store cannot complete a request.
 *
 * <p>Command and webhook handlers see this unchecked exception instead of the
 * underlying {@link java.sql.SQLException}, and typically answer the user with its message.</p>
 *
 * @see com.opsbot.engine.Scheduler
 */
public class SchedulerException extends RuntimeException {

    /**
     * @param message the error message
     */
    public SchedulerException(String message) {
        super(message);
    }

    /**
     * @param message the error message
     * @param cause the underlying store failure
     */
    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
