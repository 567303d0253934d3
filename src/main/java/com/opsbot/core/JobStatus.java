package com.opsbot.core;

/**
 * Lifecycle states of a queued job.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RESERVED: job claimed by the dispatcher, exactly once</li>
 *   <li>RESERVED → DONE: job process finished, whatever its exit code</li>
 *   <li>RESERVED → PENDING: runner could not be launched, job goes back to the queue</li>
 * </ul>
 *
 * <p>There is no failed state. A failed run is reported to the requester, not persisted.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("Pending"),
    RESERVED("Reserved"),
    DONE("Done");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return true for DONE, the only state a job never leaves
     */
    public boolean isTerminal() {
        return this == DONE;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * @param newStatus the target status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RESERVED;
            case RESERVED -> newStatus == DONE || newStatus == PENDING;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
