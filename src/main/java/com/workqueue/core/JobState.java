package com.workqueue.core;

/**
 * Enum representing the states a queued job moves through.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → ENQUEUED: admitted into its channel by the dispatcher</li>
 *   <li>ENQUEUED → RUNNING: claimed right before execution starts</li>
 *   <li>RUNNING → DONE: the target operation returned normally</li>
 *   <li>RUNNING → FAILED: the target operation raised an error</li>
 * </ul>
 *
 * <p>States only move forward. DONE and FAILED are terminal.</p>
 *
 * @see #canTransitionTo(JobState)
 */
public enum JobState {
    PENDING("Pending"),
    ENQUEUED("Enqueued"),
    RUNNING("Running"),
    DONE("Done"),
    FAILED("Failed");

    private final String displayName;

    JobState(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this state.
     *
     * @return the display name (e.g., "Done", "Failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this state is terminal. Jobs never leave a terminal state.
     *
     * @return true for DONE and FAILED
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Check if a job in this state counts against its channel's capacity.
     *
     * @return true for ENQUEUED and RUNNING
     */
    public boolean occupiesChannel() {
        return this == ENQUEUED || this == RUNNING;
    }

    /**
     * Validate if a transition to a new state is legal.
     *
     * @param newState the target state
     * @return true if the transition is allowed, false if it would skip or regress a state
     */
    public boolean canTransitionTo(JobState newState) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newState == ENQUEUED;
            case ENQUEUED -> newState == RUNNING;
            case RUNNING -> newState == DONE || newState == FAILED;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
