package express.mvp.myra.shutdown;

/**
 * Phases of a {@link ShutdownGroup}.
 *
 * <pre>
 * RUNNING ──shutdownAll()──▶ SHUTTING_DOWN ──all services done──▶ TERMINATED
 * </pre>
 *
 * <p>The transition out of {@link #RUNNING} happens exactly once per group, through a single
 * atomic compare-and-set. There is no way back.
 */
public enum ShutdownPhase {

    /** Services are registered and running; no shutdown requested yet. */
    RUNNING(0, "Running"),

    /**
     * A shutdown sequence has started.
     *
     * <p>Every service's shutdown has been (or is being) dispatched; further
     * {@link ShutdownGroup#shutdownAll} calls are rejected.
     */
    SHUTTING_DOWN(1, "Shutting down"),

    /** Every service's shutdown has completed, successfully or not. */
    TERMINATED(2, "Terminated");

    private final int order;
    private final String displayName;

    ShutdownPhase(int order, String displayName) {
        this.order = order;
        this.displayName = displayName;
    }

    /**
     * Returns the numeric order of this phase for comparison.
     *
     * @return the phase order (0 = RUNNING, 2 = TERMINATED)
     */
    public int order() {
        return order;
    }

    /**
     * Returns a human-readable name for this phase.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if this phase is before the specified phase.
     *
     * @param other the phase to compare with
     * @return true if this phase comes before the other
     */
    public boolean isBefore(ShutdownPhase other) {
        return this.order < other.order;
    }

    /**
     * Checks if shutdown has been initiated.
     *
     * @return true in SHUTTING_DOWN or TERMINATED
     */
    public boolean isShuttingDown() {
        return this.order > RUNNING.order;
    }

    /**
     * Checks if shutdown is complete.
     *
     * @return true only in {@link #TERMINATED}
     */
    public boolean isTerminated() {
        return this == TERMINATED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
