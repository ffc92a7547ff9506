package express.mvp.myra.shutdown;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one shutdown sequence: an outcome per service, in registration order.
 *
 * <p>A report is produced for every completed sequence, whether or not services failed. It is
 * immutable.
 */
public final class ShutdownReport {

    private final List<ServiceOutcome> outcomes;

    private final List<ServiceOutcome> failures;

    private final boolean forceSupplied;

    private final long durationMs;

    ShutdownReport(List<ServiceOutcome> outcomes, boolean forceSupplied, long durationMs) {
        this.outcomes = List.copyOf(outcomes);
        this.failures = this.outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .collect(Collectors.toUnmodifiableList());
        this.forceSupplied = forceSupplied;
        this.durationMs = durationMs;
    }

    /**
     * Returns every service outcome in registration order.
     *
     * @return unmodifiable list of outcomes
     */
    public List<ServiceOutcome> outcomes() {
        return outcomes;
    }

    /**
     * Returns the outcomes of services that failed.
     *
     * @return unmodifiable list of failed outcomes
     */
    public List<ServiceOutcome> failures() {
        return failures;
    }

    /**
     * Returns the number of services that were shut down.
     *
     * @return the service count
     */
    public int serviceCount() {
        return outcomes.size();
    }

    /**
     * Checks whether any service failed.
     *
     * @return true if at least one service failed
     */
    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Checks whether every service shut down successfully.
     *
     * @return true if no service failed
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

    /**
     * Returns whether the sequence was given a force signal.
     *
     * @return true if services received a force signal
     */
    public boolean forceSupplied() {
        return forceSupplied;
    }

    /**
     * Returns the wall-clock time from dispatch to the last service completing.
     *
     * @return duration in milliseconds
     */
    public long durationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "ShutdownReport[services=" + outcomes.size()
                + ", failures=" + failures.size()
                + ", forced=" + forceSupplied
                + ", durationMs=" + durationMs
                + "]";
    }

    /**
     * Outcome of one service's shutdown.
     *
     * @param index position of the service in registration order
     * @param serviceName the service's {@link Graceful#name()}
     * @param failure why the service failed, or null on success
     * @param durationMs time from dispatch to completion in milliseconds
     */
    @SuppressFBWarnings(
            value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
            justification = "Throwable is kept for diagnostics and cannot be safely copied.")
    public record ServiceOutcome(int index, String serviceName, Throwable failure, long durationMs) {

        /**
         * Checks whether the service shut down successfully.
         *
         * @return true if there is no failure
         */
        public boolean isSuccess() {
            return failure == null;
        }
    }
}
