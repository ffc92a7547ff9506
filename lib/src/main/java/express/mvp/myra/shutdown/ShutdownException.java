package express.mvp.myra.shutdown;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * Unchecked exception thrown when a shutdown sequence cannot run or did not succeed.
 *
 * <h2>Reasons</h2>
 *
 * <ul>
 *   <li>{@link Reason#ALREADY_SHUTTING_DOWN}: thrown synchronously by
 *       {@link ShutdownGroup#shutdownAll} when another sequence already started. Recoverable;
 *       callers typically log it and move on.
 *   <li>{@link Reason#SERVICE_FAILURE}: completes the composite future exceptionally when
 *       {@link ShutdownConfig#failOnServiceError()} is enabled and at least one service failed.
 *       Each service failure is attached as a suppressed exception.
 * </ul>
 */
public class ShutdownException extends RuntimeException {

    /** Why a shutdown sequence failed. */
    public enum Reason {
        /** A shutdown sequence has already been started on this group. */
        ALREADY_SHUTTING_DOWN,

        /** One or more services completed their shutdown exceptionally. */
        SERVICE_FAILURE
    }

    private final Reason reason;

    private final transient ShutdownReport report;

    /**
     * Constructs a new shutdown exception.
     *
     * @param reason why shutdown failed
     * @param message the detail message
     * @param report the report of the finished sequence, or null if none ran
     */
    public ShutdownException(Reason reason, String message, ShutdownReport report) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.report = report;
    }

    static ShutdownException alreadyShuttingDown() {
        return new ShutdownException(
                Reason.ALREADY_SHUTTING_DOWN, "ShutdownGroup is already shutting down", null);
    }

    static ShutdownException serviceFailure(ShutdownReport report) {
        ShutdownException e = new ShutdownException(
                Reason.SERVICE_FAILURE,
                report.failures().size() + " of " + report.serviceCount() + " services failed to shut down",
                report);
        for (ShutdownReport.ServiceOutcome failed : report.failures()) {
            e.addSuppressed(failed.failure());
        }
        return e;
    }

    /**
     * Returns why shutdown failed.
     *
     * @return the reason
     */
    public Reason reason() {
        return reason;
    }

    /**
     * Returns the report of the finished sequence.
     *
     * @return the report, or null for {@link Reason#ALREADY_SHUTTING_DOWN}
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "ShutdownReport is immutable.")
    public ShutdownReport report() {
        return report;
    }
}
