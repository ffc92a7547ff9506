package express.mvp.myra.shutdown;

/**
 * Callback interface for shutdown progress of a {@link ShutdownGroup}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * group.addListener(new ShutdownListener() {
 *     @Override
 *     public void onServiceShutdown(ShutdownReport.ServiceOutcome outcome) {
 *         if (!outcome.isSuccess()) {
 *             alerts.raise(outcome.serviceName(), outcome.failure());
 *         }
 *     }
 *
 *     @Override
 *     public void onShutdownComplete(ShutdownReport report) {
 *         metrics.recordShutdown(report.durationMs());
 *     }
 * });
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callbacks run on whichever thread completes the corresponding stage, usually a service's
 * own thread or a shutdown worker. Implementations must be thread-safe. Exceptions thrown by a
 * listener are logged and otherwise ignored.
 */
public interface ShutdownListener {

    /**
     * Called once, after the group entered {@link ShutdownPhase#SHUTTING_DOWN} and before any
     * service is dispatched.
     *
     * @param serviceCount number of services about to be shut down
     * @param forceSupplied whether the services receive a force signal
     */
    default void onShutdownStarted(int serviceCount, boolean forceSupplied) {
        // Default: no-op
    }

    /**
     * Called when one service's shutdown completes.
     *
     * @param outcome the service's outcome
     */
    default void onServiceShutdown(ShutdownReport.ServiceOutcome outcome) {
        // Default: no-op
    }

    /**
     * Called once every service has completed, before the composite future completes.
     *
     * @param report the report of the sequence
     */
    void onShutdownComplete(ShutdownReport report);
}
