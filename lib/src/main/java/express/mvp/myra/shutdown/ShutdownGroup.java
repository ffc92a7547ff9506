package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.cleanup.CleanupGuard;
import express.mvp.myra.shutdown.cleanup.ShutdownCleaner;
import express.mvp.myra.shutdown.signal.ForceSignal;
import express.mvp.myra.shutdown.signal.TerminationHandle;
import express.mvp.myra.shutdown.signal.TerminationSignal;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shuts down a group of services together, in two phases.
 *
 * <p>Services are registered with {@link #push(Graceful)} and shut down concurrently by
 * {@link #shutdownAll(ForceSignal)}. A shutdown sequence runs at most once per group.
 *
 * <h2>Two-Phase Shutdown</h2>
 *
 * <pre>
 * 1. First termination notification
 *    └─▶ shutdownAll(force) on every service, concurrently
 *        └─▶ services finish in-flight work
 *
 * 2. Second termination notification
 *    └─▶ force signal fires
 *        └─▶ services abandon remaining work
 *
 * 3. Every service completed
 *    └─▶ composite future completes with a ShutdownReport
 * </pre>
 *
 * <h2>Closing Without Shutdown</h2>
 *
 * <p>{@link #close()} on a group that was never shut down forces every service down with an
 * already-fired {@link ForceSignal} and blocks until they all completed. A group that becomes
 * unreachable without being closed gets the same forced shutdown on the cleaner thread, with a
 * warning in the log.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownGroup group = new ShutdownGroup();
 * group.push(httpServer);
 * group.push(journalWriter);
 *
 * TerminationSignal signal = ShutdownGroup.installTerminationHandle();
 * group.waitToTerminate(signal).join(); // Ctrl-C once: graceful, twice: forced
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>{@link #shutdownAll}, {@link #close()} and {@link #waitToTerminate} may race from different
 * threads; exactly one of them runs the shutdown sequence. {@link #push(Graceful)} is not
 * thread-safe and must complete before any shutdown starts: pushing concurrently with or after a
 * shutdown is a caller error and the pushed service may or may not be shut down.
 *
 * @see Graceful
 * @see ShutdownPhase
 */
public final class ShutdownGroup implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ShutdownGroup.class.getName());

    private final GroupState state;

    private final ShutdownCleaner.TrackedCleanable cleanable;

    /** Creates an empty group with default configuration. */
    public ShutdownGroup() {
        this(ShutdownConfig.defaults());
    }

    /**
     * Creates an empty group.
     *
     * @param config the group configuration
     */
    public ShutdownGroup(ShutdownConfig config) {
        this.state = new GroupState(Objects.requireNonNull(config, "config must not be null"));
        this.cleanable = ShutdownCleaner.register(this, "ShutdownGroup", state::forceShutdown);
    }

    /**
     * Installs the process-wide OS termination handler for the default signals.
     *
     * @return the termination signal, usable by any number of groups
     * @throws IllegalStateException if already installed in this process
     * @see TerminationHandle#install()
     */
    public static TerminationSignal installTerminationHandle() {
        return TerminationHandle.install();
    }

    /**
     * Installs the process-wide OS termination handler for the configured signals.
     *
     * @param config configuration naming the signals to bridge
     * @return the termination signal, usable by any number of groups
     * @throws IllegalStateException if already installed in this process
     */
    public static TerminationSignal installTerminationHandle(ShutdownConfig config) {
        return TerminationHandle.install(config.terminationSignals());
    }

    /**
     * Appends a service to the group.
     *
     * <p>Must not be called concurrently with, or after the start of, a shutdown sequence.
     *
     * @param service the service to register
     * @throws NullPointerException if service is null
     */
    public void push(Graceful service) {
        state.push(Objects.requireNonNull(service, "service must not be null"));
    }

    /**
     * Shuts down every registered service concurrently.
     *
     * <p>Each service receives its own handle to {@code force}, or null when {@code force} is
     * null. All services are dispatched before this method returns. The returned future completes
     * once every service has completed; it carries one outcome per service and does not fail
     * because a service failed unless {@link ShutdownConfig#failOnServiceError()} is set.
     *
     * @param force signal asking services to stop immediately, or null
     * @return a future completing when every service has shut down
     * @throws ShutdownException with {@link ShutdownException.Reason#ALREADY_SHUTTING_DOWN} if a
     *     shutdown sequence already started; no service is invoked
     */
    public CompletableFuture<ShutdownReport> shutdownAll(ForceSignal force) {
        return state.shutdownAll(force);
    }

    /**
     * Waits for a termination notification, then shuts the group down in two phases.
     *
     * <p>The subscription to {@code signal} is opened immediately. The first notification starts
     * {@link #shutdownAll} with a force signal that fires on the next notification. If a shutdown
     * is already in progress this is logged and the returned future completes normally. Service
     * failures are logged, not propagated.
     *
     * @param signal the termination signal to listen to
     * @return a future completing after the first notification and the resulting shutdown
     */
    public CompletableFuture<Void> waitToTerminate(TerminationSignal signal) {
        TerminationSignal.Subscription subscription = signal.subscribe();

        return subscription.next()
                .thenCompose(received -> {
                    LOGGER.info("Received termination signal.");
                    LOGGER.info("Send the termination signal again to force shutdown.");

                    ForceSignal force = ForceSignal.from(subscription.next());
                    CompletableFuture<ShutdownReport> done;
                    try {
                        done = state.shutdownAll(force);
                    } catch (ShutdownException e) {
                        LOGGER.info("Shutdown already in progress: " + e.getMessage());
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return done.<Void>handle((report, error) -> {
                        if (error != null) {
                            LOGGER.log(Level.WARNING, "Shutdown finished with errors", error);
                        }
                        return null;
                    });
                })
                .whenComplete((ignored, error) -> subscription.close());
    }

    /**
     * Forces every service down if no shutdown was requested, blocking until they completed.
     *
     * <p>Does nothing if a shutdown sequence was already started, including one still in
     * progress. Must not be called from a shutdown worker thread of any group: blocking a worker
     * while waiting for the services it runs can deadlock.
     *
     * @throws IllegalStateException if called from a shutdown worker thread while a forced
     *     shutdown would be needed
     * @throws ShutdownException if {@link ShutdownConfig#failOnServiceError()} is set and a
     *     service failed
     */
    @Override
    public void close() {
        if (!state.phase().isShuttingDown()
                && ShutdownThreadFactory.isShutdownWorker(Thread.currentThread())) {
            throw new IllegalStateException(
                    "ShutdownGroup must not be closed from shutdown worker thread "
                            + Thread.currentThread().getName());
        }
        CleanupGuard.run("ShutdownGroup close", cleanable::clean);
    }

    /**
     * Returns the number of registered services.
     *
     * @return the service count
     */
    public int size() {
        return state.size();
    }

    /**
     * Returns the current phase.
     *
     * @return the phase
     */
    public ShutdownPhase phase() {
        return state.phase();
    }

    /**
     * Checks whether a shutdown sequence has started.
     *
     * @return true once shutdown has been requested
     */
    public boolean isShuttingDown() {
        return state.phase().isShuttingDown();
    }

    /**
     * Checks whether the shutdown sequence has completed.
     *
     * @return true once every service completed
     */
    public boolean isTerminated() {
        return state.phase().isTerminated();
    }

    /**
     * Returns the group configuration.
     *
     * @return the configuration
     */
    public ShutdownConfig config() {
        return state.config();
    }

    /**
     * Registers a listener for shutdown progress.
     *
     * @param listener the listener to register
     */
    public void addListener(ShutdownListener listener) {
        state.addListener(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ShutdownListener listener) {
        return state.removeListener(listener);
    }

    @Override
    public String toString() {
        return "ShutdownGroup[services=" + state.size() + ", phase=" + state.phase() + "]";
    }
}
