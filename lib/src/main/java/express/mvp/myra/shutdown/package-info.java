/**
 * Coordinated graceful shutdown of groups of asynchronous services.
 *
 * <p>A {@link express.mvp.myra.shutdown.ShutdownGroup} collects
 * {@link express.mvp.myra.shutdown.Graceful} services and shuts them down concurrently. The
 * first termination notification starts a graceful shutdown; a second one fires the
 * {@link express.mvp.myra.shutdown.signal.ForceSignal} every service was handed.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.shutdown.ShutdownGroup} - Owns services and runs the shutdown
 *       sequence at most once
 *   <li>{@link express.mvp.myra.shutdown.Graceful} - Contract implemented by each service
 *   <li>{@link express.mvp.myra.shutdown.ShutdownReport} - Per-service outcome of a sequence
 *   <li>{@link express.mvp.myra.shutdown.ShutdownConfig} - Worker threads, failure policy and
 *       bridged OS signals
 * </ul>
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * RUNNING ──shutdownAll()──▶ SHUTTING_DOWN ──all services done──▶ TERMINATED
 * </pre>
 *
 * @see express.mvp.myra.shutdown.signal
 */
package express.mvp.myra.shutdown;
