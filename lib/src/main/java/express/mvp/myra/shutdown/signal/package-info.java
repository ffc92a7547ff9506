/**
 * Signalling primitives for two-phase shutdown.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.shutdown.signal.ForceSignal} - Broadcast-once "stop now" signal
 *       shared by every service of a group
 *   <li>{@link express.mvp.myra.shutdown.signal.TerminationSignal} - Multi-consumer broadcast of
 *       termination notifications
 *   <li>{@link express.mvp.myra.shutdown.signal.TerminationHandle} - Bridges OS signals
 *       (Ctrl-C by default) into a termination signal
 * </ul>
 */
package express.mvp.myra.shutdown.signal;
