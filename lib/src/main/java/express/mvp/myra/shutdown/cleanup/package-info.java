/**
 * Cleanup helpers for shutdown paths.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.shutdown.cleanup.CleanupGuard} - Runs cleanup callbacks and logs
 *       their failures with context
 *   <li>{@link express.mvp.myra.shutdown.cleanup.ShutdownCleaner} - Runs a forced shutdown for
 *       owners that were dropped without close()
 * </ul>
 *
 * @see java.lang.ref.Cleaner
 */
package express.mvp.myra.shutdown.cleanup;
