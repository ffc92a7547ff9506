package express.mvp.myra.shutdown.cleanup;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs cleanup callbacks so that their failures are diagnosed instead of lost.
 *
 * <p>Cleanup often runs while another failure is already propagating (a {@code finally} block, a
 * {@code close()} during try-with-resources, a cleaner thread). A second failure raised at that
 * point tends to either hide the first one or vanish silently. This guard logs the second failure
 * with its context before letting it continue, and never replaces a primary failure.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * @Override
 * public void close() {
 *     CleanupGuard.run("flush journal", journal::flush);
 * }
 *
 * try {
 *     process();
 * } catch (RuntimeException e) {
 *     CleanupGuard.runWhileFailing(e, "release lease", lease::release);
 *     throw e;
 * }
 * }</pre>
 */
public final class CleanupGuard {

    private static final Logger LOGGER = Logger.getLogger(CleanupGuard.class.getName());

    private CleanupGuard() {
        // Utility class
    }

    /**
     * Runs {@code cleanup}, logging any failure with its context and rethrowing it unchanged.
     *
     * <p>When the caller is a {@code close()} invoked by try-with-resources while another exception
     * propagates, the rethrown failure is attached to that exception as suppressed by the language,
     * so the primary failure still surfaces first.
     *
     * @param description what the cleanup does, for diagnostics
     * @param cleanup the cleanup to run
     */
    public static void run(String description, Runnable cleanup) {
        Objects.requireNonNull(cleanup, "cleanup must not be null");
        try {
            cleanup.run();
        } catch (RuntimeException | Error e) {
            LOGGER.log(Level.SEVERE, context("Cleanup failed", description), e);
            throw e;
        }
    }

    /**
     * Runs {@code cleanup} while {@code primary} is propagating.
     *
     * <p>A failure of the cleanup is logged together with the primary failure and attached to it
     * as suppressed. This method never throws the secondary failure; the caller rethrows
     * {@code primary}.
     *
     * @param <T> the type of the primary failure
     * @param primary the failure currently propagating
     * @param description what the cleanup does, for diagnostics
     * @param cleanup the cleanup to run
     * @return {@code primary}, for {@code throw CleanupGuard.runWhileFailing(...)}
     */
    public static <T extends Throwable> T runWhileFailing(
            T primary, String description, Runnable cleanup) {
        Objects.requireNonNull(primary, "primary must not be null");
        Objects.requireNonNull(cleanup, "cleanup must not be null");
        try {
            cleanup.run();
        } catch (Throwable secondary) {
            LOGGER.log(
                    Level.SEVERE,
                    context("Second failure during cleanup", description)
                            + " while handling: " + primary,
                    secondary);
            if (secondary != primary) {
                primary.addSuppressed(secondary);
            }
        }
        return primary;
    }

    private static String context(String what, String description) {
        return what + " [" + description + "] on thread " + Thread.currentThread().getName();
    }
}
