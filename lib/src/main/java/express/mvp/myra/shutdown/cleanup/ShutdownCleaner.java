package express.mvp.myra.shutdown.cleanup;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Runs a final shutdown action when its owner is closed or becomes unreachable.
 *
 * <p>Explicit {@code close()} is the expected way to release an owner. This cleaner is the safety
 * net for owners that are dropped without it: the same action then runs on the cleaner thread, and
 * a warning names the owner that leaked.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * final class Owner implements AutoCloseable {
 *     private final State state = new State();
 *     private final ShutdownCleaner.TrackedCleanable cleanable;
 *
 *     Owner() {
 *         // The action must not capture 'this'
 *         this.cleanable = ShutdownCleaner.register(this, "Owner", state::forceStop);
 *     }
 *
 *     @Override
 *     public void close() {
 *         cleanable.clean();
 *     }
 * }
 * }</pre>
 *
 * <h2>Important Constraints</h2>
 *
 * <ul>
 *   <li>The action <b>must not</b> reference the registered owner, or the owner is never collected
 *   <li>The action runs at most once, on whichever path gets there first
 *   <li>When triggered by the collector it runs on the shared cleaner thread, so it should not
 *       block on work that needs that thread
 * </ul>
 *
 * @see java.lang.ref.Cleaner
 */
public final class ShutdownCleaner {

    private static final Logger LOGGER = Logger.getLogger(ShutdownCleaner.class.getName());

    private static final Cleaner CLEANER = Cleaner.create();

    private static final AtomicLong registrations = new AtomicLong(0);

    private static final AtomicLong explicitCleanups = new AtomicLong(0);

    /** Owners collected without an explicit clean. */
    private static final AtomicLong discardedCleanups = new AtomicLong(0);

    private ShutdownCleaner() {
        // Utility class
    }

    /**
     * Registers {@code action} to run when {@code owner} is cleaned or becomes phantom reachable.
     *
     * @param owner the object whose lifetime bounds the action
     * @param description names the owner in the leak warning
     * @param action the shutdown action (must not reference owner)
     * @return a cleanable for explicit cleanup
     */
    public static TrackedCleanable register(Object owner, String description, Runnable action) {
        CleanupAction wrapper = new CleanupAction(description, action);
        Cleaner.Cleanable cleanable = CLEANER.register(owner, wrapper);
        registrations.incrementAndGet();
        return new TrackedCleanable(cleanable, wrapper);
    }

    /**
     * Returns the total number of registrations.
     *
     * @return registration count
     */
    public static long getRegistrationCount() {
        return registrations.get();
    }

    /**
     * Returns the number of actions run through {@link TrackedCleanable#clean()}.
     *
     * @return explicit cleanup count
     */
    public static long getExplicitCleanupCount() {
        return explicitCleanups.get();
    }

    /**
     * Returns the number of actions run because the owner was collected.
     *
     * @return discarded owner count
     */
    public static long getDiscardedCount() {
        return discardedCleanups.get();
    }

    /**
     * Returns the number of registrations whose action has not run yet.
     *
     * @return active registration count
     */
    public static long getActiveCount() {
        return registrations.get() - explicitCleanups.get() - discardedCleanups.get();
    }

    private static final class CleanupAction implements Runnable {
        private final String description;
        private final Runnable delegate;
        private volatile boolean explicit = false;

        CleanupAction(String description, Runnable delegate) {
            this.description = description;
            this.delegate = delegate;
        }

        void markExplicit() {
            this.explicit = true;
        }

        @Override
        public void run() {
            if (explicit) {
                explicitCleanups.incrementAndGet();
                delegate.run();
            } else {
                discardedCleanups.incrementAndGet();
                LOGGER.warning(description + " was discarded without close(); forcing shutdown");
                CleanupGuard.run(description + " discarded", delegate);
            }
        }
    }

    /** Handle for running the registered action explicitly. */
    public static final class TrackedCleanable implements AutoCloseable {
        private final Cleaner.Cleanable cleanable;
        private final CleanupAction action;
        private final AtomicBoolean cleaned = new AtomicBoolean(false);

        TrackedCleanable(Cleaner.Cleanable cleanable, CleanupAction action) {
            this.cleanable = cleanable;
            this.action = action;
        }

        /**
         * Runs the action on the calling thread unless it already ran.
         */
        public void clean() {
            if (cleaned.compareAndSet(false, true)) {
                action.markExplicit();
            }
            cleanable.clean();
        }

        /**
         * Returns whether {@link #clean()} has been called.
         *
         * @return true after the first explicit clean
         */
        public boolean isCleaned() {
            return cleaned.get();
        }

        @Override
        public void close() {
            clean();
        }
    }
}
