package express.mvp.myra.shutdown.signal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Multi-consumer broadcast of termination notifications.
 *
 * <p>Every call to {@link #publish()} is delivered to every open {@link Subscription}. A
 * subscription only sees notifications published after it was created, and consumes them one at
 * a time with {@link Subscription#next()}. Notifications carry no payload, so nothing is buffered
 * beyond a per-subscription count and a slow subscriber never lags out.
 *
 * <pre>
 *   OS interrupt ──▶ publish() ──┬──▶ Subscription A: next() ──▶ graceful shutdown
 *                                │                    next() ──▶ force signal
 *                                └──▶ Subscription B: next() ──▶ ...
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Futures are completed outside the internal lock, so callbacks
 * attached to them may publish or subscribe again.
 *
 * @see TerminationHandle
 */
public final class TerminationSignal {

    private final Object lock = new Object();

    /** Open subscriptions. Guarded by {@link #lock}. */
    private final List<Subscription> subscribers = new ArrayList<>();

    /** Total notifications published. Guarded by {@link #lock}. */
    private long published;

    /** Creates a signal with no subscribers. */
    public TerminationSignal() {
        // No subscribers until subscribe() is called
    }

    /**
     * Opens a subscription that receives every notification published from now on.
     *
     * @return the new subscription
     */
    public Subscription subscribe() {
        synchronized (lock) {
            Subscription subscription = new Subscription(published);
            subscribers.add(subscription);
            return subscription;
        }
    }

    /**
     * Publishes one notification to every open subscription.
     *
     * @return the number of subscriptions the notification was delivered to
     * @throws SignalDeliveryException if there is no open subscription
     */
    public int publish() {
        List<CompletableFuture<Void>> ready = new ArrayList<>();
        int receivers;
        synchronized (lock) {
            receivers = subscribers.size();
            if (receivers == 0) {
                throw new SignalDeliveryException("No subscriber is listening for termination signals");
            }
            published++;
            for (Subscription subscription : subscribers) {
                CompletableFuture<Void> waiter = subscription.waiters.poll();
                if (waiter != null) {
                    subscription.consumed++;
                    ready.add(waiter);
                }
            }
        }
        for (CompletableFuture<Void> waiter : ready) {
            waiter.complete(null);
        }
        return receivers;
    }

    /**
     * Returns the number of notifications published so far.
     *
     * @return the published count
     */
    public long publishedCount() {
        synchronized (lock) {
            return published;
        }
    }

    /**
     * Returns the number of open subscriptions.
     *
     * @return the subscriber count
     */
    public int subscriberCount() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "TerminationSignal[published=" + published + ", subscribers=" + subscribers.size() + "]";
        }
    }

    /**
     * A receiver of termination notifications.
     *
     * <p>Closing a subscription detaches it from the signal and cancels any future returned by
     * {@link #next()} that has not completed yet.
     */
    public final class Subscription implements AutoCloseable {

        /** Notifications consumed (or skipped at subscription time). Guarded by the signal lock. */
        private long consumed;

        /** Pending {@link #next()} futures, oldest first. Guarded by the signal lock. */
        private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();

        /** Guarded by the signal lock. */
        private boolean closed;

        private Subscription(long startAt) {
            this.consumed = startAt;
        }

        /**
         * Returns a future for the next notification this subscription has not consumed.
         *
         * <p>If a notification is already available the returned future is complete. Successive
         * calls consume successive notifications.
         *
         * @return a future completing when the next notification arrives
         */
        public CompletableFuture<Void> next() {
            synchronized (lock) {
                if (closed) {
                    CompletableFuture<Void> cancelled = new CompletableFuture<>();
                    cancelled.cancel(false);
                    return cancelled;
                }
                if (waiters.isEmpty() && consumed < published) {
                    consumed++;
                    return CompletableFuture.completedFuture(null);
                }
                CompletableFuture<Void> waiter = new CompletableFuture<>();
                waiters.add(waiter);
                return waiter;
            }
        }

        /**
         * Returns whether this subscription has been closed.
         *
         * @return true once closed
         */
        public boolean isClosed() {
            synchronized (lock) {
                return closed;
            }
        }

        @Override
        public void close() {
            List<CompletableFuture<Void>> abandoned;
            synchronized (lock) {
                if (closed) {
                    return;
                }
                closed = true;
                subscribers.remove(this);
                abandoned = new ArrayList<>(waiters);
                waiters.clear();
            }
            for (CompletableFuture<Void> waiter : abandoned) {
                waiter.cancel(false);
            }
        }
    }
}
