package express.mvp.myra.shutdown.signal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Broadcast-once notification telling services to abandon graceful work.
 *
 * <p>A force signal is either <em>pending</em> or <em>fired</em>. The absence of a signal (a
 * {@code null} argument) is the third, <em>unset</em>, state. Once fired, a signal stays fired:
 * every current and future observer sees the firing, and no observer can see a pending signal
 * after another observer has seen it fired.
 *
 * <h2>Sharing</h2>
 *
 * <p>The trigger passed to {@link #from(CompletionStage)} is observed exactly once, however many
 * handles are derived from the signal with {@link #newHandle()}. Each handle is an independent
 * view: cancelling the future returned by one handle's {@link #future()} has no effect on any
 * other observer.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * public CompletionStage<Void> shutdown(ForceSignal force) {
 *     return CompletableFuture.runAsync(() -> {
 *         while (hasPendingWork()) {
 *             if (force != null && force.isFired()) {
 *                 return; // abandon remaining work
 *             }
 *             flushOne();
 *         }
 *     });
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable from the outside and safe for use by any number of threads.
 */
public final class ForceSignal {

    private static final ForceSignal FIRED = new ForceSignal(CompletableFuture.completedFuture(null));

    /** Completes (normally, exactly once) when the signal fires. */
    private final CompletableFuture<Void> fired;

    /** Released when {@link #fired} completes; backs the blocking waits. */
    private final CountDownLatch latch = new CountDownLatch(1);

    private ForceSignal(CompletableFuture<Void> fired) {
        this.fired = fired;
        fired.thenRun(latch::countDown);
    }

    /**
     * Creates a pending signal that fires when {@code trigger} completes.
     *
     * <p>Any completion fires the signal, including exceptional completion and cancellation: a
     * trigger that can no longer deliver is treated as a request to force.
     *
     * @param trigger the stage whose completion fires the signal
     * @return a new pending (or already fired, if the trigger is done) signal
     * @throws NullPointerException if trigger is null
     */
    public static ForceSignal from(CompletionStage<?> trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        CompletableFuture<Void> fired = new CompletableFuture<>();
        trigger.whenComplete((value, error) -> fired.complete(null));
        return new ForceSignal(fired);
    }

    /**
     * Returns a signal that has already fired.
     *
     * <p>Services receiving it take their fast path immediately.
     *
     * @return the shared fired signal
     */
    public static ForceSignal fired() {
        return FIRED;
    }

    /**
     * Creates an independent handle to the same firing.
     *
     * @return a new handle that fires together with this signal
     */
    public ForceSignal newHandle() {
        return new ForceSignal(fired.copy());
    }

    /**
     * Checks whether the signal has fired.
     *
     * @return true once the signal has fired
     */
    public boolean isFired() {
        return fired.isDone();
    }

    /**
     * Returns a future that completes when the signal fires.
     *
     * <p>Each call returns a fresh dependent future; completing or cancelling it does not affect
     * the signal.
     *
     * @return a future completing on firing
     */
    public CompletableFuture<Void> future() {
        return fired.copy();
    }

    /**
     * Runs {@code action} once the signal fires, or immediately if it already has.
     *
     * @param action the action to run
     * @throws NullPointerException if action is null
     */
    public void whenFired(Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        fired.thenRun(action);
    }

    /**
     * Blocks until the signal fires.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * Blocks until the signal fires or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return true if the signal fired within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public String toString() {
        return "ForceSignal[" + (isFired() ? "fired" : "pending") + "]";
    }
}
