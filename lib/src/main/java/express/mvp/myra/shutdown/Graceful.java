package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.signal.ForceSignal;
import java.util.concurrent.CompletionStage;

/**
 * A service that can be shut down asynchronously.
 *
 * <p>{@link #shutdown(ForceSignal)} starts the service's cleanup and returns a stage that completes
 * once cleanup is finished. Completing normally means success; completing exceptionally reports a
 * service-specific failure.
 *
 * <h2>Force Signal</h2>
 *
 * <p>The caller may supply a {@link ForceSignal}. When it fires, the service should abandon the
 * remaining graceful work and complete as soon as practical. A service with nothing to wait for
 * may ignore it. When {@code force} is {@code null}, no force request will ever come and the
 * service completes on its own schedule.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * final class Flusher implements Graceful {
 *     @Override
 *     public CompletionStage<Void> shutdown(ForceSignal force) {
 *         CompletableFuture<Void> drained = queue.drainAsync();
 *         if (force == null) {
 *             return drained;
 *         }
 *         return drained.applyToEither(force.future(), ignored -> null);
 *     }
 * }
 * }</pre>
 *
 * <p>There is no deadline: the returned stage must complete eventually, but a service that never
 * completes keeps its group's shutdown pending forever.
 */
public interface Graceful {

    /**
     * Shuts the service down.
     *
     * @param force signal asking for immediate shutdown, or null if none will be sent
     * @return a stage completing when cleanup is done
     */
    CompletionStage<Void> shutdown(ForceSignal force);

    /**
     * Returns the name used for this service in logs and reports.
     *
     * @return the service name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
