package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.signal.ForceSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Everything a {@link ShutdownGroup} owns, kept apart from the group object so that the cleaner
 * action can run a forced shutdown without referencing the group.
 */
final class GroupState {

    private static final Logger LOGGER = Logger.getLogger(ShutdownGroup.class.getName());

    private final ShutdownConfig config;

    private final AtomicReference<ShutdownPhase> phase =
            new AtomicReference<>(ShutdownPhase.RUNNING);

    /** Registered services, in order. Mutated only before shutdown starts. */
    private final List<Graceful> services = new ArrayList<>();

    private final List<ShutdownListener> listeners = new CopyOnWriteArrayList<>();

    GroupState(ShutdownConfig config) {
        this.config = config;
    }

    ShutdownConfig config() {
        return config;
    }

    ShutdownPhase phase() {
        return phase.get();
    }

    void push(Graceful service) {
        services.add(service);
    }

    int size() {
        return services.size();
    }

    void addListener(ShutdownListener listener) {
        listeners.add(listener);
    }

    boolean removeListener(ShutdownListener listener) {
        return listeners.remove(listener);
    }

    CompletableFuture<ShutdownReport> shutdownAll(ForceSignal force) {
        // Only the first caller wins
        if (!phase.compareAndSet(ShutdownPhase.RUNNING, ShutdownPhase.SHUTTING_DOWN)) {
            throw ShutdownException.alreadyShuttingDown();
        }

        List<Graceful> snapshot = List.copyOf(services);
        boolean forceSupplied = force != null;
        long startNanos = System.nanoTime();
        notifyStarted(snapshot.size(), forceSupplied);

        ExecutorService workers = Executors.newCachedThreadPool(
                new ShutdownThreadFactory(config.threadNamePrefix(), config.daemonThreads()));
        List<CompletableFuture<ShutdownReport.ServiceOutcome>> pending =
                new ArrayList<>(snapshot.size());
        try {
            for (int i = 0; i < snapshot.size(); i++) {
                ForceSignal handle = forceSupplied ? force.newHandle() : null;
                pending.add(dispatch(i, snapshot.get(i), handle, workers));
            }
        } finally {
            // Already submitted dispatches still run
            workers.shutdown();
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> finish(pending, forceSupplied, startNanos));
    }

    /**
     * Forces every service down and blocks until they all completed. Does nothing if a shutdown
     * sequence was already started.
     */
    void forceShutdown() {
        CompletableFuture<ShutdownReport> done;
        try {
            done = shutdownAll(ForceSignal.fired());
        } catch (ShutdownException e) {
            LOGGER.fine("Shutdown already requested; no forced shutdown needed");
            return;
        }
        try {
            done.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private CompletableFuture<ShutdownReport.ServiceOutcome> dispatch(
            int index, Graceful service, ForceSignal force, Executor workers) {
        String name = nameOf(service, index);
        long startNanos = System.nanoTime();
        LOGGER.fine(() -> "Shutting down " + name + (force != null ? " (force signal supplied)" : ""));

        return CompletableFuture.supplyAsync(() -> invoke(service, name, force), workers)
                .thenCompose(stage -> stage)
                .handle((ignored, error) -> {
                    ShutdownReport.ServiceOutcome outcome = new ShutdownReport.ServiceOutcome(
                            index, name, unwrap(error), elapsedMs(startNanos));
                    if (outcome.isSuccess()) {
                        LOGGER.fine(() -> name + " shut down in " + outcome.durationMs() + "ms");
                    } else {
                        LOGGER.log(Level.WARNING, name + " failed to shut down", outcome.failure());
                    }
                    notifyServiceShutdown(outcome);
                    return outcome;
                });
    }

    private static CompletionStage<Void> invoke(Graceful service, String name, ForceSignal force) {
        CompletionStage<Void> stage = service.shutdown(force);
        if (stage == null) {
            throw new NullPointerException(name + " returned a null shutdown stage");
        }
        return stage;
    }

    private ShutdownReport finish(
            List<CompletableFuture<ShutdownReport.ServiceOutcome>> pending,
            boolean forceSupplied,
            long startNanos) {
        List<ShutdownReport.ServiceOutcome> outcomes = pending.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        ShutdownReport report = new ShutdownReport(outcomes, forceSupplied, elapsedMs(startNanos));
        phase.set(ShutdownPhase.TERMINATED);

        LOGGER.info(() -> "Shut down " + report.serviceCount() + " services in "
                + report.durationMs() + "ms (" + report.failures().size() + " failed)");
        notifyComplete(report);

        if (config.failOnServiceError() && report.hasFailures()) {
            throw ShutdownException.serviceFailure(report);
        }
        return report;
    }

    private static String nameOf(Graceful service, int index) {
        String name;
        try {
            name = service.name();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Service name lookup failed for service-" + index, e);
            return "service-" + index;
        }
        if (name == null || name.isBlank()) {
            return "service-" + index;
        }
        return name;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void notifyStarted(int serviceCount, boolean forceSupplied) {
        for (ShutdownListener listener : listeners) {
            try {
                listener.onShutdownStarted(serviceCount, forceSupplied);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed", e);
            }
        }
    }

    private void notifyServiceShutdown(ShutdownReport.ServiceOutcome outcome) {
        for (ShutdownListener listener : listeners) {
            try {
                listener.onServiceShutdown(outcome);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed", e);
            }
        }
    }

    private void notifyComplete(ShutdownReport report) {
        for (ShutdownListener listener : listeners) {
            try {
                listener.onShutdownComplete(report);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed", e);
            }
        }
    }
}
