package express.mvp.myra.shutdown;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.shutdown.cleanup.ShutdownCleaner;
import express.mvp.myra.shutdown.signal.ForceSignal;
import express.mvp.myra.shutdown.signal.TerminationSignal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit tests for {@link ShutdownGroup}. */
@DisplayName("ShutdownGroup")
@Timeout(10)
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT", "NP_NONNULL_PARAM_VIOLATION"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class ShutdownGroupTest {

    private ShutdownGroup group;

    @BeforeEach
    void setUp() {
        group = new ShutdownGroup();
    }

    @AfterEach
    void tearDown() {
        // Groups left running by a test are forced down here
        if (!group.isShuttingDown()) {
            group.close();
        }
    }

    /** Service whose shutdown behaviour is supplied by the test. */
    static final class RecordingService implements Graceful {
        private final String name;
        private final Function<ForceSignal, CompletionStage<Void>> behaviour;
        private final AtomicInteger calls = new AtomicInteger();
        private final List<ForceSignal> received = Collections.synchronizedList(new ArrayList<>());

        RecordingService(String name, Function<ForceSignal, CompletionStage<Void>> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        static RecordingService immediate(String name) {
            return new RecordingService(name, force -> CompletableFuture.completedFuture(null));
        }

        /** Completes only once the force signal fires; never completes without one. */
        static RecordingService untilForced(String name) {
            return new RecordingService(
                    name, force -> force == null ? new CompletableFuture<Void>() : force.future());
        }

        @Override
        public CompletionStage<Void> shutdown(ForceSignal force) {
            received.add(force);
            calls.incrementAndGet();
            return behaviour.apply(force);
        }

        @Override
        public String name() {
            return name;
        }

        int calls() {
            return calls.get();
        }

        ForceSignal lastForce() {
            return received.get(received.size() - 1);
        }
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("New group is empty and running")
        void newGroup() {
            assertEquals(0, group.size());
            assertEquals(ShutdownPhase.RUNNING, group.phase());
            assertFalse(group.isShuttingDown());
            assertFalse(group.isTerminated());
        }

        @Test
        @DisplayName("push increases size")
        void pushIncreasesSize() {
            group.push(RecordingService.immediate("a"));
            group.push(RecordingService.immediate("b"));

            assertEquals(2, group.size());
        }

        @Test
        @DisplayName("push rejects null")
        void pushRejectsNull() {
            assertThrows(NullPointerException.class, () -> group.push(null));
        }

        @Test
        @DisplayName("Constructor rejects null config")
        void constructorRejectsNull() {
            assertThrows(NullPointerException.class, () -> new ShutdownGroup(null));
        }
    }

    @Nested
    @DisplayName("shutdownAll")
    class ShutdownAllTests {

        @Test
        @DisplayName("Empty group completes immediately")
        void emptyGroup() {
            CompletableFuture<ShutdownReport> done = group.shutdownAll(null);

            assertTrue(done.isDone());
            assertEquals(0, done.join().serviceCount());
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Every service is shut down exactly once")
        void everyServiceOnce() throws Exception {
            List<RecordingService> services = List.of(
                    RecordingService.immediate("a"),
                    RecordingService.immediate("b"),
                    RecordingService.immediate("c"));
            services.forEach(group::push);

            ShutdownReport report = group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            for (RecordingService service : services) {
                assertEquals(1, service.calls());
            }
            assertEquals(3, report.serviceCount());
            assertTrue(report.isSuccess());
            assertEquals(List.of("a", "b", "c"),
                    report.outcomes().stream().map(ShutdownReport.ServiceOutcome::serviceName).toList());
        }

        @Test
        @DisplayName("Services are shut down concurrently")
        void servicesRunConcurrently() throws Exception {
            int count = 4;
            CountDownLatch started = new CountDownLatch(count);
            CompletableFuture<Void> release = new CompletableFuture<>();
            for (int i = 0; i < count; i++) {
                group.push(new RecordingService("s" + i, force -> {
                    started.countDown();
                    return release;
                }));
            }

            CompletableFuture<ShutdownReport> done = group.shutdownAll(null);

            // Every service started while none has completed
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertFalse(done.isDone());
            assertEquals(ShutdownPhase.SHUTTING_DOWN, group.phase());

            release.complete(null);
            assertEquals(count, done.get(5, TimeUnit.SECONDS).serviceCount());
            assertEquals(ShutdownPhase.TERMINATED, group.phase());
        }

        @Test
        @DisplayName("A blocking service does not delay the others")
        void blockingServiceDoesNotDelayOthers() throws Exception {
            CountDownLatch unblock = new CountDownLatch(1);
            CountDownLatch quickDone = new CountDownLatch(1);
            group.push(new RecordingService("blocking", force -> {
                try {
                    unblock.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return CompletableFuture.completedFuture(null);
            }));
            group.push(new RecordingService("quick", force -> {
                quickDone.countDown();
                return CompletableFuture.completedFuture(null);
            }));

            CompletableFuture<ShutdownReport> done = group.shutdownAll(null);

            assertTrue(quickDone.await(5, TimeUnit.SECONDS));
            unblock.countDown();
            assertTrue(done.get(5, TimeUnit.SECONDS).isSuccess());
        }

        @Test
        @DisplayName("Second call is rejected without invoking services")
        void secondCallRejected() {
            RecordingService service = RecordingService.untilForced("pending");
            group.push(service);
            group.shutdownAll(null);

            ShutdownException e = assertThrows(ShutdownException.class, () -> group.shutdownAll(null));

            assertEquals(ShutdownException.Reason.ALREADY_SHUTTING_DOWN, e.reason());
            assertEquals(1, service.calls());
        }

        @Test
        @DisplayName("Exactly one of many concurrent callers wins")
        void concurrentCallersOneWinner() throws Exception {
            RecordingService service = RecordingService.immediate("only");
            group.push(service);
            int callers = 8;
            CountDownLatch go = new CountDownLatch(1);
            AtomicInteger winners = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(executor.submit(() -> {
                        go.await();
                        try {
                            group.shutdownAll(null).join();
                            winners.incrementAndGet();
                        } catch (ShutdownException e) {
                            rejected.incrementAndGet();
                        }
                        return null;
                    }));
                }
                go.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, winners.get());
            assertEquals(callers - 1, rejected.get());
            assertEquals(1, service.calls());
        }
    }

    @Nested
    @DisplayName("Force signal")
    class ForceSignalTests {

        @Test
        @DisplayName("Null force reaches every service as null")
        void nullForcePassedThrough() throws Exception {
            RecordingService a = RecordingService.immediate("a");
            RecordingService b = RecordingService.immediate("b");
            group.push(a);
            group.push(b);

            ShutdownReport report = group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertNull(a.lastForce());
            assertNull(b.lastForce());
            assertFalse(report.forceSupplied());
        }

        @Test
        @DisplayName("Every service gets its own handle that fires with the source signal")
        void forceFansOut() throws Exception {
            RecordingService a = RecordingService.untilForced("a");
            RecordingService b = RecordingService.untilForced("b");
            group.push(a);
            group.push(b);
            CompletableFuture<Void> trigger = new CompletableFuture<>();

            CompletableFuture<ShutdownReport> done = group.shutdownAll(ForceSignal.from(trigger));
            awaitCalls(a, b);

            assertNotNull(a.lastForce());
            assertNotSame(a.lastForce(), b.lastForce());
            assertFalse(a.lastForce().isFired());
            assertFalse(b.lastForce().isFired());
            assertFalse(done.isDone());

            trigger.complete(null);

            ShutdownReport report = done.get(5, TimeUnit.SECONDS);
            assertTrue(a.lastForce().isFired());
            assertTrue(b.lastForce().isFired());
            assertTrue(report.forceSupplied());
        }

        @Test
        @DisplayName("Already fired force completes forced services at once")
        void alreadyFiredForce() throws Exception {
            group.push(RecordingService.untilForced("a"));

            ShutdownReport report = group.shutdownAll(ForceSignal.fired()).get(5, TimeUnit.SECONDS);

            assertTrue(report.isSuccess());
        }
    }

    @Nested
    @DisplayName("Service failures")
    class FailureTests {

        @Test
        @DisplayName("Failures are reported without failing the group")
        void failuresReported() throws Exception {
            IllegalStateException async = new IllegalStateException("async failure");
            IllegalArgumentException sync = new IllegalArgumentException("sync failure");
            group.push(RecordingService.immediate("ok"));
            group.push(new RecordingService("async", force -> CompletableFuture.failedFuture(async)));
            group.push(new RecordingService("sync", force -> {
                throw sync;
            }));

            ShutdownReport report = group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertEquals(3, report.serviceCount());
            assertEquals(2, report.failures().size());
            assertTrue(report.outcomes().get(0).isSuccess());
            assertSame(async, report.outcomes().get(1).failure());
            assertSame(sync, report.outcomes().get(2).failure());
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Null shutdown stage is reported as a failure")
        void nullStage() throws Exception {
            group.push(new RecordingService("broken", force -> null));

            ShutdownReport report = group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertInstanceOf(NullPointerException.class, report.outcomes().get(0).failure());
        }

        @Test
        @DisplayName("failOnServiceError fails the composite after every service ran")
        void failOnServiceError() {
            group.close();
            group = new ShutdownGroup(ShutdownConfig.builder().failOnServiceError(true).build());
            IllegalStateException failure = new IllegalStateException("boom");
            RecordingService ok = RecordingService.immediate("ok");
            group.push(new RecordingService("bad", force -> CompletableFuture.failedFuture(failure)));
            group.push(ok);

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> group.shutdownAll(null).get(5, TimeUnit.SECONDS));

            ShutdownException cause = assertInstanceOf(ShutdownException.class, e.getCause());
            assertEquals(ShutdownException.Reason.SERVICE_FAILURE, cause.reason());
            assertEquals(2, cause.report().serviceCount());
            assertSame(failure, cause.getSuppressed()[0]);
            assertEquals(1, ok.calls());
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Unnamed services get an index based name")
        void unnamedService() throws Exception {
            group.push(new Graceful() {
                @Override
                public CompletionStage<Void> shutdown(ForceSignal force) {
                    return CompletableFuture.completedFuture(null);
                }
            });

            ShutdownReport report = group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertEquals("service-0", report.outcomes().get(0).serviceName());
        }

        @Test
        @DisplayName("Failing name lookup falls back to an index based name")
        void failingNameLookup() throws Exception {
            RecordingService ok = RecordingService.immediate("ok");
            group.push(ok);
            group.push(new Graceful() {
                @Override
                public CompletionStage<Void> shutdown(ForceSignal force) {
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public String name() {
                    throw new IllegalStateException("name unavailable");
                }
            });

            ShutdownReport report = group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertEquals("service-1", report.outcomes().get(1).serviceName());
            assertTrue(report.isSuccess());
            assertEquals(1, ok.calls());
            assertTrue(group.isTerminated());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listener sees start, each service and completion")
        void listenerEvents() throws Exception {
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            AtomicReference<ShutdownReport> completed = new AtomicReference<>();
            group.addListener(new ShutdownListener() {
                @Override
                public void onShutdownStarted(int serviceCount, boolean forceSupplied) {
                    events.add("started:" + serviceCount + ":" + forceSupplied);
                }

                @Override
                public void onServiceShutdown(ShutdownReport.ServiceOutcome outcome) {
                    events.add("service:" + outcome.serviceName());
                }

                @Override
                public void onShutdownComplete(ShutdownReport report) {
                    completed.set(report);
                }
            });
            group.push(RecordingService.immediate("a"));
            group.push(RecordingService.immediate("b"));

            ShutdownReport report = group.shutdownAll(ForceSignal.fired()).get(5, TimeUnit.SECONDS);

            assertEquals("started:2:true", events.get(0));
            assertTrue(events.containsAll(List.of("service:a", "service:b")));
            assertSame(report, completed.get());
        }

        @Test
        @DisplayName("Failing listener does not break shutdown")
        void failingListener() throws Exception {
            group.addListener(report -> {
                throw new IllegalStateException("listener failure");
            });
            group.push(RecordingService.immediate("a"));

            assertTrue(group.shutdownAll(null).get(5, TimeUnit.SECONDS).isSuccess());
        }

        @Test
        @DisplayName("Removed listener is not called")
        void removedListener() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ShutdownListener listener = report -> calls.incrementAndGet();
            group.addListener(listener);

            assertTrue(group.removeListener(listener));
            group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertEquals(0, calls.get());
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("Forces every service down and blocks until done")
        void closeForcesShutdown() {
            AtomicInteger finished = new AtomicInteger();
            RecordingService slow = new RecordingService("slow", force -> force.future()
                    .thenRunAsync(() -> {
                        sleep(50);
                        finished.incrementAndGet();
                    }));
            group.push(slow);

            group.close();

            assertEquals(1, finished.get());
            assertTrue(slow.lastForce().isFired());
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Close after shutdown started does nothing")
        void closeAfterShutdown() {
            RecordingService pending = RecordingService.untilForced("pending");
            group.push(pending);
            CompletableFuture<ShutdownReport> done = group.shutdownAll(null);

            group.close();
            group.close();

            assertFalse(done.isDone());
            assertEquals(1, pending.calls());
            assertEquals(ShutdownPhase.SHUTTING_DOWN, group.phase());
        }

        @Test
        @DisplayName("Close from a shutdown worker thread is rejected")
        void closeFromWorkerRejected() throws Exception {
            ShutdownGroup inner = new ShutdownGroup();
            AtomicReference<Throwable> thrown = new AtomicReference<>();
            group.push(new RecordingService("closer", force -> {
                try {
                    inner.close();
                } catch (IllegalStateException e) {
                    thrown.set(e);
                }
                return CompletableFuture.completedFuture(null);
            }));

            group.shutdownAll(null).get(5, TimeUnit.SECONDS);

            assertInstanceOf(IllegalStateException.class, thrown.get());
            assertFalse(inner.isShuttingDown());
            inner.close();
            assertTrue(inner.isTerminated());
        }

        @Test
        @DisplayName("Close on empty group terminates it")
        void closeEmptyGroup() {
            group.close();

            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Discarded group forces its services down with a fired signal")
        @Timeout(30)
        void discardedGroupForcesShutdown() throws InterruptedException {
            CountDownLatch shutDown = new CountDownLatch(1);
            AtomicReference<ForceSignal> received = new AtomicReference<>();
            long discardedBefore = ShutdownCleaner.getDiscardedCount();

            discardGroup(shutDown, received);
            for (int i = 0; i < 100 && shutDown.getCount() > 0; i++) {
                System.gc();
                shutDown.await(100, TimeUnit.MILLISECONDS);
            }

            assertEquals(0, shutDown.getCount(), "discarded group was never shut down");
            assertTrue(received.get().isFired());
            assertTrue(ShutdownCleaner.getDiscardedCount() >= discardedBefore + 1);
        }
    }

    @Nested
    @DisplayName("waitToTerminate")
    class WaitToTerminateTests {

        private TerminationSignal signal;

        @BeforeEach
        void setUpSignal() {
            signal = new TerminationSignal();
        }

        @Test
        @DisplayName("First notification shuts down gracefully, second forces")
        void twoPhaseShutdown() throws Exception {
            RecordingService a = RecordingService.untilForced("a");
            RecordingService b = RecordingService.untilForced("b");
            group.push(a);
            group.push(b);

            CompletableFuture<Void> done = group.waitToTerminate(signal);
            assertEquals(1, signal.subscriberCount());
            assertFalse(done.isDone());

            signal.publish();
            awaitCalls(a, b);
            Thread.sleep(100);
            assertFalse(done.isDone());
            assertFalse(a.lastForce().isFired());

            signal.publish();
            done.get(5, TimeUnit.SECONDS);

            assertTrue(a.lastForce().isFired());
            assertTrue(b.lastForce().isFired());
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Quick services finish after a single notification")
        void quickServices() throws Exception {
            group.push(RecordingService.immediate("quick"));

            CompletableFuture<Void> done = group.waitToTerminate(signal);
            signal.publish();

            done.get(5, TimeUnit.SECONDS);
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Shutdown already in progress completes normally")
        void alreadyShuttingDown() throws Exception {
            RecordingService pending = RecordingService.untilForced("pending");
            group.push(pending);
            group.shutdownAll(null);

            CompletableFuture<Void> done = group.waitToTerminate(signal);
            signal.publish();

            done.get(5, TimeUnit.SECONDS);
            assertEquals(1, pending.calls());
        }

        @Test
        @DisplayName("Service failures do not fail the wait")
        void failuresSwallowedIntoLog() throws Exception {
            group.close();
            group = new ShutdownGroup(ShutdownConfig.builder().failOnServiceError(true).build());
            group.push(new RecordingService(
                    "bad", force -> CompletableFuture.failedFuture(new IllegalStateException("boom"))));

            CompletableFuture<Void> done = group.waitToTerminate(signal);
            signal.publish();

            done.get(5, TimeUnit.SECONDS);
            assertTrue(group.isTerminated());
        }

        @Test
        @DisplayName("Subscription is closed once done")
        void subscriptionClosed() throws Exception {
            group.push(RecordingService.immediate("quick"));

            CompletableFuture<Void> done = group.waitToTerminate(signal);
            signal.publish();
            done.get(5, TimeUnit.SECONDS);

            assertEquals(0, signal.subscriberCount());
        }

        @Test
        @DisplayName("Several groups share one signal")
        void sharedSignal() throws Exception {
            ShutdownGroup other = new ShutdownGroup();
            group.push(RecordingService.immediate("a"));
            other.push(RecordingService.immediate("b"));

            CompletableFuture<Void> first = group.waitToTerminate(signal);
            CompletableFuture<Void> second = other.waitToTerminate(signal);
            assertEquals(2, signal.publish());

            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
            assertTrue(other.isTerminated());
        }
    }

    /** Creates a group with one recording service and drops it without close(). */
    private static void discardGroup(CountDownLatch shutDown, AtomicReference<ForceSignal> received) {
        ShutdownGroup discarded = new ShutdownGroup();
        discarded.push(new RecordingService("discarded", force -> {
            received.set(force);
            shutDown.countDown();
            return CompletableFuture.completedFuture(null);
        }));
    }

    private static void awaitCalls(RecordingService... services) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        for (RecordingService service : services) {
            while (service.calls() == 0) {
                if (System.nanoTime() > deadline) {
                    fail("Service " + service.name() + " was never shut down");
                }
                Thread.sleep(5);
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
