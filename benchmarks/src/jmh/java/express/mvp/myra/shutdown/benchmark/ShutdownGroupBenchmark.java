package express.mvp.myra.shutdown.benchmark;

import express.mvp.myra.shutdown.Graceful;
import express.mvp.myra.shutdown.ShutdownGroup;
import express.mvp.myra.shutdown.ShutdownReport;
import express.mvp.myra.shutdown.signal.ForceSignal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Measures the cost of one complete shutdown sequence.
 *
 * <p>{@code graceful} shuts down services that complete at once. {@code forced} shuts down
 * services that wait for the force signal, which is fired only after every service was
 * dispatched, so the fan-out of the signal to each service is part of the measurement.
 */
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ShutdownGroupBenchmark {

    private static final Graceful IMMEDIATE = force -> CompletableFuture.completedFuture(null);

    private static final Graceful UNTIL_FORCED = ShutdownGroupBenchmark::untilForced;

    @Param({"1", "16", "128"})
    public int services;

    @Benchmark
    public void graceful(GracefulGroup state, Blackhole bh) {
        bh.consume(state.group.shutdownAll(null).join());
    }

    @Benchmark
    public void forced(ForcedGroup state, Blackhole bh) {
        CompletableFuture<Void> trigger = new CompletableFuture<>();
        CompletableFuture<ShutdownReport> done = state.group.shutdownAll(ForceSignal.from(trigger));
        trigger.complete(null);
        bh.consume(done.join());
    }

    /** Fresh group of immediately completing services for every invocation. */
    @State(Scope.Thread)
    public static class GracefulGroup {
        ShutdownGroup group;

        @Setup(Level.Invocation)
        public void setup(ShutdownGroupBenchmark benchmark) {
            group = newGroup(benchmark.services, IMMEDIATE);
        }
    }

    /** Fresh group of services that wait for the force signal, for every invocation. */
    @State(Scope.Thread)
    public static class ForcedGroup {
        ShutdownGroup group;

        @Setup(Level.Invocation)
        public void setup(ShutdownGroupBenchmark benchmark) {
            group = newGroup(benchmark.services, UNTIL_FORCED);
        }
    }

    private static ShutdownGroup newGroup(int services, Graceful service) {
        ShutdownGroup group = new ShutdownGroup();
        for (int i = 0; i < services; i++) {
            group.push(service);
        }
        return group;
    }

    private static CompletionStage<Void> untilForced(ForceSignal force) {
        return force.future();
    }
}
