package express.mvp.myra.shutdown.signal;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import sun.misc.Signal;

/**
 * Bridges OS termination signals into a {@link TerminationSignal}.
 *
 * <p>Each time the operating system delivers one of the configured signals (by default
 * {@code SIGINT}, i.e. Ctrl-C), one notification is published. The first notification asks
 * services to shut down gracefully, the second forces them (see
 * {@link express.mvp.myra.shutdown.ShutdownGroup#waitToTerminate(TerminationSignal)}).
 *
 * <h2>Process Scope</h2>
 *
 * <p>The handler is process-wide state: {@link #install()} may be called once per process and the
 * returned signal can be shared by any number of shutdown groups. It is never uninstalled.
 *
 * <h2>Delivery Failure</h2>
 *
 * <p>The handler runs on the JVM's signal dispatch thread, where there is no caller to report an
 * error to. If a notification cannot be published, the failure is logged and the process halts
 * with status 1.
 *
 * <pre>{@code
 * TerminationSignal signal = TerminationHandle.install();
 * group.waitToTerminate(signal).join();
 * }</pre>
 */
@SuppressWarnings("restriction")
public final class TerminationHandle {

    private static final Logger LOGGER = Logger.getLogger(TerminationHandle.class.getName());

    /** Signals bridged when none are configured. */
    public static final List<String> DEFAULT_SIGNALS = List.of("INT");

    /** Exit status used when a notification cannot be delivered. */
    static final int DELIVERY_FAILURE_STATUS = 1;

    private static final AtomicBoolean INSTALLED = new AtomicBoolean(false);

    private TerminationHandle() {
        // Utility class
    }

    /**
     * Installs the bridge for {@link #DEFAULT_SIGNALS}.
     *
     * @return the signal receiving one notification per OS delivery
     * @throws IllegalStateException if already installed in this process, or if the OS handler
     *     cannot be registered
     */
    public static TerminationSignal install() {
        return install(DEFAULT_SIGNALS);
    }

    /**
     * Installs the bridge for the given OS signal names (for example {@code "INT"} or
     * {@code "TERM"}).
     *
     * @param signalNames names of the signals to bridge
     * @return the signal receiving one notification per OS delivery
     * @throws IllegalStateException if already installed in this process, or if an OS handler
     *     cannot be registered
     * @throws IllegalArgumentException if signalNames is empty
     */
    public static TerminationSignal install(List<String> signalNames) {
        Objects.requireNonNull(signalNames, "signalNames must not be null");
        if (!INSTALLED.compareAndSet(false, true)) {
            throw new IllegalStateException("Termination handle is already installed in this process");
        }
        try {
            return install(signalNames, TerminationHandle::registerOsHandler, TerminationHandle::halt);
        } catch (RuntimeException e) {
            // Allow a later install to try again
            INSTALLED.set(false);
            throw e;
        }
    }

    /**
     * Returns whether the process-wide bridge has been installed.
     *
     * @return true after a successful {@link #install()}
     */
    public static boolean isInstalled() {
        return INSTALLED.get();
    }

    static TerminationSignal install(
            List<String> signalNames, SignalRegistrar registrar, IntConsumer terminator) {
        if (signalNames.isEmpty()) {
            throw new IllegalArgumentException("At least one signal name is required");
        }
        TerminationSignal signal = new TerminationSignal();
        Runnable handler = () -> deliver(signal, terminator);
        for (String name : signalNames) {
            try {
                registrar.register(name, handler);
            } catch (RuntimeException e) {
                throw new IllegalStateException("Error setting handler for SIG" + name, e);
            }
            LOGGER.fine(() -> "Installed termination handler for SIG" + name);
        }
        return signal;
    }

    static void deliver(TerminationSignal signal, IntConsumer terminator) {
        try {
            signal.publish();
        } catch (SignalDeliveryException e) {
            LOGGER.log(Level.SEVERE, "Could not send termination signal", e);
            terminator.accept(DELIVERY_FAILURE_STATUS);
        }
    }

    private static void registerOsHandler(String name, Runnable handler) {
        Signal.handle(new Signal(name), received -> handler.run());
    }

    private static void halt(int status) {
        Runtime.getRuntime().halt(status);
    }

    /** Hook that attaches a handler to a named OS signal. */
    @FunctionalInterface
    interface SignalRegistrar {

        /**
         * Registers {@code handler} to run each time the named signal is delivered.
         *
         * @param signalName the OS signal name without the {@code SIG} prefix
         * @param handler the handler to run
         */
        void register(String signalName, Runnable handler);
    }
}
