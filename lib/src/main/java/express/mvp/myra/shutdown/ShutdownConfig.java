package express.mvp.myra.shutdown;

import express.mvp.myra.shutdown.signal.TerminationHandle;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for a {@link ShutdownGroup} and its termination handle.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Shutdown Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>threadNamePrefix</td><td>myra-shutdown</td><td>Prefix of shutdown worker threads</td></tr>
 *   <tr><td>daemonThreads</td><td>true</td><td>Whether workers are daemon threads</td></tr>
 *   <tr><td>failOnServiceError</td><td>false</td><td>Fail the composite shutdown if any
 *       service fails</td></tr>
 *   <tr><td>terminationSignals</td><td>[INT]</td><td>OS signals bridged by the termination
 *       handle</td></tr>
 * </table>
 *
 * <h2>Service Failures</h2>
 *
 * <p>By default a failing service does not fail the group: every outcome is reported in the
 * {@link ShutdownReport}. With {@code failOnServiceError(true)} the composite future instead
 * completes exceptionally with a {@link ShutdownException} carrying the same report. Either way,
 * every service runs to completion.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownConfig config = ShutdownConfig.builder()
 *     .threadNamePrefix("ingest-shutdown")
 *     .failOnServiceError(true)
 *     .terminationSignals(List.of("INT", "TERM"))
 *     .build();
 *
 * ShutdownGroup group = new ShutdownGroup(config);
 * }</pre>
 */
public final class ShutdownConfig {

    private final String threadNamePrefix;

    private final boolean daemonThreads;

    private final boolean failOnServiceError;

    /** OS signal names, without the SIG prefix. */
    private final List<String> terminationSignals;

    private ShutdownConfig(Builder builder) {
        this.threadNamePrefix = builder.threadNamePrefix;
        this.daemonThreads = builder.daemonThreads;
        this.failOnServiceError = builder.failOnServiceError;
        this.terminationSignals = builder.terminationSignals;
    }

    /**
     * Creates a new builder for constructing configuration.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration with default values.
     *
     * @return default configuration
     */
    public static ShutdownConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the prefix for shutdown worker thread names.
     *
     * @return the name prefix
     */
    public String threadNamePrefix() {
        return threadNamePrefix;
    }

    /**
     * Returns whether shutdown workers are daemon threads.
     *
     * @return true for daemon workers
     */
    public boolean daemonThreads() {
        return daemonThreads;
    }

    /**
     * Returns whether a service failure fails the composite shutdown.
     *
     * @return true to fail the composite future on any service failure
     */
    public boolean failOnServiceError() {
        return failOnServiceError;
    }

    /**
     * Returns the OS signals bridged by {@link ShutdownGroup#installTerminationHandle(ShutdownConfig)}.
     *
     * @return unmodifiable list of signal names
     */
    public List<String> terminationSignals() {
        return terminationSignals;
    }

    @Override
    public String toString() {
        return "ShutdownConfig["
                + "threadNamePrefix=" + threadNamePrefix
                + ", daemonThreads=" + daemonThreads
                + ", failOnServiceError=" + failOnServiceError
                + ", terminationSignals=" + terminationSignals
                + "]";
    }

    /**
     * Builder for constructing {@link ShutdownConfig} instances.
     */
    public static final class Builder {
        private String threadNamePrefix = "myra-shutdown";
        private boolean daemonThreads = true;
        private boolean failOnServiceError = false;
        private List<String> terminationSignals = TerminationHandle.DEFAULT_SIGNALS;

        private Builder() {}

        /**
         * Sets the prefix for shutdown worker thread names.
         *
         * @param prefix the name prefix
         * @return this builder for chaining
         * @throws NullPointerException if prefix is null
         * @throws IllegalArgumentException if prefix is blank
         */
        public Builder threadNamePrefix(String prefix) {
            Objects.requireNonNull(prefix, "prefix must not be null");
            if (prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.threadNamePrefix = prefix;
            return this;
        }

        /**
         * Sets whether shutdown workers are daemon threads.
         *
         * @param daemon true for daemon workers
         * @return this builder for chaining
         */
        public Builder daemonThreads(boolean daemon) {
            this.daemonThreads = daemon;
            return this;
        }

        /**
         * Sets whether a service failure fails the composite shutdown.
         *
         * @param fail true to fail the composite future on any service failure
         * @return this builder for chaining
         */
        public Builder failOnServiceError(boolean fail) {
            this.failOnServiceError = fail;
            return this;
        }

        /**
         * Sets the OS signals bridged by the termination handle.
         *
         * @param signalNames signal names without the SIG prefix, e.g. {@code "INT"}
         * @return this builder for chaining
         * @throws NullPointerException if signalNames or an element is null
         * @throws IllegalArgumentException if signalNames is empty
         */
        public Builder terminationSignals(List<String> signalNames) {
            List<String> copy = List.copyOf(signalNames);
            if (copy.isEmpty()) {
                throw new IllegalArgumentException("At least one termination signal is required");
            }
            this.terminationSignals = copy;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable ShutdownConfig
         */
        public ShutdownConfig build() {
            return new ShutdownConfig(this);
        }
    }
}
