package express.mvp.myra.shutdown;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for the workers that dispatch service shutdowns.
 *
 * <p>Threads are named "{prefix}-{counter}". Threads created here are recognisable through
 * {@link #isShutdownWorker(Thread)}, which lets a group refuse to block one of its own workers
 * while waiting for the services those workers run.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 */
public final class ShutdownThreadFactory implements ThreadFactory {

    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;

    private final boolean daemon;

    /**
     * Creates a factory producing daemon threads.
     *
     * @param namePrefix the prefix for thread names
     */
    public ShutdownThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public ShutdownThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Checks whether {@code thread} was created by a shutdown thread factory.
     *
     * @param thread the thread to check
     * @return true for shutdown workers
     */
    public static boolean isShutdownWorker(Thread thread) {
        return thread instanceof WorkerThread;
    }

    /**
     * Creates a new, unstarted worker thread.
     *
     * @param runnable the task to execute
     * @return a new thread (not started)
     */
    @Override
    public Thread newThread(Runnable runnable) {
        long count = threadCount.incrementAndGet();
        Thread thread = new WorkerThread(runnable, namePrefix + "-" + count);
        thread.setDaemon(daemon);
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    /**
     * Returns the name prefix used for thread naming.
     *
     * @return the name prefix
     */
    public String getNamePrefix() {
        return namePrefix;
    }

    /**
     * Returns whether this factory creates daemon threads.
     *
     * @return true if daemon threads are created
     */
    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "ShutdownThreadFactory["
                + "prefix=" + namePrefix
                + ", created=" + threadCount.get()
                + "]";
    }

    private static final class WorkerThread extends Thread {
        WorkerThread(Runnable runnable, String name) {
            super(runnable, name);
        }
    }
}
