package express.mvp.myra.resilience;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for the scheduler behind retry delays and error reports.
 *
 * <p>Threads are named "{prefix}-{counter}" and are daemon threads by default, so a forgotten
 * {@link Resilience#close()} does not keep the JVM alive.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe.
 */
public final class ResilienceThreadFactory implements ThreadFactory {

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;
    private final boolean daemon;

    /**
     * Creates a factory producing daemon threads.
     *
     * @param namePrefix the prefix for thread names
     */
    public ResilienceThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads are daemon threads
     */
    public ResilienceThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }

    /**
     * Returns the number of threads created so far.
     *
     * @return the thread count
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    /**
     * Returns the thread name prefix.
     *
     * @return the prefix
     */
    public String getNamePrefix() {
        return namePrefix;
    }

    /**
     * Checks if created threads are daemon threads.
     *
     * @return the daemon flag
     */
    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "ResilienceThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
