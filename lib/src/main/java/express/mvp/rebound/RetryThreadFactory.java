package express.mvp.rebound;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the daemon threads of a coordinator's own scheduler and worker pool, named
 * "{prefix}-{n}". Daemon threads let the JVM exit even if a coordinator is never closed.
 */
final class RetryThreadFactory implements ThreadFactory {

    private final AtomicInteger created = new AtomicInteger();
    private final String prefix;

    RetryThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + "-" + created.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
