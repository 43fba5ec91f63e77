package express.mvp.rebound;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Suspends the calling thread between attempts of a blocking retry sequence.
 *
 * <p>Implementations must respond to interruption by throwing {@link InterruptedException};
 * the coordinator turns that into a {@link RetryCancelledException}. Tests inject a recording
 * sleeper to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks for the given duration.
     *
     * @param duration how long to wait, never negative
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns a sleeper backed by {@link TimeUnit#sleep(long)}.
     *
     * @return thread sleeper
     */
    static Sleeper threadSleep() {
        return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
