package express.mvp.rebound;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.rebound.policy.RetryPolicy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link RetryThreadFactory}. */
@DisplayName("RetryThreadFactory")
@SuppressFBWarnings(
        value = {"THROWS_METHOD_THROWS_CLAUSE_BASIC_EXCEPTION"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class RetryThreadFactoryTest {

    @Test
    @DisplayName("threads are unstarted daemons with numbered names")
    void threads_areNumberedDaemons() {
        RetryThreadFactory factory = new RetryThreadFactory("rebound-scheduler");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("rebound-scheduler-1", first.getName());
        assertEquals("rebound-scheduler-2", second.getName());
        assertTrue(first.isDaemon());
        assertFalse(first.isAlive());
    }

    @Test
    @DisplayName("coordinator workers run on factory threads")
    void coordinatorWorkers_useFactoryThreads() throws Exception {
        try (RetryCoordinator coordinator = RetryCoordinator.create()) {
            String name =
                    coordinator
                            .supplyAsync(
                                    RetryPolicy.noRetry(), () -> Thread.currentThread().getName())
                            .get(5, TimeUnit.SECONDS);

            assertTrue(name.startsWith("rebound-worker-"), name);
        }
    }

    @Test
    @DisplayName("works as an executor thread factory")
    void worksWithExecutors() throws Exception {
        ExecutorService executor =
                Executors.newSingleThreadExecutor(new RetryThreadFactory("pool"));
        try {
            String name =
                    executor.submit(() -> Thread.currentThread().getName())
                            .get(5, TimeUnit.SECONDS);
            assertEquals("pool-1", name);
        } finally {
            executor.shutdownNow();
        }
    }
}
