package express.mvp.rebound.benchmark;

import express.mvp.rebound.policy.JitteredBackoff;
import express.mvp.rebound.policy.RetryPolicy;
import java.time.Duration;
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
 * Micro-benchmark of backoff computation.
 *
 * <p>Compares jittered and fixed delay computation, and a full schedule walk for the preset
 * under test.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class BackoffBenchmark {

    @Param({"defaults", "aggressive"})
    public String preset;

    private RetryPolicy policy;
    private JitteredBackoff jittered;
    private JitteredBackoff fixed;

    @Setup(Level.Trial)
    public void setup() {
        policy = "aggressive".equals(preset) ? RetryPolicy.aggressive() : RetryPolicy.defaults();
        jittered = new JitteredBackoff();
        fixed = JitteredBackoff.noJitter();
    }

    @Benchmark
    public Duration jitteredDelay() {
        return jittered.nextDelay(policy.getInitialDelay(), policy);
    }

    @Benchmark
    public Duration fixedDelay() {
        return fixed.nextDelay(policy.getInitialDelay(), policy);
    }

    @Benchmark
    public void fullSchedule(Blackhole blackhole) {
        Duration current = policy.getInitialDelay();
        for (int retry = 1; retry < policy.getMaxAttempts(); retry++) {
            blackhole.consume(jittered.nextDelay(current, policy));
            current = policy.grow(current);
        }
    }
}
