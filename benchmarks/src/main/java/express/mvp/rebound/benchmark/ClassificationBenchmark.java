package express.mvp.rebound.benchmark;

import express.mvp.rebound.error.ConnectivityCode;
import express.mvp.rebound.error.ErrorClass;
import express.mvp.rebound.error.ErrorDomain;
import express.mvp.rebound.error.ExceptionTranslator;
import express.mvp.rebound.error.OperationException;
import express.mvp.rebound.error.ServiceCode;
import express.mvp.rebound.error.TableErrorClassifier;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Micro-benchmark of error classification.
 *
 * <p>Classification runs once per failed attempt, so it should stay far below the cost of the
 * operation being retried. Measures:
 *
 * <ul>
 *   <li>Direct structured error - table lookup only
 *   <li>Wrapped structured error - cause chain walk plus lookup
 *   <li>Unstructured error - full chain walk ending in UNKNOWN
 *   <li>Translate then classify - boundary translation of a JDK exception
 * </ul>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ClassificationBenchmark {

    private TableErrorClassifier classifier;
    private OperationException structured;
    private Throwable wrapped;
    private Throwable unstructured;
    private ConnectException jdkException;

    @Setup(Level.Trial)
    public void setup() {
        classifier = TableErrorClassifier.standard();
        structured =
                new OperationException(
                        ErrorDomain.CONNECTIVITY, ConnectivityCode.TIMED_OUT, "timed out");
        wrapped =
                new CompletionException(
                        new RuntimeException(
                                new OperationException(ServiceCode.UNAVAILABLE, "unavailable")));
        unstructured = new IllegalStateException("bug", new RuntimeException("inner"));
        jdkException = new ConnectException("refused");
    }

    @Benchmark
    public ErrorClass classifyStructured() {
        return classifier.classify(structured);
    }

    @Benchmark
    public ErrorClass classifyWrapped() {
        return classifier.classify(wrapped);
    }

    @Benchmark
    public ErrorClass classifyUnstructured() {
        return classifier.classify(unstructured);
    }

    @Benchmark
    public ErrorClass translateAndClassify() {
        return classifier.classify(ExceptionTranslator.translate(jdkException));
    }
}
