package express.mvp.rebound;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Receives the final outcome of a retry sequence.
 *
 * <p>Exactly one of the two methods is invoked, exactly once, after the sequence finished.
 * Callbacks run on a coordinator thread and should return quickly.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * coordinator.run(RetryPolicy.defaults(), () -> profiles.load(id),
 *     RetryCallback.of(
 *         profile -> view.show(profile),
 *         error -> view.showError(error)));
 * }</pre>
 *
 * @param <T> the result type
 */
public interface RetryCallback<T> {

    /**
     * Called when an attempt succeeded.
     *
     * @param value the result, may be null
     */
    void onSuccess(T value);

    /**
     * Called when the sequence failed or was cancelled.
     *
     * @param error the last attempt's error, or a {@link
     *     java.util.concurrent.CancellationException}
     */
    void onFailure(Throwable error);

    /**
     * Creates a callback from two consumers.
     *
     * @param onSuccess success consumer
     * @param onFailure failure consumer
     * @param <T> the result type
     * @return new callback
     */
    static <T> RetryCallback<T> of(Consumer<? super T> onSuccess, Consumer<Throwable> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return new RetryCallback<>() {
            @Override
            public void onSuccess(T value) {
                onSuccess.accept(value);
            }

            @Override
            public void onFailure(Throwable error) {
                onFailure.accept(error);
            }
        };
    }
}
