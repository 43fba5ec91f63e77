package express.mvp.rebound;

import express.mvp.rebound.policy.RetryPolicy;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Semantic operation categories bound to a retry preset.
 *
 * <p>Categories only choose a policy; they do not change how retries behave.
 *
 * <ul>
 *   <li><b>NETWORK:</b> Plain network calls, {@link RetryPolicy#aggressive()}
 *   <li><b>DATABASE:</b> Database reads and storage writes, {@link RetryPolicy#defaults()}
 *   <li><b>UPLOAD:</b> Large or expensive uploads, {@link RetryPolicy#conservative()}
 * </ul>
 */
public enum RetryCategory {
    NETWORK(RetryPolicy::aggressive),
    DATABASE(RetryPolicy::defaults),
    UPLOAD(RetryPolicy::conservative);

    private final Supplier<RetryPolicy> policy;

    RetryCategory(Supplier<RetryPolicy> policy) {
        this.policy = policy;
    }

    /**
     * Returns the preset bound to this category.
     *
     * @return the retry policy
     */
    public RetryPolicy policy() {
        return policy.get();
    }

    /**
     * Returns the operation name used when the caller does not supply one.
     *
     * @return lower-case category name
     */
    String operationName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
