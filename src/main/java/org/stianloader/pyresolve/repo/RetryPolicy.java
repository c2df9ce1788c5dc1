package org.stianloader.pyresolve.repo;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.internal.ConcurrencyUtil;
import org.stianloader.pyresolve.logging.LoggingAdapter;

/**
 * Retry with exponential backoff for transient index failures.
 *
 * <p>Only failures accepted by the retryable predicate are retried; by default that is any
 * {@link IOException} (connection errors, timeouts, HTTP 5xx and 429) except {@link FileNotFoundException}.
 * Other failures, such as {@link ProjectNotFoundException}, are passed through unchanged. Once the attempts are
 * exhausted the operation fails with an {@link IndexUnavailableException} carrying the last failure.
 */
public final class RetryPolicy {

    @NotNull
    public static final Predicate<Throwable> DEFAULT_RETRYABLE = (t) -> t instanceof IOException && !(t instanceof FileNotFoundException);

    @NotNull
    public static final RetryPolicy DEFAULT = new RetryPolicy(4, 500L, 2.0D, 8_000L, RetryPolicy.DEFAULT_RETRYABLE);

    /**
     * A policy that performs a single attempt only.
     */
    @NotNull
    public static final RetryPolicy NONE = new RetryPolicy(1, 0L, 1.0D, 0L, RetryPolicy.DEFAULT_RETRYABLE);

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final double multiplier;
    private final long maxDelayMillis;
    @NotNull
    private final Predicate<Throwable> retryable;

    public RetryPolicy(int maxAttempts, long initialDelayMillis, double multiplier, long maxDelayMillis, @NotNull Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, but is " + maxAttempts);
        }
        if (initialDelayMillis < 0 || maxDelayMillis < 0 || multiplier < 1.0D) {
            throw new IllegalArgumentException("Delays must not be negative and the multiplier must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelayMillis;
        this.multiplier = multiplier;
        this.maxDelayMillis = maxDelayMillis;
        this.retryable = retryable;
    }

    /**
     * Obtains the delay that is waited before performing the given attempt.
     *
     * @param attempt The 1-based number of the attempt that is about to be performed
     * @return The delay in milliseconds, 0 for the first attempt
     */
    @Contract(pure = true)
    public long getDelayMillis(int attempt) {
        if (attempt <= 1) {
            return 0L;
        }
        double delay = this.initialDelayMillis * Math.pow(this.multiplier, attempt - 2);
        return (long) Math.min(delay, this.maxDelayMillis);
    }

    @Contract(pure = true)
    public int getMaxAttempts() {
        return this.maxAttempts;
    }

    @Contract(pure = true)
    public boolean isRetryable(@NotNull Throwable t) {
        return this.retryable.test(ConcurrencyUtil.unwrap(t));
    }

    /**
     * Runs an asynchronous operation, repeating it while it fails with a retryable failure.
     * Cancelling the returned future cancels the attempt in flight and any pending retry.
     *
     * @param <T> The result type
     * @param operation Factory for a single attempt
     * @param indexId The id of the index the operation targets, used for error reporting
     * @param resource Description of the requested resource, used for error reporting
     * @param executor The executor on which delayed retries are started
     * @return A future that completes with the first successful result
     */
    @NotNull
    public <T> CompletableFuture<T> execute(@NotNull Supplier<CompletableFuture<T>> operation, @NotNull String indexId, @NotNull String resource, @NotNull Executor executor) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<T>> inFlight = new AtomicReference<>();
        result.whenComplete((value, ex) -> {
            if (result.isCancelled()) {
                CompletableFuture<T> current = inFlight.get();
                if (current != null) {
                    current.cancel(true);
                }
            }
        });
        this.attempt(operation, indexId, resource, executor, 1, result, inFlight);
        return result;
    }

    private <T> void attempt(@NotNull Supplier<CompletableFuture<T>> operation, @NotNull String indexId, @NotNull String resource,
            @NotNull Executor executor, int attempt, @NotNull CompletableFuture<T> result, @NotNull AtomicReference<CompletableFuture<T>> inFlight) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<T> future = ConcurrencyUtil.scheduleDelayed(operation, this.getDelayMillis(attempt), executor);
        inFlight.set(future);
        if (result.isCancelled()) {
            future.cancel(true);
            return;
        }
        future.whenComplete((value, ex) -> {
            if (ex == null) {
                result.complete(value);
                return;
            }
            Throwable cause = ConcurrencyUtil.unwrap(ex);
            if (cause instanceof CancellationException || result.isDone()) {
                result.completeExceptionally(cause);
            } else if (!this.isRetryable(cause)) {
                result.completeExceptionally(cause);
            } else if (attempt >= this.maxAttempts) {
                LoggingAdapter.getDefaultLogger().error(RetryPolicy.class, "Index '{}' failed to serve {} after {} attempts: {}", indexId, resource, attempt, cause.toString());
                result.completeExceptionally(new IndexUnavailableException(indexId, resource, attempt, cause));
            } else {
                LoggingAdapter.getDefaultLogger().warn(RetryPolicy.class, "Fetching {} from index '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        resource, indexId, attempt, this.maxAttempts, this.getDelayMillis(attempt + 1), cause.toString());
                this.attempt(operation, indexId, resource, executor, attempt + 1, result, inFlight);
            }
        });
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + this.maxAttempts + ", initialDelay=" + this.initialDelayMillis + "ms, multiplier="
                + this.multiplier + ", maxDelay=" + this.maxDelayMillis + "ms]";
    }
}
