package org.stianloader.pyresolve.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

public final class ConcurrencyUtil {

    /**
     * Cancels the source future once the dependent future is cancelled. Futures derived through
     * {@link CompletableFuture#thenCompose(java.util.function.Function)} and friends do not do that on their own.
     *
     * @param <T> The type of the dependent future
     * @param dependent The future handed out to callers
     * @param source The future that performs the actual work
     * @return The dependent future, for chaining
     */
    @NotNull
    public static <T> CompletableFuture<T> propagateCancellation(@NotNull CompletableFuture<T> dependent, @NotNull CompletableFuture<?> source) {
        dependent.whenComplete((ignored, ex) -> {
            if (dependent.isCancelled()) {
                source.cancel(true);
            }
        });
        return dependent;
    }

    /**
     * Runs a {@link Callable} on the given executor. If the returned future is completed (e.g. cancelled)
     * before the executor picks up the task, the task is skipped entirely.
     *
     * @param <T> The type of the computed value
     * @param source The task to run
     * @param executor The executor to run the task on
     * @return A future that completes with the result of the task
     */
    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Obtain a future that runs the supplied future factory after the given delay.
     * Cancelling the returned future before the delay elapsed prevents the factory from being invoked.
     */
    @NotNull
    public static <T> CompletableFuture<T> scheduleDelayed(@NotNull Supplier<CompletableFuture<T>> task, long delayMillis, @NotNull Executor executor) {
        if (delayMillis <= 0) {
            return task.get();
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        Executor delayed = CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS, executor);
        delayed.execute(() -> {
            if (result.isDone()) {
                return;
            }
            CompletableFuture<T> inner;
            try {
                inner = task.get();
            } catch (Throwable t) {
                result.completeExceptionally(t);
                return;
            }
            inner.whenComplete((value, ex) -> {
                if (ex == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(ConcurrencyUtil.unwrap(ex));
                }
            });
            result.whenComplete((ignored, ex) -> {
                if (result.isCancelled()) {
                    inner.cancel(true);
                }
            });
        });
        return result;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that {@link CompletableFuture}
     * puts around exceptions.
     *
     * @param t The throwable to unwrap
     * @return The innermost throwable that is not a wrapper
     */
    @NotNull
    @Contract(pure = true)
    public static Throwable unwrap(@NotNull Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Rethrows a throwable obtained from a future as-is if it is unchecked, wrapping it otherwise.
     *
     * @param t The throwable to rethrow, possibly wrapped in a {@link CompletionException}
     * @return Never returns, declared so callers can write <code>throw ConcurrencyUtil.rethrow(t)</code>
     */
    @NotNull
    public static RuntimeException rethrow(@NotNull Throwable t) {
        Throwable cause = ConcurrencyUtil.unwrap(t);
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        } else if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new CompletionException(cause);
    }

    private ConcurrencyUtil() {
        throw new UnsupportedOperationException();
    }
}
