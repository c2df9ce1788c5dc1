package org.stianloader.pyresolve.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link CompletableFuture} that only completes once all source futures complete,
 * exceptionally or not. The resulting future only completes exceptionally if all sources
 * complete exceptionally, otherwise it completes with the values of the successful sources,
 * in the order of the sources. Failures of individual sources can be inspected through
 * {@link #getFailures()} after completion.
 */
public class StronglyMultiCompletableFuture<T> extends CompletableFuture<List<T>> {

    static class MultiCompletionException extends CompletionException {

        private static final long serialVersionUID = 4208375813530446381L;

        public MultiCompletionException(Throwable[] causers) {
            super("All sources completed exceptionally", null);
            for (Throwable t : causers) {
                if (t != null) {
                    this.addSuppressed(t);
                }
            }
        }
    }

    private final CompletableFuture<T>[] sources;
    private final Object[] results;
    private final Throwable[] exceptions;
    private int completions;
    private int exceptionally;

    @SuppressWarnings("unchecked")
    public StronglyMultiCompletableFuture(@NotNull List<CompletableFuture<T>> sources) {
        this(sources.toArray(new CompletableFuture[0]));
    }

    @SafeVarargs
    public StronglyMultiCompletableFuture(@NotNull CompletableFuture<T>... sources) {
        this.sources = sources;
        this.exceptions = new Throwable[sources.length];
        this.results = new Object[sources.length];
        for (int i = 0; i < sources.length; i++) {
            final int futureIndex = i;
            sources[i].whenComplete((result, ex) -> {
                if (ex == null) {
                    this.sourceCompleted(futureIndex, result);
                } else {
                    this.sourceException(futureIndex, ConcurrencyUtil.unwrap(ex));
                }
            });
        }
        if (sources.length == 0) {
            this.complete(new ArrayList<>());
        }
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        if (cancelled) {
            for (CompletableFuture<T> source : this.sources) {
                source.cancel(mayInterruptIfRunning);
            }
        }
        return cancelled;
    }

    @NotNull
    protected CompletionException generateException() {
        synchronized (this) {
            return new MultiCompletionException(this.exceptions);
        }
    }

    /**
     * Obtains the exceptions of all sources that completed exceptionally so far.
     *
     * @return The failures, in source order
     */
    @NotNull
    public List<@NotNull Throwable> getFailures() {
        List<Throwable> failures = new ArrayList<>();
        synchronized (this) {
            for (Throwable t : this.exceptions) {
                if (t != null) {
                    failures.add(t);
                }
            }
        }
        return Collections.unmodifiableList(failures);
    }

    @SuppressWarnings("unchecked")
    private void onSettled() {
        if (++this.completions != this.results.length || this.isDone()) {
            return;
        }
        if (this.exceptionally == this.results.length) {
            this.completeExceptionally(this.generateException());
            return;
        }
        List<T> values = new ArrayList<>();
        for (int i = 0; i < this.results.length; i++) {
            if (this.exceptions[i] == null) {
                values.add((T) this.results[i]);
            }
        }
        this.complete(values);
    }

    private void sourceCompleted(int i, @Nullable T result) {
        synchronized (this) {
            this.results[i] = result;
            this.onSettled();
        }
    }

    private void sourceException(int i, @NotNull Throwable exception) {
        Objects.requireNonNull(exception);
        synchronized (this) {
            this.exceptions[i] = exception;
            this.exceptionally++;
            this.onSettled();
        }
    }
}
