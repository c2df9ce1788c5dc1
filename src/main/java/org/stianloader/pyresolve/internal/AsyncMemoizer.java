package org.stianloader.pyresolve.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A concurrent cache of asynchronously computed values.
 *
 * <p>Each key is populated at most once: the first caller starts the lookup and every concurrent or later caller
 * receives the very same {@link CompletableFuture}. Failed lookups stay cached as well; the values are expected to
 * be stable for the lifetime of the memoizer.
 *
 * @param <K> The key type. Keys are compared by {@link Object#equals(Object)}.
 * @param <V> The value type.
 */
public class AsyncMemoizer<K, V> {
    @NotNull
    private final ConcurrentMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();

    /**
     * Cancels all entries that have not yet completed and removes them from the cache, so
     * that the cache never hands out cancelled futures.
     *
     * @return The amount of cancelled entries
     */
    public int cancelPending() {
        List<K> cancelled = new ArrayList<>();
        this.entries.forEach((key, future) -> {
            if (!future.isDone() && future.cancel(true)) {
                cancelled.add(key);
            }
        });
        for (K key : cancelled) {
            this.entries.remove(key);
        }
        return cancelled.size();
    }

    public void clear() {
        this.entries.clear();
    }

    /**
     * Removes all entries that completed exceptionally, so that the next lookup of their keys is retried.
     *
     * @return The amount of evicted entries
     */
    public int evictFailed() {
        int evicted = 0;
        for (K key : new ArrayList<>(this.entries.keySet())) {
            CompletableFuture<V> future = this.entries.get(key);
            if (future != null && future.isCompletedExceptionally() && this.entries.remove(key, future)) {
                evicted++;
            }
        }
        return evicted;
    }

    @NotNull
    public CompletableFuture<V> get(@NotNull K key, @NotNull Function<? super K, CompletableFuture<V>> loader) {
        CompletableFuture<V> existing = this.entries.get(key);
        if (existing != null) {
            return existing;
        }
        // The loader must not run inside computeIfAbsent as it may synchronously
        // recurse into this memoizer (e.g. with a direct executor).
        CompletableFuture<V> placeholder = new CompletableFuture<>();
        existing = this.entries.putIfAbsent(key, placeholder);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<V> loaded;
        try {
            loaded = loader.apply(key);
        } catch (Throwable t) {
            placeholder.completeExceptionally(t);
            return placeholder;
        }
        loaded.whenComplete((value, ex) -> {
            if (ex == null) {
                placeholder.complete(value);
            } else {
                placeholder.completeExceptionally(ConcurrencyUtil.unwrap(ex));
            }
        });
        placeholder.whenComplete((value, ex) -> {
            if (placeholder.isCancelled()) {
                loaded.cancel(true);
            }
        });
        return placeholder;
    }

    @Nullable
    @Contract(pure = true)
    public CompletableFuture<V> getIfPresent(@NotNull K key) {
        return this.entries.get(key);
    }

    @Contract(pure = true)
    public int size() {
        return this.entries.size();
    }
}
