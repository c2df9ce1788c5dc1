package org.stianloader.pyresolve.resolver;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.internal.AsyncMemoizer;
import org.stianloader.pyresolve.metadata.CoreMetadata;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.IndexAttachedValue;

/**
 * Caches the results of network lookups that do not depend on the target environment: the merged project pages
 * of the indexes and the core metadata of distributions. Entries are populated at most once; concurrent lookups of
 * the same key share the same future.
 */
public class ResolutionCache {
    @NotNull
    private final AsyncMemoizer<String, List<IndexAttachedValue<DistributionLink>>> projectPages = new AsyncMemoizer<>();
    @NotNull
    private final AsyncMemoizer<String, CoreMetadata> metadata = new AsyncMemoizer<>();
    private final long createdAt;
    private final boolean shared;

    public ResolutionCache() {
        this(System.currentTimeMillis(), false);
    }

    /**
     * Creates a cache.
     *
     * @param createdAt The creation timestamp, in milliseconds since the epoch
     * @param shared Whether several resolution runs may use the cache at the same time. Runs do not cancel the
     * outstanding lookups of a shared cache when they end, as other runs may still await them.
     */
    public ResolutionCache(long createdAt, boolean shared) {
        this.createdAt = createdAt;
        this.shared = shared;
    }

    /**
     * Cancels all lookups that are still in flight and forgets about them.
     *
     * @return The amount of cancelled lookups
     */
    public int cancelPending() {
        return this.projectPages.cancelPending() + this.metadata.cancelPending();
    }

    /**
     * Forgets all failed lookups, so that a later run retries them.
     */
    public void evictFailures() {
        this.projectPages.evictFailed();
        this.metadata.evictFailed();
    }

    @Contract(pure = true)
    public long getCreatedAt() {
        return this.createdAt;
    }

    /**
     * Obtains the metadata of a distribution, keyed by the URL of the distribution file. Runs for other environments
     * may pick other files of the same version, so the candidate itself is not a suitable key.
     *
     * @param candidate The candidate
     * @param loader Performs the lookup for the candidate without extras if the metadata is not cached yet
     * @return The future metadata
     */
    @NotNull
    public CompletableFuture<CoreMetadata> getMetadata(@NotNull Candidate candidate, @NotNull Function<Candidate, CompletableFuture<CoreMetadata>> loader) {
        Candidate base = candidate.getBase();
        return this.metadata.get(base.getSourceUrl(), (url) -> loader.apply(base));
    }

    @NotNull
    public CompletableFuture<List<IndexAttachedValue<DistributionLink>>> getProjectPage(@NotNull String name, @NotNull Function<String, CompletableFuture<List<IndexAttachedValue<DistributionLink>>>> loader) {
        return this.projectPages.get(name, loader);
    }

    @Contract(pure = true)
    public boolean isShared() {
        return this.shared;
    }

    @Contract(pure = true)
    public boolean isExpired(long now, long maxAgeMillis) {
        return now - this.createdAt > maxAgeMillis;
    }

    @Contract(pure = true)
    public int size() {
        return this.projectPages.size() + this.metadata.size();
    }
}
