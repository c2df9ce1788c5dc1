package org.stianloader.pyresolve.repo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.internal.StronglyMultiCompletableFuture;
import org.stianloader.pyresolve.logging.LoggingAdapter;

/**
 * The index negotiator queries all configured {@link PackageIndex indexes} for a project and merges the answers.
 *
 * <p><ul>
 * <li>All indexes are queried concurrently. The merged listing keeps the order of the indexes, and within each
 * index the order of its page. If two indexes list a file with the same name, the first index wins.</li>
 * <li>The returned future completes with a {@link ProjectNotFoundException} if every index reports the project as
 * missing.</li>
 * <li>It completes with an {@link IndexUnavailableException} if no index answered and at least one index
 * was unreachable.</li>
 * <li>Otherwise unreachable indexes are logged and skipped.</li>
 * </ul>
 */
public class IndexNegotiator {
    @NotNull
    private final List<PackageIndex> indexes = new ArrayList<>();
    @NotNull
    private final Set<String> indexIds = new HashSet<>();

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public IndexNegotiator addIndex(@NotNull PackageIndex index) {
        if (this.indexIds.add(index.getIndexId())) {
            this.indexes.add(index);
        } else {
            throw new IllegalStateException("There is already an index with the id \"" + index.getIndexId() + "\" registered!");
        }
        return this;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull PackageIndex> getIndexes() {
        return Collections.unmodifiableList(this.indexes);
    }

    @NotNull
    public CompletableFuture<List<IndexAttachedValue<DistributionLink>>> getProjectPage(@NotNull String normalizedName, @NotNull Executor executor) {
        if (this.indexes.isEmpty()) {
            CompletableFuture<List<IndexAttachedValue<DistributionLink>>> failed = new CompletableFuture<>();
            failed.completeExceptionally(new ProjectNotFoundException(normalizedName, null));
            return failed;
        }

        List<CompletableFuture<IndexAttachedValue<List<DistributionLink>>>> futures = new ArrayList<>();
        for (PackageIndex index : this.indexes) {
            futures.add(index.getProjectPage(normalizedName, executor));
        }
        StronglyMultiCompletableFuture<IndexAttachedValue<List<DistributionLink>>> combined = new StronglyMultiCompletableFuture<>(futures);

        CompletableFuture<List<IndexAttachedValue<DistributionLink>>> result = combined.handle((pages, ex) -> {
            List<Throwable> failures = combined.getFailures();
            for (Throwable failure : failures) {
                if (failure instanceof CancellationException) {
                    throw (CancellationException) failure;
                }
            }
            if (ex != null) {
                IndexUnavailableException unavailable = null;
                for (Throwable failure : failures) {
                    if (failure instanceof IndexUnavailableException) {
                        if (unavailable == null) {
                            unavailable = (IndexUnavailableException) failure;
                        } else {
                            unavailable.addSuppressed(failure);
                        }
                    } else if (!(failure instanceof ProjectNotFoundException)) {
                        if (failure instanceof RuntimeException) {
                            throw (RuntimeException) failure;
                        }
                        throw new IndexUnavailableException("*", "the project page of '" + normalizedName + "'", 1, failure);
                    }
                }
                if (unavailable != null) {
                    throw unavailable;
                }
                throw new ProjectNotFoundException(normalizedName, null);
            }

            for (Throwable failure : failures) {
                if (!(failure instanceof ProjectNotFoundException)) {
                    LoggingAdapter.getDefaultLogger().warn(IndexNegotiator.class, "Skipping an index for project '{}' as it could not be queried: {}", normalizedName, failure.toString());
                }
            }

            List<IndexAttachedValue<DistributionLink>> merged = new ArrayList<>();
            Set<String> filenames = new HashSet<>();
            for (IndexAttachedValue<List<DistributionLink>> page : pages) {
                for (DistributionLink link : page.getValue()) {
                    if (filenames.add(link.getFilename())) {
                        merged.add(new IndexAttachedValue<>(page.getIndex(), link));
                    }
                }
            }
            return merged;
        });
        result.whenComplete((ignored, ex) -> {
            if (result.isCancelled()) {
                combined.cancel(true);
            }
        });
        return result;
    }
}
