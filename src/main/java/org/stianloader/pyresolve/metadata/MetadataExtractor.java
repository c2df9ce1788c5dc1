package org.stianloader.pyresolve.metadata;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.resolver.Candidate;

/**
 * Obtains the core metadata of a candidate distribution.
 */
public interface MetadataExtractor {

    /**
     * Extracts the metadata of a candidate. Extras of the candidate are ignored, the metadata is that of
     * the distribution file.
     *
     * <p>The returned future completes with a {@link MetadataUnavailableException} if the metadata cannot be
     * determined statically, and with an {@link org.stianloader.pyresolve.repo.IndexUnavailableException} if the
     * index could not serve the necessary files.
     *
     * @param candidate The candidate
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes with the metadata
     */
    @NotNull
    CompletableFuture<CoreMetadata> extract(@NotNull Candidate candidate, @NotNull Executor executor);
}
