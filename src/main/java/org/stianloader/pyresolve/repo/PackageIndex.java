package org.stianloader.pyresolve.repo;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A source of distributions following the simple repository API (PEP 503 and PEP 691).
 *
 * <p>All operations are asynchronous and must not block the calling thread; blocking work is to be
 * performed on the supplied executor. Implementations apply their own retry policy, so a future that
 * completes exceptionally reports the final outcome of the request.
 */
public interface PackageIndex {

    /**
     * Obtains the listing of all files of a project.
     *
     * <ul>
     * <li>The returned future completes with a {@link ProjectNotFoundException} if the index definitely
     * does not know the project (HTTP 404 and other client errors).</li>
     * <li>It completes with an {@link IndexUnavailableException} if the index could not be reached within
     * the retry budget.</li>
     * <li>Cancelling the returned future aborts the underlying request.</li>
     * </ul>
     *
     * @param normalizedName The PEP 503 normalized project name
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes with the listed files, in the order the index lists them
     */
    @NotNull
    CompletableFuture<IndexAttachedValue<List<DistributionLink>>> getProjectPage(@NotNull String normalizedName, @NotNull Executor executor);

    /**
     * Fetches an arbitrary file served by the index, such as a distribution or a core metadata file.
     * A file that does not exist makes the future complete with a {@link java.io.FileNotFoundException}.
     *
     * @param url The absolute URL of the file, as listed on a project page
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future that completes with the contents of the file
     */
    @NotNull
    CompletableFuture<byte[]> getResource(@NotNull String url, @NotNull Executor executor);

    @NotNull
    @Contract(pure = true)
    String getIndexId();

    @NotNull
    @Contract(pure = true)
    String getPlaintextURL();
}
