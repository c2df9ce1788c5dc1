package org.stianloader.pyresolve.resolver;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * Determines the dependencies of a candidate in the target environment.
 */
public interface RequirementExpander {

    /**
     * Obtains the requirements of a candidate whose markers hold in the target environment, in declaration order.
     * For a candidate with extras, the result consists of an exact requirement on the base candidate's version,
     * followed by the requirements of the extras.
     *
     * @param candidate The candidate
     * @return A future that completes with the requirements, or with a
     * {@link org.stianloader.pyresolve.metadata.MetadataUnavailableException} if the dependencies are unknown
     */
    @NotNull
    CompletableFuture<List<Requirement>> expand(@NotNull Candidate candidate);
}
