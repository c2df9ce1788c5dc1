package org.stianloader.pyresolve.resolver;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * Lists the candidates of a project that are installable in the target environment.
 */
public interface CandidateSupplier {

    /**
     * Lists the candidates of a project, best candidate first. Candidates that cannot be installed in the target
     * environment (incompatible wheel tags, excluded by <code>Requires-Python</code>) are not listed. Yanked files
     * are listed; it is up to the caller to only admit them for exact pins.
     *
     * <p>A project that no index knows completes with an empty sequence. Unreachable indexes complete the future
     * with an {@link org.stianloader.pyresolve.repo.IndexUnavailableException}.
     *
     * @param name The normalized project name
     * @param requirements The requirements currently known for the project, which may carry direct URLs
     * @return A future that completes with the candidates
     */
    @NotNull
    CompletableFuture<CandidateSequence> listCandidates(@NotNull String name, @NotNull Collection<@NotNull Requirement> requirements);
}
