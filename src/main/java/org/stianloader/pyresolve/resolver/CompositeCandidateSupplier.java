package org.stianloader.pyresolve.resolver;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * Delegates to a direct URL supplier whenever any requirement of a project carries an URL, and to the
 * index supplier otherwise.
 */
public class CompositeCandidateSupplier implements CandidateSupplier {
    @NotNull
    private final CandidateSupplier indexSupplier;
    @NotNull
    private final CandidateSupplier directSupplier;

    public CompositeCandidateSupplier(@NotNull CandidateSupplier indexSupplier, @NotNull CandidateSupplier directSupplier) {
        this.indexSupplier = indexSupplier;
        this.directSupplier = directSupplier;
    }

    @Override
    @NotNull
    public CompletableFuture<CandidateSequence> listCandidates(@NotNull String name, @NotNull Collection<@NotNull Requirement> requirements) {
        for (Requirement requirement : requirements) {
            if (requirement.getUrl() != null) {
                return this.directSupplier.listCandidates(name, requirements);
            }
        }
        return this.indexSupplier.listCandidates(name, requirements);
    }
}
