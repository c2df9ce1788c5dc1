package org.stianloader.pyresolve.resolver;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when the requirements cannot be satisfied by any combination of candidates.
 */
public class ResolutionConflictException extends PyResolveException {

    private static final long serialVersionUID = 7731092254478962118L;

    @NotNull
    private final transient Conflict conflict;

    public ResolutionConflictException(@NotNull Conflict conflict) {
        super("Dependency conflict: " + conflict);
        this.conflict = conflict;
    }

    @NotNull
    public Conflict getConflict() {
        return this.conflict;
    }
}
