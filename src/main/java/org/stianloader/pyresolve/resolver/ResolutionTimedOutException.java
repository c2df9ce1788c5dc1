package org.stianloader.pyresolve.resolver;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when a resolution run exceeds its round budget or its wall-clock budget.
 */
public class ResolutionTimedOutException extends PyResolveException {

    private static final long serialVersionUID = -3598457023961473811L;

    private final int rounds;

    public ResolutionTimedOutException(@NotNull String message, int rounds) {
        super(message + " (after " + rounds + " rounds)");
        this.rounds = rounds;
    }

    public int getRounds() {
        return this.rounds;
    }
}
