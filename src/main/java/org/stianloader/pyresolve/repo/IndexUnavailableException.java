package org.stianloader.pyresolve.repo;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when an index could not be reached after exhausting the retry budget.
 * The last failure is attached as the cause.
 */
public class IndexUnavailableException extends PyResolveException {

    private static final long serialVersionUID = -4107166457418770245L;

    @NotNull
    private final String indexId;
    private final int attempts;

    public IndexUnavailableException(@NotNull String indexId, @NotNull String resource, int attempts, @Nullable Throwable lastFailure) {
        super("Index '" + indexId + "' failed to serve " + resource + " after " + attempts + " attempt(s)", lastFailure);
        this.indexId = indexId;
        this.attempts = attempts;
    }

    public int getAttempts() {
        return this.attempts;
    }

    @NotNull
    public String getIndexId() {
        return this.indexId;
    }
}
