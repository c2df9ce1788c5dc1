package org.stianloader.pyresolve;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Root of all exceptions deliberately thrown by pyresolve.
 *
 * <p>The exceptions are unchecked as most of them travel through {@link java.util.concurrent.CompletableFuture}
 * pipelines before they reach the caller. Parse-level exceptions abort a resolution run, while exceptions concerning
 * a single candidate are generally absorbed by the resolution engine and only escalate into a conflict if no
 * alternative remains.
 */
public class PyResolveException extends RuntimeException {

    private static final long serialVersionUID = 6139127455231786025L;

    public PyResolveException(@NotNull String message) {
        super(message);
    }

    public PyResolveException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
