package org.stianloader.pyresolve.version;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when a version string or a version specifier does not follow the PEP 440 syntax.
 */
public class InvalidVersionException extends PyResolveException {

    private static final long serialVersionUID = -2712090281466232271L;

    @NotNull
    private final String input;

    public InvalidVersionException(@NotNull String input, @NotNull String message) {
        super(message + ": \"" + input + "\"");
        this.input = input;
    }

    /**
     * Obtains the string that could not be parsed.
     *
     * @return The offending input
     */
    @NotNull
    public String getInput() {
        return this.input;
    }
}
