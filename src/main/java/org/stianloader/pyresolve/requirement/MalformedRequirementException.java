package org.stianloader.pyresolve.requirement;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when a requirement line (or the marker within it) does not follow the PEP 508 grammar.
 */
public class MalformedRequirementException extends PyResolveException {

    private static final long serialVersionUID = 2450591036961738283L;

    @NotNull
    private final String input;
    @NotNull
    private final String offendingText;

    public MalformedRequirementException(@NotNull String input, @NotNull String offendingText, @NotNull String message) {
        super(message + " near \"" + offendingText + "\" in \"" + input + "\"");
        this.input = input;
        this.offendingText = offendingText;
    }

    /**
     * Obtains the complete text that failed to parse.
     *
     * @return The input text
     */
    @NotNull
    public String getInput() {
        return this.input;
    }

    /**
     * Obtains the part of the input at which parsing failed.
     *
     * @return The offending substring, possibly empty if the input ended prematurely
     */
    @NotNull
    public String getOffendingText() {
        return this.offendingText;
    }
}
