package org.stianloader.pyresolve.marker;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when a marker expression refers to a variable that is not defined by PEP 508.
 * Such markers are rejected outright instead of silently evaluating to true or false.
 */
public class UnsupportedMarkerException extends PyResolveException {

    private static final long serialVersionUID = -1694370402633212085L;

    @NotNull
    private final String variable;

    public UnsupportedMarkerException(@NotNull String variable, @NotNull String marker) {
        super("Unsupported marker variable \"" + variable + "\" in marker \"" + marker + "\"");
        this.variable = variable;
    }

    @NotNull
    public String getVariable() {
        return this.variable;
    }
}
