package org.stianloader.pyresolve;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * Thrown when a local project declares a python requirement that the target environment does not meet.
 */
public class IncompatibleProjectException extends PyResolveException {

    private static final long serialVersionUID = -2978311085224706043L;

    @NotNull
    private final SpecifierSet requiresPython;

    public IncompatibleProjectException(@NotNull String project, @NotNull SpecifierSet requiresPython, @NotNull Environment environment) {
        super("Python " + environment.getPythonFullVersion() + " is not compatible with " + project + ", which requires python " + requiresPython);
        this.requiresPython = requiresPython;
    }

    @NotNull
    public SpecifierSet getRequiresPython() {
        return this.requiresPython;
    }
}
