package org.stianloader.pyresolve;

import java.util.Locale;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Utilities for dealing with the names of Python projects.
 *
 * <p>Indexes, requirements and metadata spell project names inconsistently: "Foo_Bar", "foo-bar" and "foo.bar"
 * all denote the same project. Everything in pyresolve that compares project names (or extra names) does so
 * using the PEP 503 normalized form returned by {@link #normalize(String)}.
 */
public final class PackageNames {

    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[-_.]+");
    private static final Pattern VALID_NAME = Pattern.compile("^([A-Z0-9]|[A-Z0-9][A-Z0-9._-]*[A-Z0-9])$", Pattern.CASE_INSENSITIVE);

    @Contract(pure = true)
    public static boolean isValid(@NotNull String name) {
        return PackageNames.VALID_NAME.matcher(name).matches();
    }

    @NotNull
    @Contract(pure = true)
    public static String normalize(@NotNull String name) {
        return PackageNames.SEPARATOR_RUNS.matcher(name.trim()).replaceAll("-").toLowerCase(Locale.ROOT);
    }

    private PackageNames() {
        throw new UnsupportedOperationException();
    }
}
