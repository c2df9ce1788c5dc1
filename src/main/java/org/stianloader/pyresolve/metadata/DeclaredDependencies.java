package org.stianloader.pyresolve.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.version.PythonVersion;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * The dependencies that a build configuration file (<code>pyproject.toml</code>, <code>setup.cfg</code> or
 * <code>setup.py</code>) declares statically. Name and version are only known if the file states them literally.
 * Requirements of extras carry an <code>extra == "name"</code> marker, as they would in core metadata.
 */
public final class DeclaredDependencies {
    @NotNull
    private final String source;
    @Nullable
    private final String name;
    @Nullable
    private final PythonVersion version;
    @NotNull
    private final List<@NotNull Requirement> requirements;
    @NotNull
    private final List<@NotNull String> extras;
    @Nullable
    private final SpecifierSet requiresPython;

    public DeclaredDependencies(@NotNull String source, @Nullable String name, @Nullable PythonVersion version, @NotNull List<@NotNull Requirement> requirements,
            @NotNull List<@NotNull String> extras, @Nullable SpecifierSet requiresPython) {
        this.source = source;
        this.name = name;
        this.version = version;
        this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
        this.extras = Collections.unmodifiableList(new ArrayList<>(extras));
        this.requiresPython = requiresPython;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getExtras() {
        return this.extras;
    }

    @Nullable
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getRequirements() {
        return this.requirements;
    }

    @Nullable
    @Contract(pure = true)
    public SpecifierSet getRequiresPython() {
        return this.requiresPython;
    }

    /**
     * Obtains the name of the file the dependencies were read from.
     *
     * @return The file name, for example <code>setup.cfg</code>
     */
    @NotNull
    @Contract(pure = true)
    public String getSource() {
        return this.source;
    }

    @Nullable
    @Contract(pure = true)
    public PythonVersion getVersion() {
        return this.version;
    }

    /**
     * Converts the declaration into core metadata of a distribution, using the given name and version where the
     * declaration does not state them.
     *
     * @param fallbackName The project name of the distribution
     * @param fallbackVersion The version of the distribution
     * @return The metadata
     */
    @NotNull
    @Contract(pure = true)
    public CoreMetadata toCoreMetadata(@NotNull String fallbackName, @NotNull PythonVersion fallbackVersion) {
        String name = this.name == null ? fallbackName : this.name;
        PythonVersion version = this.version == null ? fallbackVersion : this.version;
        return new CoreMetadata("2.1", name, version, this.requirements, this.extras, this.requiresPython);
    }

    @Override
    public String toString() {
        return "DeclaredDependencies[" + this.source + ": " + this.requirements + "]";
    }
}
