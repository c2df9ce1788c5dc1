package org.stianloader.pyresolve.version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A conjunction of {@link VersionSpecifier version clauses}, as written in a requirement such as
 * <code>requests&gt;=2.0,!=2.1.0,&lt;3</code>.
 *
 * <p>Intersecting two specifier sets never fails, even if no version can satisfy both of them.
 * Such an empty intersection only becomes a problem when the resolver tries to select a candidate.
 */
public final class SpecifierSet {

    /**
     * The set without any clauses, accepting every (final) version.
     */
    @NotNull
    public static final SpecifierSet ANY = new SpecifierSet(Collections.emptyList());

    @NotNull
    private final List<@NotNull VersionSpecifier> specifiers;

    private SpecifierSet(@NotNull List<@NotNull VersionSpecifier> specifiers) {
        this.specifiers = specifiers;
    }

    @NotNull
    public static SpecifierSet of(@NotNull Collection<@NotNull VersionSpecifier> specifiers) {
        if (specifiers.isEmpty()) {
            return SpecifierSet.ANY;
        }
        // Duplicate clauses carry no meaning, but the order of the remaining ones is retained
        return new SpecifierSet(Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(specifiers))));
    }

    /**
     * Parses a comma separated list of version clauses. The empty string yields {@link #ANY}.
     *
     * @param text The clauses
     * @return The parsed set
     * @throws InvalidVersionException If any of the clauses is invalid
     */
    @NotNull
    public static SpecifierSet parse(@NotNull String text) {
        if (text.trim().isEmpty()) {
            return SpecifierSet.ANY;
        }
        List<VersionSpecifier> specifiers = new ArrayList<>();
        for (String clause : text.split(",")) {
            if (clause.trim().isEmpty()) {
                throw new InvalidVersionException(text, "Empty version clause");
            }
            specifiers.add(VersionSpecifier.parse(clause));
        }
        return SpecifierSet.of(specifiers);
    }

    /**
     * Checks whether a version satisfies all clauses.
     *
     * @param version The version to check
     * @param prereleases Whether pre-releases are admitted. If null, they are admitted only if one of the
     * clauses explicitly opts into them.
     * @return True if the version is admitted
     */
    @Contract(pure = true)
    public boolean contains(@NotNull PythonVersion version, @Nullable Boolean prereleases) {
        boolean allowPre = prereleases == null ? this.isPrereleaseOptIn() : prereleases;
        if (!allowPre && version.isPrerelease()) {
            return false;
        }
        return this.containsIgnoringPrereleases(version);
    }

    @Contract(pure = true)
    public boolean containsIgnoringPrereleases(@NotNull PythonVersion version) {
        for (VersionSpecifier specifier : this.specifiers) {
            if (!specifier.contains(version)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SpecifierSet && new LinkedHashSet<>(((SpecifierSet) obj).specifiers).equals(new LinkedHashSet<>(this.specifiers));
    }

    /**
     * Filters the given versions, retaining their order. Unless pre-releases are explicitly disallowed,
     * pre-releases are returned if no final release matches, as PEP 440 mandates.
     *
     * @param <T> The element type
     * @param elements The elements to filter
     * @param versionOf Extracts the version of an element
     * @param prereleases Whether pre-releases are admitted. Null to decide automatically.
     * @return The admitted elements
     */
    @NotNull
    public <T> List<T> filter(@NotNull Iterable<T> elements, @NotNull Function<T, PythonVersion> versionOf, @Nullable Boolean prereleases) {
        boolean allowPre = prereleases == null ? this.isPrereleaseOptIn() : prereleases;
        List<T> accepted = new ArrayList<>();
        List<T> prereleaseOnly = new ArrayList<>();
        for (T element : elements) {
            PythonVersion version = versionOf.apply(element);
            if (!this.containsIgnoringPrereleases(version)) {
                continue;
            }
            if (version.isPrerelease() && !allowPre) {
                prereleaseOnly.add(element);
            } else {
                accepted.add(element);
            }
        }
        if (accepted.isEmpty() && prereleases == null) {
            return prereleaseOnly;
        }
        return accepted;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull VersionSpecifier> getSpecifiers() {
        return this.specifiers;
    }

    @Override
    public int hashCode() {
        return new LinkedHashSet<>(this.specifiers).hashCode();
    }

    @NotNull
    @Contract(pure = true)
    public SpecifierSet intersect(@NotNull SpecifierSet other) {
        if (this.specifiers.isEmpty()) {
            return other;
        } else if (other.specifiers.isEmpty()) {
            return this;
        }
        Set<VersionSpecifier> merged = new LinkedHashSet<>(this.specifiers);
        merged.addAll(other.specifiers);
        return SpecifierSet.of(new ArrayList<>(merged));
    }

    /**
     * Whether any clause pins exactly one version.
     *
     * @return True if an exact clause is present
     */
    @Contract(pure = true)
    public boolean isExact() {
        for (VersionSpecifier specifier : this.specifiers) {
            if (specifier.isExact()) {
                return true;
            }
        }
        return false;
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.specifiers.isEmpty();
    }

    @Contract(pure = true)
    public boolean isPrereleaseOptIn() {
        for (VersionSpecifier specifier : this.specifiers) {
            if (specifier.isPrereleaseOptIn()) {
                return true;
            }
        }
        return false;
    }

    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (VersionSpecifier specifier : this.specifiers) {
            if (builder.length() != 0) {
                builder.append(',');
            }
            builder.append(specifier);
        }
        return builder.toString();
    }
}
