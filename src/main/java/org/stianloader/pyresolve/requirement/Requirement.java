package org.stianloader.pyresolve.requirement;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.marker.Marker;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * A single PEP 508 dependency specifier such as <code>requests[socks]&gt;=2.8; python_version &gt;= "3.7"</code>.
 *
 * <p>Requirements are compared by their normalized name, extras, specifiers, marker and URL.
 * The original text and the display name are informational only.
 */
public final class Requirement {
    @NotNull
    private final String name;
    @NotNull
    private final String displayName;
    @NotNull
    private final SortedSet<@NotNull String> extras;
    @NotNull
    private final SpecifierSet specifier;
    @Nullable
    private final Marker marker;
    @Nullable
    private final String url;
    @NotNull
    private final String text;

    public Requirement(@NotNull String displayName, @NotNull Collection<@NotNull String> extras, @NotNull SpecifierSet specifier,
            @Nullable Marker marker, @Nullable String url, @Nullable String text) {
        this.displayName = Objects.requireNonNull(displayName, "displayName may not be null");
        this.name = PackageNames.normalize(displayName);
        TreeSet<String> normalizedExtras = new TreeSet<>();
        for (String extra : extras) {
            normalizedExtras.add(PackageNames.normalize(extra));
        }
        this.extras = Collections.unmodifiableSortedSet(normalizedExtras);
        this.specifier = Objects.requireNonNull(specifier, "specifier may not be null");
        this.marker = marker;
        this.url = url;
        this.text = text == null ? this.render() : text;
    }

    /**
     * Convenience factory for requirements without extras, marker or URL.
     *
     * @param name The project name
     * @param specifier The version specifiers
     * @return The requirement
     */
    @NotNull
    public static Requirement of(@NotNull String name, @NotNull SpecifierSet specifier) {
        return new Requirement(name, Collections.emptySet(), specifier, null, null, null);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof Requirement)) {
            return false;
        }
        Requirement other = (Requirement) obj;
        return this.name.equals(other.name)
                && this.extras.equals(other.extras)
                && this.specifier.equals(other.specifier)
                && Objects.equals(this.marker, other.marker)
                && Objects.equals(this.url, other.url);
    }

    @NotNull
    @Contract(pure = true)
    public String getDisplayName() {
        return this.displayName;
    }

    @NotNull
    @Contract(pure = true)
    public SortedSet<@NotNull String> getExtras() {
        return this.extras;
    }

    /**
     * Obtains the key under which the resolver tracks this requirement: the normalized name,
     * followed by the sorted extras in brackets if there are any.
     *
     * @return The identifier, for example <code>requests[security,socks]</code>
     */
    @NotNull
    @Contract(pure = true)
    public String getIdentifier() {
        if (this.extras.isEmpty()) {
            return this.name;
        }
        return this.name + '[' + String.join(",", this.extras) + ']';
    }

    @Nullable
    @Contract(pure = true)
    public Marker getMarker() {
        return this.marker;
    }

    /**
     * Obtains the PEP 503 normalized project name.
     *
     * @return The normalized name
     */
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public SpecifierSet getSpecifier() {
        return this.specifier;
    }

    @NotNull
    @Contract(pure = true)
    public String getText() {
        return this.text;
    }

    @Nullable
    @Contract(pure = true)
    public String getUrl() {
        return this.url;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.extras, this.specifier, this.marker, this.url);
    }

    /**
     * Checks whether the requirement applies to the given environment.
     *
     * @param environment The target environment
     * @param extra The extra that is being evaluated, or null
     * @return True if there is no marker or if the marker holds
     */
    public boolean isApplicable(@NotNull Environment environment, @Nullable String extra) {
        return this.marker == null || this.marker.evaluate(environment, extra);
    }

    public boolean isApplicable(@NotNull Environment environment, @NotNull Collection<@NotNull String> extras) {
        return this.marker == null || this.marker.evaluate(environment, extras);
    }

    @NotNull
    private String render() {
        StringBuilder builder = new StringBuilder(this.displayName);
        if (!this.extras.isEmpty()) {
            builder.append('[').append(String.join(",", this.extras)).append(']');
        }
        if (this.url != null) {
            builder.append(" @ ").append(this.url);
            if (this.marker != null) {
                builder.append(' ');
            }
        } else {
            builder.append(this.specifier);
        }
        if (this.marker != null) {
            builder.append("; ").append(this.marker);
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return this.text;
    }

    @NotNull
    @Contract(pure = true)
    public Requirement withExtras(@NotNull Collection<@NotNull String> extras) {
        return new Requirement(this.displayName, extras, this.specifier, this.marker, this.url, null);
    }

    /**
     * Derives a requirement for the same project without any extras. Used to tie an extra-carrying
     * identifier to the plain project.
     *
     * @return The requirement without extras
     */
    @NotNull
    @Contract(pure = true)
    public Requirement withoutExtras() {
        if (this.extras.isEmpty()) {
            return this;
        }
        return this.withExtras(Collections.emptySet());
    }

    @NotNull
    @Contract(pure = true)
    public Requirement withMarker(@Nullable Marker marker) {
        return new Requirement(this.displayName, this.extras, this.specifier, marker, this.url, null);
    }

    @NotNull
    @Contract(pure = true)
    public Requirement withSpecifier(@NotNull SpecifierSet specifier) {
        return new Requirement(this.displayName, this.extras, specifier, this.marker, this.url, null);
    }
}
