package org.stianloader.pyresolve.resolver;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.PackageIndex;
import org.stianloader.pyresolve.version.PythonVersion;

/**
 * A concrete distribution file of a project version that may be chosen to satisfy a requirement.
 *
 * <p>Two candidates are equal if they share name, version, {@link SourceKind kind}, origin (index listing or
 * direct URL) and extras. The file that backs a candidate is not part of its identity: different wheels of the
 * same version are interchangeable, so once one of them is ruled out the version is ruled out for that kind
 * of distribution.
 *
 * <p>A candidate with extras stands for the same distribution with the dependencies of these extras
 * enabled. It is tracked under its own identifier (see {@link #getIdentifier()}) and depends on
 * the same version of its {@link #getBase() base candidate}.
 */
public final class Candidate {
    @NotNull
    private final String name;
    @NotNull
    private final PythonVersion version;
    @NotNull
    private final DistributionLink link;
    @NotNull
    private final PackageIndex index;
    @NotNull
    private final SourceKind kind;
    private final int tagPriority;
    private final boolean direct;
    @NotNull
    private final SortedSet<@NotNull String> extras;

    public Candidate(@NotNull String name, @NotNull PythonVersion version, @NotNull DistributionLink link, @NotNull PackageIndex index,
            int tagPriority, boolean direct) {
        this(PackageNames.normalize(name), version, link, index, link.isWheel() ? SourceKind.WHEEL : SourceKind.SDIST, tagPriority, direct, Collections.emptySortedSet());
    }

    private Candidate(@NotNull String name, @NotNull PythonVersion version, @NotNull DistributionLink link, @NotNull PackageIndex index,
            @NotNull SourceKind kind, int tagPriority, boolean direct, @NotNull SortedSet<@NotNull String> extras) {
        this.name = name;
        this.version = Objects.requireNonNull(version, "version may not be null");
        this.link = Objects.requireNonNull(link, "link may not be null");
        this.index = Objects.requireNonNull(index, "index may not be null");
        this.kind = kind;
        this.tagPriority = tagPriority;
        this.direct = direct;
        this.extras = extras;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof Candidate)) {
            return false;
        }
        Candidate other = (Candidate) obj;
        return this.name.equals(other.name) && this.version.equals(other.version)
                && this.kind == other.kind && this.direct == other.direct && this.extras.equals(other.extras);
    }

    /**
     * Obtains the same candidate without any extras.
     *
     * @return The base candidate, or this instance if it has no extras
     */
    @NotNull
    @Contract(pure = true)
    public Candidate getBase() {
        if (this.extras.isEmpty()) {
            return this;
        }
        return new Candidate(this.name, this.version, this.link, this.index, this.kind, this.tagPriority, this.direct, Collections.emptySortedSet());
    }

    @NotNull
    @Contract(pure = true)
    public SortedSet<@NotNull String> getExtras() {
        return this.extras;
    }

    @NotNull
    @Contract(pure = true)
    public String getFilename() {
        return this.link.getFilename();
    }

    @NotNull
    @Contract(pure = true)
    public String getIdentifier() {
        if (this.extras.isEmpty()) {
            return this.name;
        }
        return this.name + '[' + String.join(",", this.extras) + ']';
    }

    /**
     * Obtains the index that served the distribution. Distribution files and core metadata are fetched from it.
     *
     * @return The index
     */
    @NotNull
    @Contract(pure = true)
    public PackageIndex getIndex() {
        return this.index;
    }

    @NotNull
    @Contract(pure = true)
    public SourceKind getKind() {
        return this.kind;
    }

    @NotNull
    @Contract(pure = true)
    public DistributionLink getLink() {
        return this.link;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    /**
     * Obtains the download URL of the distribution, without any hash fragment.
     *
     * @return The URL
     */
    @NotNull
    @Contract(pure = true)
    public String getSourceUrl() {
        String url = this.link.getUrl();
        int fragment = url.indexOf('#');
        return fragment == -1 ? url : url.substring(0, fragment);
    }

    /**
     * Obtains the position of the best matching wheel tag in the environment's list of supported tags.
     * Lower values are better. Source distributions report {@link Integer#MAX_VALUE}.
     *
     * @return The tag priority
     */
    @Contract(pure = true)
    public int getTagPriority() {
        return this.tagPriority;
    }

    @NotNull
    @Contract(pure = true)
    public PythonVersion getVersion() {
        return this.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.version, this.kind, this.direct, this.extras);
    }

    /**
     * Whether the candidate originates from a direct URL reference instead of an index listing.
     *
     * @return True for direct URL candidates
     */
    @Contract(pure = true)
    public boolean isDirect() {
        return this.direct;
    }

    @Override
    public String toString() {
        return this.getIdentifier() + "==" + this.version + " (" + this.link.getFilename() + ")";
    }

    @NotNull
    @Contract(pure = true)
    public Candidate withExtras(@NotNull Collection<@NotNull String> extras) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String extra : extras) {
            normalized.add(PackageNames.normalize(extra));
        }
        if (normalized.equals(this.extras)) {
            return this;
        }
        return new Candidate(this.name, this.version, this.link, this.index, this.kind, this.tagPriority, this.direct, Collections.unmodifiableSortedSet(normalized));
    }
}
