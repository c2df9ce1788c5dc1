package org.stianloader.pyresolve.repo;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.marker.WheelFilename;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * A single file listed on the simple index page of a project.
 */
public final class DistributionLink {
    @NotNull
    private final String filename;
    @NotNull
    private final String url;
    @NotNull
    private final Map<@NotNull String, @NotNull String> hashes;
    @Nullable
    private final SpecifierSet requiresPython;
    private final boolean yanked;
    @Nullable
    private final String yankedReason;
    private final boolean coreMetadata;

    public DistributionLink(@NotNull String filename, @NotNull String url, @NotNull Map<@NotNull String, @NotNull String> hashes,
            @Nullable SpecifierSet requiresPython, boolean yanked, @Nullable String yankedReason, boolean coreMetadata) {
        this.filename = Objects.requireNonNull(filename, "filename may not be null");
        this.url = Objects.requireNonNull(url, "url may not be null");
        this.hashes = Collections.unmodifiableMap(new TreeMap<>(hashes));
        this.requiresPython = requiresPython;
        this.yanked = yanked;
        this.yankedReason = yankedReason;
        this.coreMetadata = coreMetadata;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof DistributionLink)) {
            return false;
        }
        DistributionLink other = (DistributionLink) obj;
        return this.url.equals(other.url) && this.filename.equals(other.filename);
    }

    @NotNull
    @Contract(pure = true)
    public String getFilename() {
        return this.filename;
    }

    /**
     * Obtains the hashes of the file, keyed by the lowercase hash algorithm name (e.g. "sha256").
     *
     * @return The hashes, possibly empty
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull String> getHashes() {
        return this.hashes;
    }

    /**
     * Obtains the URL of the separately served core metadata file (PEP 658), which is the
     * URL of the distribution (without fragment) with ".metadata" appended.
     *
     * @return The metadata URL, or null if the index does not serve the core metadata
     */
    @Nullable
    @Contract(pure = true)
    public String getMetadataUrl() {
        if (!this.coreMetadata) {
            return null;
        }
        int fragment = this.url.indexOf('#');
        return (fragment == -1 ? this.url : this.url.substring(0, fragment)) + ".metadata";
    }

    @Nullable
    @Contract(pure = true)
    public SpecifierSet getRequiresPython() {
        return this.requiresPython;
    }

    /**
     * Obtains the absolute URL of the file, including any hash fragment.
     *
     * @return The URL
     */
    @NotNull
    @Contract(pure = true)
    public String getUrl() {
        return this.url;
    }

    @Nullable
    @Contract(pure = true)
    public String getYankedReason() {
        return this.yankedReason;
    }

    @Contract(pure = true)
    public boolean hasCoreMetadata() {
        return this.coreMetadata;
    }

    @Override
    public int hashCode() {
        return this.url.hashCode();
    }

    @Contract(pure = true)
    public boolean isWheel() {
        return WheelFilename.isWheel(this.filename);
    }

    @Contract(pure = true)
    public boolean isYanked() {
        return this.yanked;
    }

    @Override
    public String toString() {
        return this.filename + (this.yanked ? " (yanked)" : "");
    }
}
