package org.stianloader.pyresolve.metadata;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when the dependency metadata of a distribution cannot be determined without running its build backend,
 * or when the metadata that was found contradicts the distribution's file name.
 */
public class MetadataUnavailableException extends PyResolveException {

    private static final long serialVersionUID = -1460385315468810349L;

    @NotNull
    private final String distribution;

    public MetadataUnavailableException(@NotNull String distribution, @NotNull String message) {
        this(distribution, message, null);
    }

    public MetadataUnavailableException(@NotNull String distribution, @NotNull String message, @Nullable Throwable cause) {
        super("Metadata of " + distribution + " is unavailable: " + message, cause);
        this.distribution = distribution;
    }

    /**
     * Obtains the file name of the distribution whose metadata could not be obtained.
     *
     * @return The distribution file name
     */
    @NotNull
    public String getDistribution() {
        return this.distribution;
    }
}
