package org.stianloader.pyresolve.metadata;

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.resolver.Candidate;

/**
 * Last resort for source distributions whose dependencies are not declared statically. Implementations
 * may, for example, interpret declarative build configuration. pyresolve never runs a build backend itself.
 */
public interface BuildMetadataHook {

    /**
     * Derives the metadata of a source distribution.
     *
     * @param candidate The source distribution candidate
     * @param projectFiles The top-level project files of the archive (such as <code>setup.cfg</code>,
     * <code>setup.py</code> and <code>pyproject.toml</code>), keyed by their path relative to the project root
     * @return The metadata, or null if this hook cannot determine it
     */
    @Nullable
    CoreMetadata buildMetadata(@NotNull Candidate candidate, @NotNull Map<@NotNull String, byte @NotNull[]> projectFiles);
}
