package org.stianloader.pyresolve.requirement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The content of a pip style requirements file, with all includes flattened.
 */
public final class RequirementsDocument {
    @NotNull
    private final List<@NotNull Requirement> requirements;
    @NotNull
    private final List<@NotNull Requirement> constraints;
    @Nullable
    private final String indexUrl;
    @NotNull
    private final List<@NotNull String> extraIndexUrls;

    public RequirementsDocument(@NotNull List<@NotNull Requirement> requirements, @NotNull List<@NotNull Requirement> constraints,
            @Nullable String indexUrl, @NotNull List<@NotNull String> extraIndexUrls) {
        this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        this.indexUrl = indexUrl;
        this.extraIndexUrls = Collections.unmodifiableList(new ArrayList<>(extraIndexUrls));
    }

    /**
     * Obtains the requirements from constraint files (<code>-c</code>). Constraints narrow the admissible versions of
     * a project but never cause a project to be resolved on their own.
     *
     * @return The constraints, in file order
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getConstraints() {
        return this.constraints;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getExtraIndexUrls() {
        return this.extraIndexUrls;
    }

    /**
     * Obtains the primary index URL, as set by the last <code>--index-url</code> option.
     *
     * @return The index URL, or null if the document does not override the primary index
     */
    @Nullable
    @Contract(pure = true)
    public String getIndexUrl() {
        return this.indexUrl;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getRequirements() {
        return this.requirements;
    }

    @Override
    public String toString() {
        return "RequirementsDocument[requirements=" + this.requirements + ", constraints=" + this.constraints
                + ", indexUrl=" + this.indexUrl + ", extraIndexUrls=" + this.extraIndexUrls + "]";
    }
}
