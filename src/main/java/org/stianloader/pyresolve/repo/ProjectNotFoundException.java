package org.stianloader.pyresolve.repo;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PyResolveException;

/**
 * Thrown when an index (or every configured index) has no page for a project.
 * This is a definite answer of the index and is never retried.
 */
public class ProjectNotFoundException extends PyResolveException {

    private static final long serialVersionUID = 6342419980347413522L;

    @NotNull
    private final String projectName;
    @Nullable
    private final String indexId;

    public ProjectNotFoundException(@NotNull String projectName, @Nullable String indexId) {
        super(indexId == null
                ? "Project '" + projectName + "' does not exist in any configured index"
                : "Project '" + projectName + "' does not exist in index '" + indexId + "'");
        this.projectName = projectName;
        this.indexId = indexId;
    }

    /**
     * Obtains the id of the index that reported the project as missing.
     *
     * @return The index id, or null if all indexes were queried
     */
    @Nullable
    public String getIndexId() {
        return this.indexId;
    }

    @NotNull
    public String getProjectName() {
        return this.projectName;
    }
}
