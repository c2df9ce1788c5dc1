package org.stianloader.pyresolve.resolver;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * A requirement together with the candidate that introduced it.
 */
public final class RequirementInformation {
    @NotNull
    private final Requirement requirement;
    @Nullable
    private final Candidate parent;

    public RequirementInformation(@NotNull Requirement requirement, @Nullable Candidate parent) {
        this.requirement = Objects.requireNonNull(requirement, "requirement may not be null");
        this.parent = parent;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof RequirementInformation)) {
            return false;
        }
        RequirementInformation other = (RequirementInformation) obj;
        return this.requirement.equals(other.requirement) && Objects.equals(this.parent, other.parent);
    }

    /**
     * Obtains the candidate whose dependencies include the requirement.
     *
     * @return The parent, or null for root requirements
     */
    @Nullable
    @Contract(pure = true)
    public Candidate getParent() {
        return this.parent;
    }

    @NotNull
    @Contract(pure = true)
    public Requirement getRequirement() {
        return this.requirement;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.requirement, this.parent);
    }

    @Contract(pure = true)
    public boolean isRoot() {
        return this.parent == null;
    }

    @Override
    public String toString() {
        if (this.parent == null) {
            return this.requirement.getText() + " (from the root requirements)";
        }
        return this.requirement.getText() + " (from " + this.parent.getIdentifier() + " " + this.parent.getVersion() + ")";
    }
}
