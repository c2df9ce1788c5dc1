package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * Everything that is known about an identifier in a given resolution state: the requirements on it and the
 * candidates that were ruled out. Criteria are immutable, modifications produce new instances.
 */
public final class Criterion {
    @NotNull
    private final String identifier;
    @NotNull
    private final String name;
    @NotNull
    private final List<@NotNull RequirementInformation> information;
    @NotNull
    private final Set<@NotNull Candidate> excluded;

    Criterion(@NotNull String identifier, @NotNull String name, @NotNull List<@NotNull RequirementInformation> information, @NotNull Set<@NotNull Candidate> excluded) {
        this.identifier = identifier;
        this.name = name;
        this.information = Collections.unmodifiableList(information);
        this.excluded = Collections.unmodifiableSet(excluded);
    }

    @NotNull
    static Criterion of(@NotNull RequirementInformation information) {
        Requirement requirement = information.getRequirement();
        return new Criterion(requirement.getIdentifier(), requirement.getName(), Collections.singletonList(information), Collections.emptySet());
    }

    @NotNull
    @Contract(pure = true)
    Criterion excluding(@NotNull Candidate candidate) {
        Set<Candidate> excluded = new HashSet<>(this.excluded);
        excluded.add(candidate);
        return new Criterion(this.identifier, this.name, new ArrayList<>(this.information), excluded);
    }

    /**
     * Obtains the candidates that were ruled out for this identifier because every resolution containing them failed.
     *
     * @return The excluded candidates
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull Candidate> getExcluded() {
        return this.excluded;
    }

    @NotNull
    @Contract(pure = true)
    public String getIdentifier() {
        return this.identifier;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull RequirementInformation> getInformation() {
        return this.information;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getRequirements() {
        List<Requirement> requirements = new ArrayList<>();
        for (RequirementInformation info : this.information) {
            requirements.add(info.getRequirement());
        }
        return requirements;
    }

    /**
     * Whether any requirement pins an exact version, which admits yanked files.
     *
     * @return True if there is an exact pin
     */
    @Contract(pure = true)
    public boolean isExact() {
        for (RequirementInformation info : this.information) {
            if (info.getRequirement().getSpecifier().isExact()) {
                return true;
            }
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    Criterion merged(@NotNull RequirementInformation information) {
        if (this.information.contains(information)) {
            return this;
        }
        List<RequirementInformation> merged = new ArrayList<>(this.information);
        merged.add(information);
        return new Criterion(this.identifier, this.name, merged, new HashSet<>(this.excluded));
    }

    @Override
    public String toString() {
        return "Criterion[" + this.identifier + ", " + this.information + ", excluded=" + this.excluded.size() + "]";
    }
}
