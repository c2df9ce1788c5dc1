package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A set of requirements on the same project that no candidate satisfies together.
 */
public final class Conflict {
    @NotNull
    private final String identifier;
    @NotNull
    private final List<@NotNull RequirementInformation> causes;

    public Conflict(@NotNull String identifier, @NotNull List<@NotNull RequirementInformation> causes) {
        this.identifier = identifier;
        this.causes = Collections.unmodifiableList(new ArrayList<>(causes));
    }

    /**
     * Obtains the requirements that could not be satisfied together, each with the candidate that introduced it.
     *
     * @return The causes
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull RequirementInformation> getCauses() {
        return this.causes;
    }

    @NotNull
    @Contract(pure = true)
    public String getIdentifier() {
        return this.identifier;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("No candidate of '").append(this.identifier).append("' satisfies");
        for (RequirementInformation cause : this.causes) {
            builder.append("\n  ").append(cause);
        }
        return builder.toString();
    }
}
